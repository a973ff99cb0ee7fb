package com.glitchtrip;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * Runs the glitch stages in their fixed order:
 * channel split, attractor waves, block jitter, row sort, film, grading and,
 * in boost mode, the watermark. Large inputs are processed at a reduced working
 * width and scaled back to their original size at the end.
 */
public class GlitchEngine
{

	private static final Logger LOG = LoggerFactory.getLogger(GlitchEngine.class);

	public static final int DEFAULT_MAX_WORKING_WIDTH = 1600;

	private GlitchEngine()
	{
	}

	public static PixelBuffer applyAll(PixelBuffer source, GlitchParameters params) throws InvalidInputException
	{
		return applyAll(source, params, DEFAULT_MAX_WORKING_WIDTH);
	}

	public static PixelBuffer applyAll(PixelBuffer source, GlitchParameters params, int maxWorkingWidth)
			throws InvalidInputException
	{
		if (source == null)
		{
			throw new InvalidInputException("No source image");
		}
		if (source.isEmpty())
		{
			throw new InvalidInputException("Source image is empty: " + source.width() + "x" + source.height());
		}
		Objects.requireNonNull(params, "params");

		long started = System.nanoTime();
		int budget = maxWorkingWidth > 0 ? maxWorkingWidth : DEFAULT_MAX_WORKING_WIDTH;
		float scale = workingScale(source.width(), budget);
		boolean resized = Math.abs(scale - 1f) > 0.0001f;

		PixelBuffer bmp = source;
		if (resized)
		{
			int w = Math.max(1, (int) (source.width() * scale));
			int h = Math.max(1, (int) (source.height() * scale));
			bmp = BoxResampler.resample(source, w, h);
		}

		Random random = params.seed() != null ? new Random(params.seed()) : new Random();

		bmp = ChannelSplitter.apply(bmp, params.rgbShiftPixels() * scale, params.aberrationStrength());
		bmp = WaveDisplacer.apply(bmp, params.waveAmplitude() * scale, params.waveFrequency(), params.attractors());
		bmp = BlockJitter.apply(bmp, params.blockJitterSize(), random);
		bmp = RowPixelSorter.apply(bmp, params.pixelSortAmount());
		bmp = FilmSynthesizer.apply(bmp, params.scanlineStrength(), params.noiseAmount(), random);
		bmp = ColorGrader.apply(bmp, params.brightnessOffset(), params.effectiveSaturation(),
				params.effectiveHueDegrees(), params.contrastCrush());
		if (params.boostMode())
		{
			bmp = WatermarkOverlay.apply(bmp);
		}

		if (resized)
		{
			bmp = BoxResampler.resample(bmp, source.width(), source.height());
		}
		else if (bmp == source)
		{
			bmp = source.copy();
		}

		if (LOG.isDebugEnabled())
		{
			LOG.debug("Glitched {}x{} at working scale {} in {} ms",
					source.width(), source.height(), String.format("%.3f", scale),
					(System.nanoTime() - started) / 1_000_000);
		}
		return bmp;
	}

	static float workingScale(int width, int maxWorkingWidth)
	{
		return Math.min(1f, (float) maxWorkingWidth / width);
	}
}
