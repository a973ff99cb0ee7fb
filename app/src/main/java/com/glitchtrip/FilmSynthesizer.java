package com.glitchtrip;

import java.util.Random;

/**
 * Darkened scanlines on even rows, then luminance-neutral grain: one random
 * offset per pixel added equally to red, green and blue.
 */
final class FilmSynthesizer
{

	static final float SCANLINE_ALPHA_SCALE = 40f;
	static final float NOISE_SCALE = 60f;

	private FilmSynthesizer()
	{
	}

	static int scanlineAlpha(float strength)
	{
		return PixelBuffer.clamp(Math.round(PixelBuffer.clamp(strength, 0f, 1f) * SCANLINE_ALPHA_SCALE), 0, 255);
	}

	static int noiseScale(float amount)
	{
		return Math.round(PixelBuffer.clamp(amount, 0f, 1f) * NOISE_SCALE);
	}

	static PixelBuffer apply(PixelBuffer src, float scanlineStrength, float noiseAmount, Random random)
	{
		int lineAlpha = scanlineAlpha(scanlineStrength);
		int nScale = noiseScale(noiseAmount);
		if (lineAlpha == 0 && nScale == 0)
		{
			return src;
		}

		int w = src.width();
		int h = src.height();
		int[] px = src.pixels().clone();

		if (lineAlpha > 0)
		{
			int keep = 255 - lineAlpha;
			for (int y = 0; y < h; y += 2)
			{
				for (int x = 0, i = y * w; x < w; x++, i++)
				{
					px[i] = darken(px[i], lineAlpha, keep);
				}
			}
		}

		if (nScale > 0)
		{
			int bound = nScale * 2 + 1;
			for (int i = 0; i < px.length; i++)
			{
				int p = px[i];
				int n = random.nextInt(bound) - nScale;
				px[i] = PixelBuffer.argb(PixelBuffer.alpha(p),
						PixelBuffer.red(p) + n,
						PixelBuffer.green(p) + n,
						PixelBuffer.blue(p) + n);
			}
		}
		return new PixelBuffer(w, h, px);
	}

	/** Black composited source-over at {@code lineAlpha}/255. */
	private static int darken(int p, int lineAlpha, int keep)
	{
		int a = Math.round(lineAlpha + PixelBuffer.alpha(p) * keep / 255f);
		int r = Math.round(PixelBuffer.red(p) * keep / 255f);
		int g = Math.round(PixelBuffer.green(p) * keep / 255f);
		int b = Math.round(PixelBuffer.blue(p) * keep / 255f);
		return PixelBuffer.argb(a, r, g, b);
	}
}
