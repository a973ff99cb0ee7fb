package com.glitchtrip;

import java.util.List;

/**
 * Swirls the image around each attractor. For every output pixel the
 * tangential displacements of all attractors are summed and the input is
 * sampled at the displaced position (a pull warp, so there are no holes).
 */
final class WaveDisplacer
{

	static final double EPSILON = 1e-3;
	static final float MIN_AMPLITUDE = 1f;
	static final float MIN_WAVELENGTH = 6f;
	static final float WAVELENGTH_BASE = 120f;

	private WaveDisplacer()
	{
	}

	static boolean isNoOp(float amplitude, float frequency, List<AttractorPoint> attractors)
	{
		// negated comparisons so NaN also disables the stage
		return !(amplitude >= MIN_AMPLITUDE) || !(frequency > 0f) || attractors.isEmpty();
	}

	static PixelBuffer apply(PixelBuffer src, float amplitude, float frequency, List<AttractorPoint> attractors)
	{
		if (isNoOp(amplitude, frequency, attractors))
		{
			return src;
		}

		int w = src.width();
		int h = src.height();
		int[] in = src.pixels();
		int[] out = new int[in.length];

		int count = attractors.size();
		double[] ox = new double[count];
		double[] oy = new double[count];
		for (int i = 0; i < count; i++)
		{
			ox[i] = attractors.get(i).toPixelX(w);
			oy[i] = attractors.get(i).toPixelY(h);
		}
		double wavelength = Math.max(MIN_WAVELENGTH, WAVELENGTH_BASE / (1f + frequency));

		RowWorkers.forEachRow(w, h, y -> {
			for (int x = 0; x < w; x++)
			{
				double dx = 0;
				double dy = 0;
				for (int i = 0; i < count; i++)
				{
					double rx = x - ox[i];
					double ry = y - oy[i];
					double r = Math.sqrt(rx * rx + ry * ry);
					double a = amplitude * Math.sin(r / wavelength);
					dx += -ry / (r + EPSILON) * a;
					dy += rx / (r + EPSILON) * a;
				}
				int sx = sampleIndex(x + dx, w);
				int sy = sampleIndex(y + dy, h);
				out[y * w + x] = in[sy * w + sx];
			}
		});
		return new PixelBuffer(w, h, out);
	}

	/** Rounds and clamps a sample coordinate; non-finite values land on the border. */
	static int sampleIndex(double coordinate, int size)
	{
		if (Double.isNaN(coordinate)) return 0;
		if (coordinate <= 0) return 0;
		if (coordinate >= size - 1) return size - 1;
		return (int) Math.round(coordinate);
	}
}
