package com.glitchtrip;

import java.util.Arrays;

/**
 * Sorts runs of pixels on every even row by their packed ARGB value,
 * compared unsigned, leaving a small untouched gap between runs.
 */
final class RowPixelSorter
{

	static final float THRESHOLD = 0.01f;
	static final int BASE_RUN = 20;
	static final int RUN_PER_AMOUNT = 180;
	static final int GAP = 3;

	private RowPixelSorter()
	{
	}

	static int runLength(float amount)
	{
		return Math.round(BASE_RUN + PixelBuffer.clamp(amount, 0f, 1f) * RUN_PER_AMOUNT);
	}

	static PixelBuffer apply(PixelBuffer src, float amount)
	{
		if (!(amount > THRESHOLD))
		{
			return src;
		}

		int w = src.width();
		int h = src.height();
		int[] out = src.pixels().clone();
		int run = runLength(amount);

		for (int y = 0; y < h; y += 2)
		{
			int rowStart = y * w;
			int i = 0;
			while (i < w)
			{
				int seg = Math.min(run, w - i);
				sortUnsigned(out, rowStart + i, rowStart + i + seg);
				i += seg + GAP;
			}
		}
		return new PixelBuffer(w, h, out);
	}

	private static void sortUnsigned(int[] a, int from, int to)
	{
		// flipping the sign bit turns unsigned order into signed order
		for (int i = from; i < to; i++) a[i] ^= Integer.MIN_VALUE;
		Arrays.sort(a, from, to);
		for (int i = from; i < to; i++) a[i] ^= Integer.MIN_VALUE;
	}
}
