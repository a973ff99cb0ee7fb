package com.glitchtrip;

/**
 * Area-preserving resampling: every destination pixel is the coverage-weighted
 * average of the source pixels under its footprint. Works in both directions;
 * colors are averaged premultiplied so transparent pixels do not darken edges.
 */
final class BoxResampler
{

	private BoxResampler()
	{
	}

	static PixelBuffer resample(PixelBuffer src, int dstW, int dstH)
	{
		if (dstW <= 0 || dstH <= 0)
		{
			throw new IllegalArgumentException("Target size must be positive: " + dstW + "x" + dstH);
		}
		if (src.width() == dstW && src.height() == dstH)
		{
			return src.copy();
		}

		int srcW = src.width();
		int srcH = src.height();
		int[] in = src.pixels();

		// Premultiplied planes: a, r*a, g*a, b*a (all in 0..255 units)
		double[][] planes = new double[4][srcW * srcH];
		for (int i = 0; i < in.length; i++)
		{
			int p = in[i];
			double a = PixelBuffer.alpha(p);
			planes[0][i] = a;
			planes[1][i] = PixelBuffer.red(p) * a / 255.0;
			planes[2][i] = PixelBuffer.green(p) * a / 255.0;
			planes[3][i] = PixelBuffer.blue(p) * a / 255.0;
		}

		Footprint fx = Footprint.of(srcW, dstW);
		Footprint fy = Footprint.of(srcH, dstH);

		// Horizontal pass: srcW x srcH -> dstW x srcH
		double[][] horizontal = new double[4][dstW * srcH];
		for (int c = 0; c < 4; c++)
		{
			double[] from = planes[c];
			double[] to = horizontal[c];
			for (int y = 0; y < srcH; y++)
			{
				int rowIn = y * srcW;
				int rowOut = y * dstW;
				for (int x = 0; x < dstW; x++)
				{
					double sum = 0;
					int first = fx.first[x];
					double[] w = fx.weights[x];
					for (int k = 0; k < w.length; k++)
					{
						sum += from[rowIn + first + k] * w[k];
					}
					to[rowOut + x] = sum;
				}
			}
		}

		// Vertical pass: dstW x srcH -> dstW x dstH
		int[] out = new int[dstW * dstH];
		for (int y = 0; y < dstH; y++)
		{
			int first = fy.first[y];
			double[] w = fy.weights[y];
			for (int x = 0; x < dstW; x++)
			{
				double[] acc = new double[4];
				for (int c = 0; c < 4; c++)
				{
					double sum = 0;
					for (int k = 0; k < w.length; k++)
					{
						sum += horizontal[c][(first + k) * dstW + x] * w[k];
					}
					acc[c] = sum;
				}
				out[y * dstW + x] = unpremultiply(acc);
			}
		}
		return new PixelBuffer(dstW, dstH, out);
	}

	private static int unpremultiply(double[] acc)
	{
		double a = acc[0];
		if (a <= 0) return 0;
		int r = (int) Math.round(acc[1] * 255.0 / a);
		int g = (int) Math.round(acc[2] * 255.0 / a);
		int b = (int) Math.round(acc[3] * 255.0 / a);
		return PixelBuffer.argb((int) Math.round(a), r, g, b);
	}

	/** Per destination index: the first covered source index and the coverage weights. */
	private static final class Footprint
	{
		final int[] first;
		final double[][] weights;

		private Footprint(int[] first, double[][] weights)
		{
			this.first = first;
			this.weights = weights;
		}

		static Footprint of(int srcLen, int dstLen)
		{
			double ratio = (double) srcLen / dstLen;
			int[] first = new int[dstLen];
			double[][] weights = new double[dstLen][];
			for (int d = 0; d < dstLen; d++)
			{
				double start = d * ratio;
				double end = Math.min(srcLen, (d + 1) * ratio);
				int s0 = (int) Math.floor(start);
				int s1 = Math.min(srcLen, (int) Math.ceil(end));
				if (s1 <= s0) s1 = Math.min(srcLen, s0 + 1);
				double[] w = new double[s1 - s0];
				double total = 0;
				for (int s = s0; s < s1; s++)
				{
					double overlap = Math.min(s + 1, end) - Math.max(s, start);
					w[s - s0] = Math.max(0, overlap);
					total += w[s - s0];
				}
				if (total <= 0)
				{
					w[0] = 1;
					total = 1;
				}
				for (int k = 0; k < w.length; k++)
				{
					w[k] /= total;
				}
				first[d] = s0;
				weights[d] = w;
			}
			return new Footprint(first, weights);
		}
	}
}
