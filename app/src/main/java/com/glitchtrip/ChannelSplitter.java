package com.glitchtrip;

/**
 * Chromatic split: red and blue are pulled from diagonally opposite offsets
 * while green stays in place, then an optional slightly enlarged "ghost" of
 * the original is laid over the result.
 */
final class ChannelSplitter
{

	static final float GHOST_SCALE_PER_STRENGTH = 0.02f;
	static final float GHOST_ALPHA_PER_STRENGTH = 80f;

	private ChannelSplitter()
	{
	}

	static PixelBuffer apply(PixelBuffer src, float rgbShiftPixels, float aberrationStrength)
	{
		int shift = Math.round(PixelBuffer.clamp(rgbShiftPixels, 0f, 1_000_000f));
		float aberration = PixelBuffer.clamp(aberrationStrength, 0f, 1f);
		if (shift == 0 && aberration <= 0f)
		{
			return src;
		}

		int w = src.width();
		int h = src.height();
		int[] in = src.pixels();
		int[] out = shift == 0 ? in.clone() : split(in, w, h, shift);

		if (aberration > 0f)
		{
			overlayGhost(in, out, w, h, aberration);
		}
		return new PixelBuffer(w, h, out);
	}

	private static int[] split(int[] in, int w, int h, int shift)
	{
		int[] out = new int[in.length];
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int alpha = 0;
				int r = 0;
				int b = 0;

				// red copy translated by (+shift, -shift)
				int rx = x - shift;
				int ry = y + shift;
				if (rx >= 0 && rx < w && ry >= 0 && ry < h)
				{
					int p = in[ry * w + rx];
					r = PixelBuffer.red(p);
					alpha = PixelBuffer.alpha(p);
				}

				int pg = in[y * w + x];
				int g = PixelBuffer.green(pg);
				alpha = Math.max(alpha, PixelBuffer.alpha(pg));

				// blue copy translated by (-shift, +shift)
				int bx = x + shift;
				int by = y - shift;
				if (bx >= 0 && bx < w && by >= 0 && by < h)
				{
					int p = in[by * w + bx];
					b = PixelBuffer.blue(p);
					alpha = Math.max(alpha, PixelBuffer.alpha(p));
				}

				out[y * w + x] = (alpha << 24) | (r << 16) | (g << 8) | b;
			}
		}
		return out;
	}

	private static void overlayGhost(int[] original, int[] out, int w, int h, float aberration)
	{
		float scale = 1f + aberration * GHOST_SCALE_PER_STRENGTH;
		float opacity = PixelBuffer.clamp(aberration * GHOST_ALPHA_PER_STRENGTH / 255f, 0f, 1f);
		float cx = w / 2f;
		float cy = h / 2f;

		for (int y = 0; y < h; y++)
		{
			int sy = (int) Math.floor((y + 0.5f - cy) / scale + cy);
			if (sy < 0 || sy >= h) continue;
			for (int x = 0; x < w; x++)
			{
				int sx = (int) Math.floor((x + 0.5f - cx) / scale + cx);
				if (sx < 0 || sx >= w) continue;
				int i = y * w + x;
				out[i] = sourceOver(original[sy * w + sx], out[i], opacity);
			}
		}
	}

	static int sourceOver(int src, int dst, float opacity)
	{
		float sa = PixelBuffer.alpha(src) / 255f * opacity;
		if (sa <= 0f) return dst;
		float da = PixelBuffer.alpha(dst) / 255f;
		float outA = sa + da * (1f - sa);
		if (outA <= 0f) return 0;

		int r = Math.round((PixelBuffer.red(src) * sa + PixelBuffer.red(dst) * da * (1f - sa)) / outA);
		int g = Math.round((PixelBuffer.green(src) * sa + PixelBuffer.green(dst) * da * (1f - sa)) / outA);
		int b = Math.round((PixelBuffer.blue(src) * sa + PixelBuffer.blue(dst) * da * (1f - sa)) / outA);
		return PixelBuffer.argb(Math.round(outA * 255f), r, g, b);
	}
}
