package com.glitchtrip;

/**
 * Per-pixel grading in normalized RGB:
 * <ol>
 *     <li>brightness offset, clamped</li>
 *     <li>saturation scaled around the per-pixel channel mean</li>
 *     <li>hue "rotation" as a plane rotation of red and green (blue untouched)</li>
 *     <li>contrast crush pivoting on mid-gray</li>
 * </ol>
 * The hue step is deliberately not an HSV rotation; its look is part of the effect.
 */
final class ColorGrader
{

	private ColorGrader()
	{
	}

	static boolean isIdentity(float brightness, float saturation, float hueDegrees, float crush)
	{
		return brightness == 0f && saturation == 1f && hueDegrees == 0f && !(crush > 0f);
	}

	static PixelBuffer apply(PixelBuffer src, float brightness, float saturation, float hueDegrees, float crush)
	{
		float bright = finiteOr(brightness, 0f);
		float sat = Math.max(0f, finiteOr(saturation, 1f));
		float hue = finiteOr(hueDegrees, 0f);
		float k = crush > 0f ? 1f + 2f * PixelBuffer.clamp(crush, 0f, 1f) : 1f;
		boolean crushing = crush > 0f;
		if (isIdentity(bright, sat, hue, crush))
		{
			return src;
		}

		double theta = Math.toRadians(hue);
		float cos = (float) Math.cos(theta);
		float sin = (float) Math.sin(theta);

		int w = src.width();
		int h = src.height();
		int[] in = src.pixels();
		int[] out = new int[in.length];

		RowWorkers.forEachRow(w, h, y -> {
			for (int i = y * w, end = i + w; i < end; i++)
			{
				int p = in[i];
				float r = PixelBuffer.clamp(PixelBuffer.red(p) / 255f + bright, 0f, 1f);
				float g = PixelBuffer.clamp(PixelBuffer.green(p) / 255f + bright, 0f, 1f);
				float b = PixelBuffer.clamp(PixelBuffer.blue(p) / 255f + bright, 0f, 1f);

				float l = (r + g + b) / 3f;
				r = l + (r - l) * sat;
				g = l + (g - l) * sat;
				b = l + (b - l) * sat;

				float nr = r * cos - g * sin;
				float ng = r * sin + g * cos;
				r = PixelBuffer.clamp(nr, 0f, 1f);
				g = PixelBuffer.clamp(ng, 0f, 1f);

				if (crushing)
				{
					r = crush(r, k);
					g = crush(g, k);
					b = crush(b, k);
				}

				out[i] = (p & 0xFF000000) | (to8(r) << 16) | (to8(g) << 8) | to8(b);
			}
		});
		return new PixelBuffer(w, h, out);
	}

	static float crush(float x, float k)
	{
		return PixelBuffer.clamp(k * (x - 0.5f) + 0.5f, 0f, 1f);
	}

	static int to8(float v)
	{
		return Math.round(PixelBuffer.clamp(v, 0f, 1f) * 255f);
	}

	private static float finiteOr(float v, float fallback)
	{
		return Float.isFinite(v) ? v : fallback;
	}
}
