package com.glitchtrip;

import java.util.List;

/**
 * Normalized location that bends the wave displacement field. Coordinates are
 * fractions of the current buffer size, so the same point survives resizing.
 */
public record AttractorPoint(float x, float y)
{
	public AttractorPoint
	{
		x = PixelBuffer.clamp(x, 0f, 1f);
		y = PixelBuffer.clamp(y, 0f, 1f);
	}

	public double toPixelX(int width)
	{
		return x * width;
	}

	public double toPixelY(int height)
	{
		return y * height;
	}

	public AttractorPoint moveBy(float dx, float dy)
	{
		return new AttractorPoint(x + dx, y + dy);
	}

	/**
	 * Index of the point closest to (x, y), or -1 for an empty list.
	 */
	public static int nearest(List<AttractorPoint> points, float x, float y)
	{
		int index = -1;
		float best = Float.MAX_VALUE;
		for (int i = 0; i < points.size(); i++)
		{
			float dx = points.get(i).x() - x;
			float dy = points.get(i).y() - y;
			float d = dx * dx + dy * dy;
			if (d < best)
			{
				best = d;
				index = i;
			}
		}
		return index;
	}
}
