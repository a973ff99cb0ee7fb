package com.glitchtrip;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Packed ARGB raster (8 bits per channel, straight alpha). The pixel at (x, y)
 * lives at index {@code y * width + x}.
 */
public final class PixelBuffer
{

	private final int width;
	private final int height;
	private final int[] pixels;

	public PixelBuffer(int width, int height, int[] pixels)
	{
		if (width < 0 || height < 0)
		{
			throw new IllegalArgumentException("Negative dimensions: " + width + "x" + height);
		}
		if (pixels == null || pixels.length != (long) width * height)
		{
			throw new IllegalArgumentException("Pixel array length "
					+ (pixels == null ? "null" : pixels.length)
					+ " does not match " + width + "x" + height);
		}
		this.width = width;
		this.height = height;
		this.pixels = pixels;
	}

	public PixelBuffer(int width, int height)
	{
		this(width, height, new int[Math.max(0, width) * Math.max(0, height)]);
	}

	public static PixelBuffer filled(int width, int height, int argb)
	{
		PixelBuffer buffer = new PixelBuffer(width, height);
		Arrays.fill(buffer.pixels, argb);
		return buffer;
	}

	public static PixelBuffer fromImage(BufferedImage image)
	{
		int w = image.getWidth();
		int h = image.getHeight();
		int[] data = new int[w * h];
		image.getRGB(0, 0, w, h, data, 0, w);
		return new PixelBuffer(w, h, data);
	}

	public BufferedImage toImage()
	{
		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		image.setRGB(0, 0, width, height, pixels, 0, width);
		return image;
	}

	public int width()
	{
		return width;
	}

	public int height()
	{
		return height;
	}

	public boolean isEmpty()
	{
		return width <= 0 || height <= 0;
	}

	/** Backing array; stages write into buffers they allocated themselves. */
	int[] pixels()
	{
		return pixels;
	}

	public int get(int x, int y)
	{
		return pixels[y * width + x];
	}

	public void set(int x, int y, int argb)
	{
		pixels[y * width + x] = argb;
	}

	public int[] toArray()
	{
		return pixels.clone();
	}

	public PixelBuffer copy()
	{
		return new PixelBuffer(width, height, pixels.clone());
	}

	public boolean sameContent(PixelBuffer other)
	{
		return other != null && width == other.width && height == other.height
				&& Arrays.equals(pixels, other.pixels);
	}

	// --- channel helpers ---

	public static int alpha(int argb)
	{
		return (argb >>> 24) & 0xFF;
	}

	public static int red(int argb)
	{
		return (argb >> 16) & 0xFF;
	}

	public static int green(int argb)
	{
		return (argb >> 8) & 0xFF;
	}

	public static int blue(int argb)
	{
		return argb & 0xFF;
	}

	public static int argb(int a, int r, int g, int b)
	{
		return (clamp8(a) << 24) | (clamp8(r) << 16) | (clamp8(g) << 8) | clamp8(b);
	}

	static int clamp8(int v)
	{
		return v < 0 ? 0 : Math.min(v, 255);
	}

	static int clamp(int v, int lo, int hi)
	{
		return v < lo ? lo : Math.min(v, hi);
	}

	/** Clamps into [lo, hi]; NaN maps to {@code lo}. */
	static float clamp(float v, float lo, float hi)
	{
		if (!(v >= lo)) return lo;
		return Math.min(v, hi);
	}

	@Override
	public String toString()
	{
		return "PixelBuffer[" + width + "x" + height + "]";
	}
}
