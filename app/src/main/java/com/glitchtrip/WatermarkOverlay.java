package com.glitchtrip;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.util.Map;

/**
 * Boost-mode stamp: a translucent pink text mark repeated across the image,
 * with every other row shifted left by half the text width.
 * <p>
 * Glyphs come from a small built-in 5x7 cell font so the result does not depend
 * on which system fonts the host has installed.
 */
final class WatermarkOverlay
{

	static final String TEXT = "SPAM ART";
	static final Color TINT = new Color(255, 64, 160, 90);
	static final float SIZE_FRACTION = 0.08f;

	private static final int GLYPH_W = 5;
	private static final int GLYPH_H = 7;
	private static final int ADVANCE = GLYPH_W + 1;

	private static final Map<Character, String[]> GLYPHS = Map.of(
			'S', new String[]{"01111", "10000", "10000", "01110", "00001", "00001", "11110"},
			'P', new String[]{"11110", "10001", "10001", "11110", "10000", "10000", "10000"},
			'A', new String[]{"01110", "10001", "10001", "11111", "10001", "10001", "10001"},
			'M', new String[]{"10001", "11011", "10101", "10101", "10001", "10001", "10001"},
			'R', new String[]{"11110", "10001", "10001", "11110", "10100", "10010", "10001"},
			'T', new String[]{"11111", "00100", "00100", "00100", "00100", "00100", "00100"}
	);

	private WatermarkOverlay()
	{
	}

	static float textSize(int w, int h)
	{
		return Math.max(1f, Math.min(w, h) * SIZE_FRACTION);
	}

	static float textWidth(float textSize)
	{
		float cell = textSize / GLYPH_H;
		return Math.max(1f, (TEXT.length() * ADVANCE - 1) * cell);
	}

	static PixelBuffer apply(PixelBuffer src)
	{
		int w = src.width();
		int h = src.height();
		float size = textSize(w, h);
		float textWidth = textWidth(size);
		float rowStep = size * 1.8f;

		BufferedImage canvas = src.toImage();
		Graphics2D g2d = canvas.createGraphics();
		try
		{
			g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
			g2d.setColor(TINT);

			boolean shifted = false;
			for (float baseline = size * 1.2f; baseline < h; baseline += rowStep)
			{
				for (float x = shifted ? -textWidth / 2f : 0f; x < w; x += textWidth * 1.5f)
				{
					g2d.fill(stamp(x, baseline, size));
				}
				shifted = !shifted;
			}
		}
		finally
		{
			g2d.dispose();
		}
		return PixelBuffer.fromImage(canvas);
	}

	/** One copy of the text as a single shape, so overlapping cells blend once. */
	private static Path2D stamp(float x, float baseline, float size)
	{
		float cell = size / GLYPH_H;
		float top = baseline - size;
		Path2D.Float path = new Path2D.Float();
		for (int c = 0; c < TEXT.length(); c++)
		{
			String[] rows = GLYPHS.get(TEXT.charAt(c));
			if (rows == null) continue;
			float left = x + c * ADVANCE * cell;
			for (int gy = 0; gy < GLYPH_H; gy++)
			{
				for (int gx = 0; gx < GLYPH_W; gx++)
				{
					if (rows[gy].charAt(gx) == '1')
					{
						float px = left + gx * cell;
						float py = top + gy * cell;
						path.moveTo(px, py);
						path.lineTo(px + cell, py);
						path.lineTo(px + cell, py + cell);
						path.lineTo(px, py + cell);
						path.closePath();
					}
				}
			}
		}
		return path;
	}
}
