package com.glitchtrip;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WatermarkOverlayTest
{

	@Test
	void textSizeFollowsShorterSide()
	{
		assertEquals(16f, WatermarkOverlay.textSize(200, 400), 1e-4f);
		assertEquals(1f, WatermarkOverlay.textSize(4, 4), "Never smaller than one pixel");
	}

	@Test
	void textWidthCoversAllGlyphs()
	{
		// 8 glyphs of 6 cells minus the trailing gap, cells are size / 7
		assertEquals(47f * 16f / 7f, WatermarkOverlay.textWidth(16f), 1e-3f);
	}

	@Test
	void stampTintsPixelsPink()
	{
		PixelBuffer src = PixelBuffer.filled(200, 200, 0xFF000000);

		PixelBuffer out = WatermarkOverlay.apply(src);

		// inside the top bar of the first 'S'
		int p = out.get(5, 4);
		assertEquals(255, PixelBuffer.alpha(p));
		assertTrue(PixelBuffer.red(p) >= 85 && PixelBuffer.red(p) <= 95, "red " + PixelBuffer.red(p));
		assertTrue(PixelBuffer.red(p) > PixelBuffer.blue(p));
		assertTrue(PixelBuffer.blue(p) > PixelBuffer.green(p));
	}

	@Test
	void areaAboveFirstRowIsUntouched()
	{
		PixelBuffer src = PixelBuffer.filled(200, 200, 0xFF000000);

		PixelBuffer out = WatermarkOverlay.apply(src);

		for (int x = 0; x < 200; x++)
		{
			assertEquals(0xFF000000, out.get(x, 0));
			assertEquals(0xFF000000, out.get(x, 1));
		}
	}

	@Test
	void repeatsAcrossTheImage()
	{
		PixelBuffer src = PixelBuffer.filled(400, 400, 0xFF000000);

		PixelBuffer out = WatermarkOverlay.apply(src);

		int tinted = 0;
		for (int y = 300; y < 400; y++)
		{
			for (int x = 300; x < 400; x++)
			{
				if (out.get(x, y) != 0xFF000000) tinted++;
			}
		}
		assertTrue(tinted > 100, "Lower-right corner carries stamps too");
	}

	@Test
	void tinyImageKeepsSizeAndSource()
	{
		PixelBuffer src = PixelBuffer.filled(4, 3, 0xFF336699);
		int[] before = src.toArray();

		PixelBuffer out = WatermarkOverlay.apply(src);

		assertEquals(4, out.width());
		assertEquals(3, out.height());
		assertArrayEquals(before, src.toArray());
	}
}
