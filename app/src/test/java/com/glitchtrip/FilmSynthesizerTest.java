package com.glitchtrip;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FilmSynthesizerTest
{

	@Test
	void disabledStageReturnsInput()
	{
		PixelBuffer src = PixelBuffer.filled(4, 4, 0xFF808080);

		assertSame(src, FilmSynthesizer.apply(src, 0f, 0f, new Random(1)));
		assertSame(src, FilmSynthesizer.apply(src, 0.01f, 0.005f, new Random(1)), "Both round to zero");
	}

	@Test
	void scaleHelpers()
	{
		assertEquals(40, FilmSynthesizer.scanlineAlpha(1f));
		assertEquals(20, FilmSynthesizer.scanlineAlpha(0.5f));
		assertEquals(40, FilmSynthesizer.scanlineAlpha(5f));
		assertEquals(60, FilmSynthesizer.noiseScale(1f));
		assertEquals(0, FilmSynthesizer.noiseScale(-1f));
	}

	// --- Scanlines ---

	@Test
	void scanlinesDarkenEvenRowsOnly()
	{
		PixelBuffer src = PixelBuffer.filled(4, 4, 0xFFFFFFFF);

		PixelBuffer out = FilmSynthesizer.apply(src, 1f, 0f, new Random(1));

		for (int x = 0; x < 4; x++)
		{
			assertEquals(0xFFD7D7D7, out.get(x, 0));
			assertEquals(0xFFFFFFFF, out.get(x, 1));
			assertEquals(0xFFD7D7D7, out.get(x, 2));
			assertEquals(0xFFFFFFFF, out.get(x, 3));
		}
	}

	@Test
	void scanlinesAddCoverageToTransparentRows()
	{
		PixelBuffer src = PixelBuffer.filled(2, 2, 0x00000000);

		PixelBuffer out = FilmSynthesizer.apply(src, 1f, 0f, new Random(1));

		assertEquals(40, PixelBuffer.alpha(out.get(0, 0)));
		assertEquals(0, PixelBuffer.alpha(out.get(0, 1)));
	}

	// --- Grain ---

	@Test
	void grainIsLuminanceOnlyAndBounded()
	{
		PixelBuffer src = PixelBuffer.filled(32, 32, 0xFF808080);

		PixelBuffer out = FilmSynthesizer.apply(src, 0f, 1f, new Random(12));

		boolean varied = false;
		for (int p : out.toArray())
		{
			int r = PixelBuffer.red(p);
			assertEquals(r, PixelBuffer.green(p));
			assertEquals(r, PixelBuffer.blue(p));
			assertEquals(255, PixelBuffer.alpha(p));
			assertTrue(r >= 128 - 60 && r <= 128 + 60, "value " + r);
			varied |= r != 128;
		}
		assertTrue(varied);
	}

	@Test
	void grainClampsAtWhite()
	{
		PixelBuffer src = PixelBuffer.filled(16, 16, 0xFFFFFFFF);

		PixelBuffer out = FilmSynthesizer.apply(src, 0f, 1f, new Random(4));

		for (int p : out.toArray())
		{
			assertTrue(PixelBuffer.red(p) <= 255 && PixelBuffer.red(p) >= 195);
		}
	}

	@Test
	void sameRandomSameGrain()
	{
		PixelBuffer src = PixelBuffer.filled(16, 16, 0xFF445566);

		PixelBuffer a = FilmSynthesizer.apply(src, 0.5f, 0.5f, new Random(77));
		PixelBuffer b = FilmSynthesizer.apply(src, 0.5f, 0.5f, new Random(77));

		assertTrue(a.sameContent(b));
	}
}
