package com.glitchtrip;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class PixelBufferTest
{

	@Test
	void rejectsMismatchedArray()
	{
		assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(2, 2, new int[3]));
		assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(-1, 2, new int[0]));
		assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(2, 2, null));
	}

	@Test
	void zeroAreaIsEmpty()
	{
		assertTrue(new PixelBuffer(0, 5).isEmpty());
		assertTrue(new PixelBuffer(5, 0).isEmpty());
		assertFalse(new PixelBuffer(1, 1).isEmpty());
	}

	@Test
	void rasterIndexing()
	{
		PixelBuffer buffer = new PixelBuffer(3, 2, new int[]{0, 1, 2, 3, 4, 5});

		assertEquals(5, buffer.get(2, 1));
		buffer.set(0, 1, 42);
		assertEquals(42, buffer.toArray()[3]);
	}

	@Test
	void copyAndToArrayAreIndependent()
	{
		PixelBuffer buffer = PixelBuffer.filled(2, 2, 7);
		PixelBuffer copy = buffer.copy();
		int[] array = buffer.toArray();

		copy.set(0, 0, 1);
		array[1] = 1;

		assertEquals(7, buffer.get(0, 0));
		assertEquals(7, buffer.get(1, 0));
		assertFalse(buffer.sameContent(copy));
	}

	@Test
	void imageConversionKeepsAlpha()
	{
		PixelBuffer buffer = new PixelBuffer(2, 1, new int[]{0x80FF0000, 0xFF00FF00});

		BufferedImage image = buffer.toImage();
		PixelBuffer back = PixelBuffer.fromImage(image);

		assertEquals(BufferedImage.TYPE_INT_ARGB, image.getType());
		assertTrue(buffer.sameContent(back));
	}

	// --- channel helpers ---

	@Test
	void channelAccessors()
	{
		int p = 0x80C0A010;

		assertEquals(0x80, PixelBuffer.alpha(p));
		assertEquals(0xC0, PixelBuffer.red(p));
		assertEquals(0xA0, PixelBuffer.green(p));
		assertEquals(0x10, PixelBuffer.blue(p));
	}

	@Test
	void packingClampsChannels()
	{
		assertEquals(0xFFFF0000, PixelBuffer.argb(300, 256, -4, 0));
	}

	@Test
	void floatClampMapsNaNToLowerBound()
	{
		assertEquals(0f, PixelBuffer.clamp(Float.NaN, 0f, 1f));
		assertEquals(1f, PixelBuffer.clamp(Float.POSITIVE_INFINITY, 0f, 1f));
		assertEquals(0.25f, PixelBuffer.clamp(0.25f, 0f, 1f));
	}
}
