package com.glitchtrip;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PresetTest
{

	@Test
	void secretPresetNeedsUnlock()
	{
		assertEquals(List.of(Preset.VHS, Preset.MOSH, Preset.PINK), Preset.available(false));
		assertEquals(List.of(Preset.VHS, Preset.MOSH, Preset.PINK, Preset.SPAMYETI), Preset.available(true));
	}

	@Test
	void toParametersCopiesEveryField()
	{
		GlitchParameters p = Preset.VHS.toParameters(false, 3L);

		assertEquals(4f, p.rgbShiftPixels());
		assertEquals(6, p.blockJitterSize());
		assertEquals(0.12f, p.noiseAmount());
		assertEquals(0.6f, p.scanlineStrength());
		assertEquals(4f, p.waveAmplitude());
		assertEquals(10f, p.waveFrequency());
		assertEquals(0f, p.pixelSortAmount());
		assertEquals(0.2f, p.aberrationStrength());
		assertEquals(0.1f, p.contrastCrush());
		assertEquals(1.0f, p.saturation());
		assertEquals(-4f, p.hueDegrees());
		assertEquals(0.05f, p.brightnessOffset());
		assertEquals(Preset.VHS.attractors(), p.attractors());
		assertEquals(3L, p.seed());
	}

	@Test
	void randomStaysInRanges()
	{
		Random rnd = new Random(1234);
		for (int i = 0; i < 200; i++)
		{
			Preset p = Preset.random(rnd);
			assertTrue(p.rgbShift() >= 0f && p.rgbShift() <= 20f);
			assertTrue(p.blockJitter() >= 0 && p.blockJitter() < 30);
			assertTrue(p.noise() >= 0f && p.noise() <= 0.5f);
			assertTrue(p.saturation() >= 0.6f && p.saturation() <= 1.8f);
			assertTrue(p.hue() >= -90f && p.hue() <= 90f);
			assertTrue(p.brightness() >= -0.2f && p.brightness() <= 0.2f);
			assertEquals(2, p.attractors().size());
			for (AttractorPoint a : p.attractors())
			{
				assertTrue(a.x() >= 0.1f && a.x() <= 0.9f);
				assertTrue(a.y() >= 0.1f && a.y() <= 0.9f);
			}
		}
	}

	@Test
	void randomIsReproducibleFromSeed()
	{
		assertEquals(Preset.random(new Random(8)), Preset.random(new Random(8)));
	}
}
