package com.glitchtrip;

import java.util.List;
import java.util.Random;

/**
 * Named slider snapshot used to seed the controls.
 */
public record Preset(
		String name,
		float rgbShift,
		int blockJitter,
		float noise,
		float scanlines,
		float waveAmp,
		float waveFreq,
		float pixelSort,
		float aberration,
		float crush,
		float saturation,
		float hue,
		float brightness,
		List<AttractorPoint> attractors)
{
	public static final Preset VHS = new Preset("VHS", 4f, 6, 0.12f, 0.6f, 4f, 10f, 0f, 0.2f, 0.1f, 1.0f, -4f, 0.05f,
			List.of(new AttractorPoint(0.25f, 0.35f), new AttractorPoint(0.7f, 0.55f)));
	public static final Preset MOSH = new Preset("MOSH", 10f, 22, 0.05f, 0.2f, 8f, 5f, 0.7f, 0.4f, 0.2f, 1.2f, 8f, 0.0f,
			List.of(new AttractorPoint(0.2f, 0.8f), new AttractorPoint(0.8f, 0.2f)));
	public static final Preset PINK = new Preset("PINK", 8f, 16, 0.10f, 0.4f, 12f, 14f, 0.4f, 0.6f, 0.1f, 1.4f, 22f, 0.05f,
			List.of(new AttractorPoint(0.4f, 0.3f), new AttractorPoint(0.65f, 0.7f)));
	// only offered once boost mode is unlocked
	public static final Preset SPAMYETI = new Preset("SPAMYETI", 14f, 28, 0.16f, 0.7f, 18f, 18f, 0.55f, 0.8f, 0.25f, 1.5f, 44f, 0.15f,
			List.of(new AttractorPoint(0.33f, 0.33f), new AttractorPoint(0.66f, 0.66f)));
	public static final Preset DEFAULTS = new Preset("DEFAULT", 6f, 12, 0.08f, 0.4f, 6f, 12f, 0f, 0.3f, 0f, 1f, 0f, 0f,
			List.of(new AttractorPoint(0.3f, 0.3f), new AttractorPoint(0.7f, 0.6f)));

	public Preset
	{
		attractors = List.copyOf(attractors);
	}

	public static List<Preset> standard()
	{
		return List.of(VHS, MOSH, PINK);
	}

	public static List<Preset> available(boolean boostUnlocked)
	{
		return boostUnlocked ? List.of(VHS, MOSH, PINK, SPAMYETI) : standard();
	}

	public static Preset random(Random rnd)
	{
		return new Preset(
				"RANDOM",
				range(rnd, 0f, 20f),
				rnd.nextInt(30),
				range(rnd, 0f, 0.5f),
				range(rnd, 0f, 1f),
				range(rnd, 0f, 30f),
				range(rnd, 0f, 30f),
				range(rnd, 0f, 1f),
				range(rnd, 0f, 1f),
				range(rnd, 0f, 1f),
				range(rnd, 0.6f, 1.8f),
				range(rnd, -90f, 90f),
				range(rnd, -0.2f, 0.2f),
				List.of(new AttractorPoint(range(rnd, 0.1f, 0.9f), range(rnd, 0.1f, 0.9f)),
						new AttractorPoint(range(rnd, 0.1f, 0.9f), range(rnd, 0.1f, 0.9f))));
	}

	private static float range(Random rnd, float lo, float hi)
	{
		return lo + rnd.nextFloat() * (hi - lo);
	}

	public GlitchParameters toParameters(boolean boostMode, Long seed)
	{
		return GlitchParameters.builder()
				.rgbShiftPixels(rgbShift)
				.blockJitterSize(blockJitter)
				.noiseAmount(noise)
				.scanlineStrength(scanlines)
				.waveAmplitude(waveAmp)
				.waveFrequency(waveFreq)
				.pixelSortAmount(pixelSort)
				.aberrationStrength(aberration)
				.contrastCrush(crush)
				.saturation(saturation)
				.hueDegrees(hue)
				.brightnessOffset(brightness)
				.attractors(attractors)
				.boostMode(boostMode)
				.seed(seed)
				.build();
	}
}
