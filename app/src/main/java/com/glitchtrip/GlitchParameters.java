package com.glitchtrip;

import java.util.List;

/**
 * Everything the pipeline needs for one run. A fresh instance is built per
 * invocation; {@code seed} is null when the randomized stages should draw
 * from system entropy.
 */
public record GlitchParameters(
		float rgbShiftPixels,
		float aberrationStrength,
		int blockJitterSize,
		float noiseAmount,
		float scanlineStrength,
		float waveAmplitude,
		float waveFrequency,
		float pixelSortAmount,
		float contrastCrush,
		float saturation,
		float hueDegrees,
		float brightnessOffset,
		List<AttractorPoint> attractors,
		boolean boostMode,
		Long seed)
{
	static final float BOOST_HUE_DEGREES = 30f;
	static final float BOOST_SATURATION = 1.1f;

	public GlitchParameters
	{
		attractors = attractors == null ? List.of() : List.copyOf(attractors);
	}

	/** Every effect disabled, grading at identity. */
	public static GlitchParameters neutral()
	{
		return builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public float effectiveHueDegrees()
	{
		return boostMode ? hueDegrees + BOOST_HUE_DEGREES : hueDegrees;
	}

	public float effectiveSaturation()
	{
		return boostMode ? saturation * BOOST_SATURATION : saturation;
	}

	public Builder toBuilder()
	{
		return new Builder()
				.rgbShiftPixels(rgbShiftPixels)
				.aberrationStrength(aberrationStrength)
				.blockJitterSize(blockJitterSize)
				.noiseAmount(noiseAmount)
				.scanlineStrength(scanlineStrength)
				.waveAmplitude(waveAmplitude)
				.waveFrequency(waveFrequency)
				.pixelSortAmount(pixelSortAmount)
				.contrastCrush(contrastCrush)
				.saturation(saturation)
				.hueDegrees(hueDegrees)
				.brightnessOffset(brightnessOffset)
				.attractors(attractors)
				.boostMode(boostMode)
				.seed(seed);
	}

	public static final class Builder
	{
		private float rgbShiftPixels;
		private float aberrationStrength;
		private int blockJitterSize;
		private float noiseAmount;
		private float scanlineStrength;
		private float waveAmplitude;
		private float waveFrequency;
		private float pixelSortAmount;
		private float contrastCrush;
		private float saturation = 1f;
		private float hueDegrees;
		private float brightnessOffset;
		private List<AttractorPoint> attractors = List.of();
		private boolean boostMode;
		private Long seed;

		private Builder()
		{
		}

		public Builder rgbShiftPixels(float v)
		{
			rgbShiftPixels = v;
			return this;
		}

		public Builder aberrationStrength(float v)
		{
			aberrationStrength = v;
			return this;
		}

		public Builder blockJitterSize(int v)
		{
			blockJitterSize = v;
			return this;
		}

		public Builder noiseAmount(float v)
		{
			noiseAmount = v;
			return this;
		}

		public Builder scanlineStrength(float v)
		{
			scanlineStrength = v;
			return this;
		}

		public Builder waveAmplitude(float v)
		{
			waveAmplitude = v;
			return this;
		}

		public Builder waveFrequency(float v)
		{
			waveFrequency = v;
			return this;
		}

		public Builder pixelSortAmount(float v)
		{
			pixelSortAmount = v;
			return this;
		}

		public Builder contrastCrush(float v)
		{
			contrastCrush = v;
			return this;
		}

		public Builder saturation(float v)
		{
			saturation = v;
			return this;
		}

		public Builder hueDegrees(float v)
		{
			hueDegrees = v;
			return this;
		}

		public Builder brightnessOffset(float v)
		{
			brightnessOffset = v;
			return this;
		}

		public Builder attractors(List<AttractorPoint> v)
		{
			attractors = v;
			return this;
		}

		public Builder boostMode(boolean v)
		{
			boostMode = v;
			return this;
		}

		public Builder seed(Long v)
		{
			seed = v;
			return this;
		}

		public GlitchParameters build()
		{
			return new GlitchParameters(rgbShiftPixels, aberrationStrength, blockJitterSize,
					noiseAmount, scanlineStrength, waveAmplitude, waveFrequency, pixelSortAmount,
					contrastCrush, saturation, hueDegrees, brightnessOffset, attractors,
					boostMode, seed);
		}
	}
}
