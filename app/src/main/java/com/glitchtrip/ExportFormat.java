package com.glitchtrip;

import java.util.Locale;

public enum ExportFormat
{
	PNG("png", "png", "image/png", false),
	JPEG("jpeg", "jpg", "image/jpeg", true);

	/** Compression quality for JPEG. */
	public static final float QUALITY = 0.95f;

	private final String formatName;
	private final String extension;
	private final String mimeType;
	private final boolean lossy;

	ExportFormat(String formatName, String extension, String mimeType, boolean lossy)
	{
		this.formatName = formatName;
		this.extension = extension;
		this.mimeType = mimeType;
		this.lossy = lossy;
	}

	public String formatName()
	{
		return formatName;
	}

	public String extension()
	{
		return extension;
	}

	public String mimeType()
	{
		return mimeType;
	}

	public boolean isLossy()
	{
		return lossy;
	}

	public static ExportFormat fromFileName(String name)
	{
		String lower = name.toLowerCase(Locale.ROOT);
		if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return JPEG;
		return PNG;
	}
}
