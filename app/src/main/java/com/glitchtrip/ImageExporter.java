package com.glitchtrip;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.Locale;

public class ImageExporter
{

	private static final Logger LOG = LoggerFactory.getLogger(ImageExporter.class);

	public static String exportFileName(ExportFormat format, long timestampMillis)
	{
		return "glitchtrip_" + timestampMillis + "." + format.extension();
	}

	public static void write(PixelBuffer pixels, File output, ExportFormat format) throws IOException
	{
		write(pixels.toImage(), output, format);
	}

	public static void write(BufferedImage image, File output, ExportFormat format) throws IOException
	{
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.formatName());
		if (!writers.hasNext())
		{
			throw new IOException("No " + format.name() + " writer available");
		}
		File parent = output.getAbsoluteFile().getParentFile();
		if (parent != null)
		{
			Files.createDirectories(parent.toPath());
		}

		BufferedImage toWrite = format == ExportFormat.JPEG ? flattenAlpha(image) : image;
		ImageWriter writer = writers.next();
		// ImageIO keeps the old file contents past the new end unless it is removed first
		Files.deleteIfExists(output.toPath());
		try (ImageOutputStream ios = ImageIO.createImageOutputStream(output))
		{
			if (ios == null)
			{
				throw new IOException("Cannot open output stream: " + output);
			}
			writer.setOutput(ios);
			ImageWriteParam param = writer.getDefaultWriteParam();
			if (format.isLossy() && param.canWriteCompressed())
			{
				param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
				String type = pickCompressionType(param.getCompressionTypes());
				if (type != null)
				{
					param.setCompressionType(type);
				}
				param.setCompressionQuality(ExportFormat.QUALITY);
			}
			writer.write(null, new IIOImage(toWrite, null, null), param);
		}
		finally
		{
			writer.dispose();
		}
		LOG.info("Exported {} ({})", output.getAbsolutePath(), format.mimeType());
	}

	static String pickCompressionType(String[] types)
	{
		if (types == null || types.length == 0) return null;
		for (String t : types)
		{
			String lower = t.toLowerCase(Locale.ROOT);
			if (lower.contains("lossy") && !lower.contains("lossless")) return t;
		}
		return types[0];
	}

	/** JPEG has no alpha channel; composite onto black first. */
	static BufferedImage flattenAlpha(BufferedImage src)
	{
		BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = rgb.createGraphics();
		try
		{
			g.setColor(Color.BLACK);
			g.fillRect(0, 0, src.getWidth(), src.getHeight());
			g.drawImage(src, 0, 0, null);
		}
		finally
		{
			g.dispose();
		}
		return rgb;
	}
}
