package com.glitchtrip;

import org.apache.commons.imaging.ImageInfo;
import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a source image into a {@link PixelBuffer}. Decoding goes through
 * ImageIO (so registered plugins such as a WebP reader are picked up); Commons
 * Imaging is used only to describe the file.
 */
public class ImageLoader
{

	private static final Logger LOG = LoggerFactory.getLogger(ImageLoader.class);

	public record LoadResult(PixelBuffer pixels, String formatName, List<String> warnings) {}

	public static LoadResult load(File file) throws IOException
	{
		if (!file.isFile())
		{
			throw new IOException("Not a file: " + file);
		}

		BufferedImage image = ImageIO.read(file);
		if (image == null)
		{
			throw new IOException("Failed to load " + file.getName() + ": no image reader for this format");
		}
		if (image.getWidth() <= 0 || image.getHeight() <= 0)
		{
			throw new IOException("Failed to load " + file.getName() + ": image is empty");
		}

		List<String> warnings = new ArrayList<>();
		String formatName = "unknown";
		try
		{
			ImageInfo info = Imaging.getImageInfo(file);
			formatName = info.getFormatName();
			if (info.getBitsPerPixel() > 32)
			{
				warnings.add(file.getName() + ": " + info.getBitsPerPixel()
						+ " bpp source reduced to 8 bits per channel");
			}
			if (info.getNumberOfImages() > 1)
			{
				warnings.add(file.getName() + ": contains " + info.getNumberOfImages()
						+ " images, only the first is used");
			}
		}
		catch (IOException | RuntimeException e)
		{
			// Commons Imaging does not know every format ImageIO can decode
			LOG.debug("No metadata for {}: {}", file.getName(), e.getMessage());
		}

		for (String warning : warnings)
		{
			LOG.warn(warning);
		}
		LOG.info("Loaded {} ({}x{}, {})", file.getName(), image.getWidth(), image.getHeight(), formatName);
		return new LoadResult(PixelBuffer.fromImage(image), formatName, warnings);
	}
}
