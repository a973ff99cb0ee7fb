package com.glitchtrip;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ExportFormatTest
{

	@Test
	void formatFromFileName()
	{
		assertEquals(ExportFormat.JPEG, ExportFormat.fromFileName("shot.JPG"));
		assertEquals(ExportFormat.JPEG, ExportFormat.fromFileName("shot.jpeg"));
		assertEquals(ExportFormat.PNG, ExportFormat.fromFileName("shot.png"));
		assertEquals(ExportFormat.PNG, ExportFormat.fromFileName("shot"));
	}

	@Test
	void fileNameMatchingIgnoresDefaultLocale()
	{
		Locale previous = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
		try
		{
			assertEquals(ExportFormat.JPEG, ExportFormat.fromFileName("SHOT.JPEG"));
			assertEquals(ExportFormat.PNG, ExportFormat.fromFileName("SHOT.PNG"));
		}
		finally
		{
			Locale.setDefault(previous);
		}
	}

	@Test
	void onlyJpegIsLossy()
	{
		assertFalse(ExportFormat.PNG.isLossy());
		assertTrue(ExportFormat.JPEG.isLossy());
		assertEquals("image/jpeg", ExportFormat.JPEG.mimeType());
	}

	@Test
	void everyOfferedFormatHasWriter()
	{
		for (ExportFormat format : ExportFormat.values())
		{
			assertTrue(ImageIO.getImageWritersByFormatName(format.formatName()).hasNext(),
					"No writer for " + format);
		}
	}
}
