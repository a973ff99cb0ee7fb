package com.glitchtrip;

/**
 * User settings persisted between sessions.
 */
public class AppConfig
{
	private int maxWorkingWidth;
	private ExportFormat exportFormat;
	private int recorderFrames;
	private String lastDirectory;

	public AppConfig()
	{
		this.maxWorkingWidth = GlitchEngine.DEFAULT_MAX_WORKING_WIDTH;
		this.exportFormat = ExportFormat.PNG;
		this.recorderFrames = 60;
		this.lastDirectory = null;
	}

	/** Repairs values that a hand-edited or older file may carry. */
	void normalize()
	{
		if (maxWorkingWidth < 1) maxWorkingWidth = GlitchEngine.DEFAULT_MAX_WORKING_WIDTH;
		if (exportFormat == null) exportFormat = ExportFormat.PNG;
		recorderFrames = FrameRecorder.clampFrames(recorderFrames);
	}

	public int getMaxWorkingWidth()
	{
		return maxWorkingWidth;
	}

	public void setMaxWorkingWidth(int maxWorkingWidth)
	{
		this.maxWorkingWidth = maxWorkingWidth;
	}

	public ExportFormat getExportFormat()
	{
		return exportFormat;
	}

	public void setExportFormat(ExportFormat exportFormat)
	{
		this.exportFormat = exportFormat;
	}

	public int getRecorderFrames()
	{
		return recorderFrames;
	}

	public void setRecorderFrames(int recorderFrames)
	{
		this.recorderFrames = recorderFrames;
	}

	public String getLastDirectory()
	{
		return lastDirectory;
	}

	public void setLastDirectory(String lastDirectory)
	{
		this.lastDirectory = lastDirectory;
	}
}
