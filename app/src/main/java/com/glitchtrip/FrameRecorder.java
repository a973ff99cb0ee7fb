package com.glitchtrip;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Saves every rendered result as a numbered PNG until the requested number of
 * frames has been written, then stops by itself.
 * <p>
 * Render workers record from background threads while the UI starts and stops
 * the recorder, so all state is guarded by the instance lock. A write holds the
 * lock, which keeps frame numbers unique when renders overlap.
 */
public class FrameRecorder
{

	private static final Logger LOG = LoggerFactory.getLogger(FrameRecorder.class);

	public static final int MIN_FRAMES = 10;
	public static final int MAX_FRAMES = 240;

	private final File directory;
	private int targetFrames = 60;
	private int framesWritten;
	private boolean recording;

	public FrameRecorder(File directory)
	{
		this.directory = directory;
	}

	static String frameFileName(int index)
	{
		return String.format("glitchtrip_anim_%04d.png", index);
	}

	public static int clampFrames(int frames)
	{
		return Math.max(MIN_FRAMES, Math.min(MAX_FRAMES, frames));
	}

	public synchronized void start(int frames)
	{
		targetFrames = clampFrames(frames);
		framesWritten = 0;
		recording = true;
		LOG.info("Recording {} frames to {}", targetFrames, directory.getAbsolutePath());
	}

	public synchronized void stop()
	{
		recording = false;
	}

	/**
	 * Writes the frame if recording.
	 *
	 * @return the file written, or null when not recording
	 */
	public synchronized File record(PixelBuffer frame) throws IOException
	{
		if (!recording) return null;
		int index = framesWritten + 1;
		File out = new File(directory, frameFileName(index));
		ImageExporter.write(frame, out, ExportFormat.PNG);
		framesWritten = index;
		if (framesWritten >= targetFrames)
		{
			recording = false;
			LOG.info("Recording finished after {} frames", framesWritten);
		}
		return out;
	}

	public synchronized boolean isRecording()
	{
		return recording;
	}

	public synchronized int framesWritten()
	{
		return framesWritten;
	}

	public synchronized int targetFrames()
	{
		return targetFrames;
	}

	public File directory()
	{
		return directory;
	}
}
