package com.glitchtrip;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class FrameRecorderTest
{

	@Test
	void frameCountIsClamped()
	{
		assertEquals(10, FrameRecorder.clampFrames(3));
		assertEquals(60, FrameRecorder.clampFrames(60));
		assertEquals(240, FrameRecorder.clampFrames(1000));
	}

	@Test
	void idleRecorderWritesNothing(@TempDir Path tempDir) throws Exception
	{
		FrameRecorder recorder = new FrameRecorder(tempDir.toFile());

		assertNull(recorder.record(PixelBuffer.filled(2, 2, 0xFF000000)));
		assertEquals(0, tempDir.toFile().list().length);
	}

	@Test
	void stopsAfterTargetFrames(@TempDir Path tempDir) throws Exception
	{
		FrameRecorder recorder = new FrameRecorder(tempDir.toFile());
		recorder.start(1);
		assertEquals(FrameRecorder.MIN_FRAMES, recorder.targetFrames());

		PixelBuffer frame = PixelBuffer.filled(4, 4, 0xFF112233);
		File first = recorder.record(frame);
		for (int i = 1; i < FrameRecorder.MIN_FRAMES; i++)
		{
			assertTrue(recorder.isRecording());
			recorder.record(frame);
		}

		assertFalse(recorder.isRecording());
		assertEquals(FrameRecorder.MIN_FRAMES, recorder.framesWritten());
		assertEquals("glitchtrip_anim_0001.png", first.getName());
		assertTrue(new File(tempDir.toFile(), "glitchtrip_anim_0010.png").isFile());
		assertNull(recorder.record(frame));
	}

	@Test
	void restartResetsCounter(@TempDir Path tempDir) throws Exception
	{
		FrameRecorder recorder = new FrameRecorder(tempDir.toFile());
		recorder.start(20);
		recorder.record(PixelBuffer.filled(2, 2, 0xFF000000));
		recorder.stop();

		recorder.start(20);

		assertEquals(0, recorder.framesWritten());
		assertEquals("glitchtrip_anim_0001.png", recorder.record(PixelBuffer.filled(2, 2, 0xFF000000)).getName());
	}

	// --- Concurrent use ---

	@Test
	void overlappingRecordsGetDistinctFrames(@TempDir Path tempDir) throws Exception
	{
		FrameRecorder recorder = new FrameRecorder(tempDir.toFile());
		recorder.start(20);
		PixelBuffer frame = PixelBuffer.filled(8, 8, 0xFF445566);

		ExecutorService pool = Executors.newFixedThreadPool(4);
		try
		{
			List<Callable<File>> jobs = new ArrayList<>();
			for (int i = 0; i < 20; i++)
			{
				jobs.add(() -> recorder.record(frame));
			}
			Set<String> names = new HashSet<>();
			for (Future<File> f : pool.invokeAll(jobs))
			{
				File written = f.get();
				assertNotNull(written);
				assertTrue(names.add(written.getName()), "Duplicate frame " + written.getName());
			}
			assertEquals(20, names.size());
		}
		finally
		{
			pool.shutdownNow();
		}

		assertEquals(20, recorder.framesWritten());
		assertFalse(recorder.isRecording());
		assertEquals(20, tempDir.toFile().list().length);
	}

	@Test
	void stopBetweenRecordsIsHonoured(@TempDir Path tempDir) throws Exception
	{
		FrameRecorder recorder = new FrameRecorder(tempDir.toFile());
		recorder.start(30);
		PixelBuffer frame = PixelBuffer.filled(4, 4, 0xFF000000);

		ExecutorService pool = Executors.newSingleThreadExecutor();
		try
		{
			for (int i = 0; i < 3; i++)
			{
				pool.submit(() -> recorder.record(frame)).get();
			}
			recorder.stop();
			assertNull(pool.submit(() -> recorder.record(frame)).get());
		}
		finally
		{
			pool.shutdownNow();
		}

		assertEquals(3, recorder.framesWritten());
		assertEquals(3, tempDir.toFile().list().length);
	}
}
