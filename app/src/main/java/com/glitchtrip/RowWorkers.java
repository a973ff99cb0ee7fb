package com.glitchtrip;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits per-row work into horizontal bands on a shared pool. Only used by
 * stages whose output rows are pure functions of the input, so the banding
 * never changes the result.
 */
final class RowWorkers
{

	static final int THREADS = Math.max(1, Runtime.getRuntime().availableProcessors());
	static final int MIN_PIXELS = 65_536;

	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
	private static final ExecutorService EXECUTOR = Executors.newFixedThreadPool(THREADS, r -> {
		Thread t = new Thread(r, "glitch-rows-" + THREAD_COUNTER.incrementAndGet());
		t.setDaemon(true);
		return t;
	});

	interface RowTask
	{
		void run(int y);
	}

	private RowWorkers()
	{
	}

	static void forEachRow(int width, int height, RowTask task)
	{
		int bands = Math.min(THREADS, height);
		if (bands < 2 || (long) width * height < MIN_PIXELS)
		{
			for (int y = 0; y < height; y++)
			{
				task.run(y);
			}
			return;
		}

		List<Callable<Void>> jobs = new ArrayList<>(bands);
		for (int i = 0; i < bands; i++)
		{
			int start = (int) ((long) height * i / bands);
			int end = (int) ((long) height * (i + 1) / bands);
			jobs.add(() -> {
				for (int y = start; y < end; y++)
				{
					task.run(y);
				}
				return null;
			});
		}

		try
		{
			for (Future<Void> future : EXECUTOR.invokeAll(jobs))
			{
				future.get();
			}
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while processing rows", e);
		}
		catch (ExecutionException e)
		{
			if (e.getCause() instanceof RuntimeException re) throw re;
			if (e.getCause() instanceof Error err) throw err;
			throw new IllegalStateException(e.getCause());
		}
	}
}
