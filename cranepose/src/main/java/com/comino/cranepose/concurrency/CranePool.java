package com.comino.cranepose.concurrency;

import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared pool for blocking device work: camera opens and the cleanup of
 * opens that completed after their deadline.
 */
public class CranePool {

	private static final Logger logger = LoggerFactory.getLogger(CranePool.class);

	private static final int PARALLELISM = 4;

	private static ForkJoinPool pool = new ForkJoinPool(PARALLELISM);

	public static int getMaxThreads() {
		return pool.getParallelism();
	}

	public static <T> Future<T> submit(Callable<T> task) {
		if(pool.getRunningThreadCount() >= pool.getParallelism()) {
			logger.warn("No more threads available, task queued");
		}
		return pool.submit(task);
	}

	public static Future<?> submit(Runnable task) {
		if(pool.getRunningThreadCount() >= pool.getParallelism()) {
			logger.warn("No more threads available, task queued");
		}
		return pool.submit(task);
	}

	public static void close() {
		pool.shutdownNow();
	}

}
