package com.github.micycle1.spectraldeform.util;

import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures and logs the wall-clock time of a named task, e.g. a sweep of basis
 * evaluations over a collocation grid. Not thread-safe; create one per task.
 */
public class ElapsedTimer implements AutoCloseable {

	private static final Logger LOGGER = LoggerFactory.getLogger(ElapsedTimer.class);

	private final String task;
	private final StopWatch stopWatch;

	private ElapsedTimer(String task) {
		this.task = task;
		this.stopWatch = StopWatch.createStarted();
		LOGGER.info("{}: started", task);
	}

	public static ElapsedTimer start(String task) {
		return new ElapsedTimer(task);
	}

	public long elapsedMillis() {
		return stopWatch.getTime(TimeUnit.MILLISECONDS);
	}

	public boolean isRunning() {
		return stopWatch.isStarted();
	}

	/**
	 * Stops the timer and logs the elapsed time. Calling it again has no effect.
	 *
	 * @return elapsed milliseconds
	 */
	public long stop() {
		if (stopWatch.isStarted()) {
			stopWatch.stop();
			LOGGER.info("{}: finished in {}", task, stopWatch.formatTime());
		}
		return elapsedMillis();
	}

	@Override
	public void close() {
		stop();
	}
}
