package com.obsinity.metrics.processor;

/** Time source for event and context timestamps, in seconds since the epoch. */
@FunctionalInterface
public interface MetricsClock {

	double now();

	/** Wall-clock anchored at startup and advanced with {@link System#nanoTime()}, so durations never go negative. */
	static MetricsClock system() {
		return SystemMetricsClock.INSTANCE;
	}
}
