package com.obsinity.metrics.processor;

import java.time.Instant;

final class SystemMetricsClock implements MetricsClock {

	static final SystemMetricsClock INSTANCE = new SystemMetricsClock();

	private final long epochNanosAtStart;
	private final long nanoTimeAtStart;

	private SystemMetricsClock() {
		final Instant now = Instant.now();
		this.nanoTimeAtStart = System.nanoTime();
		this.epochNanosAtStart = now.getEpochSecond() * 1_000_000_000L + now.getNano();
	}

	@Override
	public double now() {
		final long epochNanos = epochNanosAtStart + (System.nanoTime() - nanoTimeAtStart);
		return epochNanos / 1_000_000_000d;
	}
}
