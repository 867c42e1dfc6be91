package com.obsinity.metrics.processor;

/** Clock that only moves when told to. */
public class ManualClock implements MetricsClock {

	private double now;

	public ManualClock(double start) {
		this.now = start;
	}

	@Override
	public synchronized double now() {
		return now;
	}

	public synchronized void advance(double seconds) {
		now += seconds;
	}
}
