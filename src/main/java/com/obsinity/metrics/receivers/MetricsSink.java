package com.obsinity.metrics.receivers;

import org.apache.logging.log4j.spi.StandardLevel;

/**
 * Destination for everything the metrics core writes out.
 *
 * <ul>
 *   <li>{@link StandardLevel#INFO}: one JSON record per closed context.
 *   <li>{@link StandardLevel#WARN}: an event was recorded with no active context and dropped.
 *   <li>{@link StandardLevel#DEBUG}: context open/close tracing.
 * </ul>
 *
 * Implementations should be best-effort and must not throw.
 */
@FunctionalInterface
public interface MetricsSink {

	void emit(StandardLevel level, String message);

	/** Lets callers skip building messages nobody will see. */
	default boolean isEnabled(StandardLevel level) {
		return true;
	}
}
