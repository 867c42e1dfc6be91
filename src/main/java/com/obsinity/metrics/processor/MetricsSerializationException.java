package com.obsinity.metrics.processor;

/** A context record could not be rendered as JSON; nothing was emitted. */
public final class MetricsSerializationException extends RuntimeException {
	public MetricsSerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
