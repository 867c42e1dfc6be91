package com.obsinity.metrics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One recorded occurrence: a flat field map carrying at least {@code name} and {@code start}.
 *
 * <p>Instances are frozen. {@link #of(Map)} takes a copy, so later changes to the caller's map do not reach an event
 * that has already been appended to a context.
 */
public final class MetricEvent {

	private final Map<String, Object> fields;

	private MetricEvent(Map<String, Object> fields) {
		this.fields = Collections.unmodifiableMap(fields);
	}

	/**
	 * Freeze a field map into an event.
	 *
	 * @throws IllegalArgumentException if {@code name} is missing or blank, or {@code start} is not a number
	 */
	public static MetricEvent of(final Map<String, ?> fields) {
		if (fields == null) {
			throw new IllegalArgumentException("Event fields must not be null");
		}
		final Object name = fields.get(MetricFields.NAME);
		if (!(name instanceof String) || ((String) name).isBlank()) {
			throw new IllegalArgumentException("Event requires a non-blank '" + MetricFields.NAME + "': " + fields);
		}
		if (!(fields.get(MetricFields.START) instanceof Number)) {
			throw new IllegalArgumentException("Event requires a numeric '" + MetricFields.START + "': " + fields);
		}
		return new MetricEvent(new LinkedHashMap<>(fields));
	}

	public String name() {
		return (String) fields.get(MetricFields.NAME);
	}

	public double start() {
		return ((Number) fields.get(MetricFields.START)).doubleValue();
	}

	/** @return elapsed seconds, or {@code null} for instantaneous events. */
	public Double duration() {
		final Object d = fields.get(MetricFields.DURATION);
		return (d instanceof Number) ? ((Number) d).doubleValue() : null;
	}

	public Object get(final String key) {
		return fields.get(key);
	}

	/** Read-only view; this is also the serialized form. */
	@JsonValue
	public Map<String, Object> asMap() {
		return fields;
	}

	@Override
	public String toString() {
		return "MetricEvent" + fields;
	}
}
