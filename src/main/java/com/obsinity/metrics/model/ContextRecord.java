package com.obsinity.metrics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Snapshot of a closed context, shaped exactly like the emitted JSON object: caller fields first, then
 * {@code events}, {@code start} and {@code duration}. The derived keys win over caller fields of the same name.
 */
public final class ContextRecord {

	private final Map<String, Object> fields;
	private final List<MetricEvent> events;
	private final double start;
	private final double duration;

	public ContextRecord(Map<String, ?> fields, List<MetricEvent> events, double start, double duration) {
		this.fields = (fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>());
		this.events = (events != null ? List.copyOf(events) : List.of());
		this.start = start;
		this.duration = duration;
	}

	public Map<String, Object> fields() {
		return Collections.unmodifiableMap(fields);
	}

	public List<MetricEvent> events() {
		return events;
	}

	public double start() {
		return start;
	}

	public double duration() {
		return duration;
	}

	@JsonValue
	public Map<String, Object> asMap() {
		final Map<String, Object> out = new LinkedHashMap<>(fields);
		out.put(MetricFields.EVENTS, events);
		out.put(MetricFields.START, start);
		out.put(MetricFields.DURATION, duration);
		return out;
	}

	@Override
	public String toString() {
		return "ContextRecord" + asMap();
	}
}
