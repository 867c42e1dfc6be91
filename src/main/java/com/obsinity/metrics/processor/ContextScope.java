package com.obsinity.metrics.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.obsinity.metrics.model.ContextRecord;
import com.obsinity.metrics.model.MetricEvent;

/**
 * An explicit, open context: its mutable field map, the events recorded so far and its start time.
 *
 * <p>This is the value the ambient layer ({@link MetricsContextSupport}) binds to a thread. Code that passes contexts
 * explicitly can record into a scope with {@link EventRecorder#recordEvent(ContextScope, String, Map)}. A scope is
 * confined to one thread at a time and is not synchronized.
 */
public final class ContextScope {

	private final Map<String, Object> fields;
	private final List<MetricEvent> events = new ArrayList<>();
	private final double start;

	ContextScope(Map<String, ?> fields, double start) {
		this.fields = (fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>());
		this.start = start;
	}

	/** Live field map; writes show up in the emitted record. */
	public Map<String, Object> fields() {
		return fields;
	}

	/** Recorded events in recording order (read-only view). */
	public List<MetricEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public double start() {
		return start;
	}

	MetricEvent append(final Map<String, ?> payload) {
		final MetricEvent event = MetricEvent.of(payload);
		events.add(event);
		return event;
	}

	ContextRecord toRecord(final double duration) {
		return new ContextRecord(fields, events, start, duration);
	}
}
