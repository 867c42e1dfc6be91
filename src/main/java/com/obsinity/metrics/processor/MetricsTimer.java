package com.obsinity.metrics.processor;

import java.util.LinkedHashMap;
import java.util.Map;

import com.obsinity.metrics.model.MetricEvent;
import com.obsinity.metrics.model.MetricFields;

/**
 * Times a block and records it as one event when closed.
 *
 * <pre>{@code
 * try (MetricsTimer t = recorder.timer("db.query", Map.of("table", "orders"))) {
 *     t.put("rows", runQuery());
 * }
 * }</pre>
 *
 * The clock starts when the timer is created. {@link #close()} records {@code name}, {@code start} and
 * {@code duration} plus whatever was put into {@link #fields()}; it runs on every exit path of a
 * try-with-resources block and records at most once.
 */
public final class MetricsTimer implements AutoCloseable {

	private final EventRecorder recorder;
	private final ContextScope target; // null = current thread's context
	private final String name;
	private final Map<String, Object> fields;
	private final MetricsClock clock;
	private final double start;
	private boolean closed;
	private MetricEvent recorded;

	MetricsTimer(EventRecorder recorder, ContextScope target, String name, Map<String, ?> fields, MetricsClock clock) {
		EventRecorder.requireName(name);
		this.recorder = recorder;
		this.target = target;
		this.name = name;
		this.fields = (fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>());
		this.clock = clock;
		this.start = clock.now();
	}

	public String name() {
		return name;
	}

	public double start() {
		return start;
	}

	/** Mutable fields of the pending event. Changes after {@link #close()} are ignored. */
	public Map<String, Object> fields() {
		return fields;
	}

	public MetricsTimer put(final String key, final Object value) {
		fields.put(key, value);
		return this;
	}

	public boolean isClosed() {
		return closed;
	}

	/** @return the event recorded on close, or {@code null} if still open or there was no context. */
	public MetricEvent recorded() {
		return recorded;
	}

	@Override
	public void close() {
		if (closed) return;
		closed = true;
		final double duration = clock.now() - start;
		fields.put(MetricFields.NAME, name);
		fields.put(MetricFields.START, start);
		fields.put(MetricFields.DURATION, duration);
		recorded = (target != null)
				? recorder.recordEvent(target, name, fields)
				: recorder.recordEvent(name, fields);
	}
}
