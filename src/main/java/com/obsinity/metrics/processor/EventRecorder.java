package com.obsinity.metrics.processor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.RequiredArgsConstructor;
import org.apache.logging.log4j.spi.StandardLevel;

import com.obsinity.metrics.model.MetricEvent;
import com.obsinity.metrics.model.MetricFields;
import com.obsinity.metrics.receivers.MetricsSink;

/**
 * Single entry point for events, instantaneous or timed.
 *
 * <p>The ambient variants append to whatever context {@link MetricsContextSupport} has bound to the calling thread.
 * With no context bound the event is logged at WARN and dropped; recording never fails because a context is missing.
 */
@RequiredArgsConstructor
public class EventRecorder {

	private final MetricsContextSupport support;
	private final MetricsSink sink;
	private final MetricsClock clock;

	public MetricEvent recordEvent(final String name) {
		return recordEvent(name, null);
	}

	/**
	 * Record an event into the current thread's context.
	 *
	 * @param name   event type, required
	 * @param fields extra fields; {@code start} defaults to now
	 * @return the recorded event, or {@code null} if there was no context to record it in
	 */
	public MetricEvent recordEvent(final String name, final Map<String, ?> fields) {
		final Map<String, Object> payload = payload(name, fields);
		final ContextScope scope = support.current();
		if (scope == null) {
			if (sink.isEnabled(StandardLevel.WARN)) {
				sink.emit(StandardLevel.WARN, support.threadName() + ": no context to record event: " + payload);
			}
			return null;
		}
		return scope.append(payload);
	}

	/** Record an event into an explicitly passed scope, bypassing the thread binding. */
	public MetricEvent recordEvent(final ContextScope scope, final String name, final Map<String, ?> fields) {
		Objects.requireNonNull(scope, "scope");
		return scope.append(payload(name, fields));
	}

	/* --------------------- timers --------------------- */

	public MetricsTimer timer(final String name) {
		return timer(name, null);
	}

	/** Start a timer that records into the current thread's context when closed. */
	public MetricsTimer timer(final String name, final Map<String, ?> fields) {
		return new MetricsTimer(this, null, name, fields, clock);
	}

	/** Start a timer that records into {@code scope} when closed. */
	public MetricsTimer timer(final ContextScope scope, final String name, final Map<String, ?> fields) {
		Objects.requireNonNull(scope, "scope");
		return new MetricsTimer(this, scope, name, fields, clock);
	}

	private Map<String, Object> payload(final String name, final Map<String, ?> fields) {
		requireName(name);
		final Map<String, Object> payload = (fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>());
		payload.putIfAbsent(MetricFields.START, clock.now());
		payload.put(MetricFields.NAME, name);
		return payload;
	}

	static void requireName(final String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Event name must not be blank");
		}
	}
}
