package com.obsinity.metrics.processor;

import java.util.List;
import java.util.Map;

import com.obsinity.metrics.model.MetricEvent;

/**
 * Handle on an open context, returned by {@link MetricsContextManager#open(Map)}.
 *
 * <p>Closing it unbinds the context from the thread and emits its record exactly once. Use it with
 * try-with-resources so the record is emitted even when the unit of work fails.
 */
public final class MetricsContext implements AutoCloseable {

	private final MetricsContextManager manager;
	private final ContextScope scope;
	private boolean closed;

	MetricsContext(MetricsContextManager manager, ContextScope scope) {
		this.manager = manager;
		this.scope = scope;
	}

	/** Live context fields, e.g. for adding a session or user id. */
	public Map<String, Object> fields() {
		return scope.fields();
	}

	public MetricsContext put(final String key, final Object value) {
		scope.fields().put(key, value);
		return this;
	}

	public Object get(final String key) {
		return scope.fields().get(key);
	}

	public List<MetricEvent> events() {
		return scope.events();
	}

	/** The explicit scope, for code that records without relying on the thread binding. */
	public ContextScope scope() {
		return scope;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * @throws MetricsSerializationException if the record cannot be rendered; the context is unbound regardless
	 */
	@Override
	public void close() {
		if (closed) return;
		closed = true;
		manager.finish(scope);
	}
}
