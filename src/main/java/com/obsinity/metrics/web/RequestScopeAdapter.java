package com.obsinity.metrics.web;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.RequiredArgsConstructor;

import com.obsinity.metrics.model.MetricFields;
import com.obsinity.metrics.processor.MetricsContext;
import com.obsinity.metrics.processor.MetricsContextManager;

/**
 * Gives every request its own metrics context.
 *
 * <p>The wrapped handler runs inside a context seeded with {@code REMOTE_ADDR}, {@code PATH_INFO},
 * {@code QUERY_STRING} and {@code thread}. The live field map is stored in the environment under
 * {@value #CONTEXT_KEY} so handlers can add their own identifiers. Results and exceptions pass through untouched.
 */
@RequiredArgsConstructor
public class RequestScopeAdapter {

	public static final String CONTEXT_KEY = "metrics_context";

	private final MetricsContextManager manager;

	public <R> RequestHandler<R> wrap(final RequestHandler<R> handler) {
		Objects.requireNonNull(handler, "handler");
		return environ -> {
			final Map<String, Object> fields = requestFields(
					environ.get(MetricFields.REMOTE_ADDR),
					environ.get(MetricFields.PATH_INFO),
					environ.get(MetricFields.QUERY_STRING));
			try (MetricsContext context = manager.open(fields)) {
				environ.put(CONTEXT_KEY, context.fields());
				return handler.handle(environ);
			}
		};
	}

	MetricsContextManager manager() {
		return manager;
	}

	/** The four fixed request fields, {@code thread} taken from the calling thread. */
	Map<String, Object> requestFields(final Object remoteAddr, final Object pathInfo, final Object queryString) {
		final Map<String, Object> fields = new LinkedHashMap<>();
		fields.put(MetricFields.REMOTE_ADDR, remoteAddr);
		fields.put(MetricFields.PATH_INFO, pathInfo);
		fields.put(MetricFields.QUERY_STRING, queryString);
		fields.put(MetricFields.THREAD, manager.support().threadName());
		return fields;
	}
}
