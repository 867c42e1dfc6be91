package com.obsinity.metrics;

import java.util.Map;
import java.util.Objects;

import com.obsinity.metrics.model.MetricEvent;
import com.obsinity.metrics.processor.MetricsContext;
import com.obsinity.metrics.processor.MetricsContextManager;
import com.obsinity.metrics.processor.MetricsTimer;

/**
 * Static access to the process-wide {@link MetricsContextManager}, for library code that has no way to be handed
 * one.
 *
 * <pre>{@code
 * try (MetricsContext c = Metrics.context(Map.of("job", "nightly-import"))) {
 *     try (MetricsTimer t = Metrics.timer("download")) {
 *         t.put("bytes", download());
 *     }
 *     Metrics.event("parsed", Map.of("rows", rows));
 * }
 * }</pre>
 *
 * The Spring auto-configuration replaces the default manager with the application's bean.
 */
public final class Metrics {

	private static volatile MetricsContextManager manager = MetricsContextManager.create();

	private Metrics() {}

	public static MetricsContextManager manager() {
		return manager;
	}

	public static void install(final MetricsContextManager contextManager) {
		manager = Objects.requireNonNull(contextManager, "MetricsContextManager must not be null");
	}

	public static MetricsContext context() {
		return manager.open();
	}

	public static MetricsContext context(final Map<String, ?> fields) {
		return manager.open(fields);
	}

	public static MetricEvent event(final String name) {
		return manager.recorder().recordEvent(name);
	}

	public static MetricEvent event(final String name, final Map<String, ?> fields) {
		return manager.recorder().recordEvent(name, fields);
	}

	public static MetricsTimer timer(final String name) {
		return manager.recorder().timer(name);
	}

	public static MetricsTimer timer(final String name, final Map<String, ?> fields) {
		return manager.recorder().timer(name, fields);
	}
}
