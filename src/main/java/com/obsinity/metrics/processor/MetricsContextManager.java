package com.obsinity.metrics.processor;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.spi.StandardLevel;

import com.obsinity.metrics.model.ContextRecord;
import com.obsinity.metrics.model.MetricFields;
import com.obsinity.metrics.receivers.LoggingMetricsSink;
import com.obsinity.metrics.receivers.MetricsSink;

/**
 * Opens and closes metrics contexts.
 *
 * <p>{@link #open(Map)} binds a fresh {@link ContextScope} to the calling thread; events recorded through
 * {@link #recorder()} on that thread land in it. Closing the returned {@link MetricsContext} unbinds the scope, stamps
 * {@code events}, {@code start} and {@code duration} into the field map, and emits the whole map as JSON at INFO.
 */
public class MetricsContextManager {

	private final MetricsContextSupport support;
	private final EventRecorder recorder;
	private final MetricsRecordSerializer serializer;
	private final MetricsSink sink;
	private final MetricsClock clock;

	public MetricsContextManager(
			MetricsContextSupport support,
			MetricsRecordSerializer serializer,
			MetricsSink sink,
			MetricsClock clock) {
		this.support = Objects.requireNonNull(support, "MetricsContextSupport must not be null");
		this.serializer = Objects.requireNonNull(serializer, "MetricsRecordSerializer must not be null");
		this.sink = Objects.requireNonNull(sink, "MetricsSink must not be null");
		this.clock = Objects.requireNonNull(clock, "MetricsClock must not be null");
		this.recorder = new EventRecorder(support, sink, clock);
	}

	/** Strict nesting, SLF4J sink on the {@code metrics} logger, system clock. */
	public static MetricsContextManager create() {
		return create(NestingPolicy.STRICT, new LoggingMetricsSink());
	}

	public static MetricsContextManager create(NestingPolicy policy, MetricsSink sink) {
		return new MetricsContextManager(
				new MetricsContextSupport(policy), new MetricsRecordSerializer(), sink, MetricsClock.system());
	}

	public EventRecorder recorder() {
		return recorder;
	}

	public MetricsContextSupport support() {
		return support;
	}

	public MetricsClock clock() {
		return clock;
	}

	/* --------------------- lifecycle --------------------- */

	public MetricsContext open() {
		return open(null);
	}

	/**
	 * Open a context seeded with {@code fields} and bind it to the calling thread.
	 *
	 * @throws ContextAlreadyActiveException under the strict policy if this thread already has a context
	 */
	public MetricsContext open(final Map<String, ?> fields) {
		final ContextScope previous = support.current();
		final ContextScope scope = new ContextScope(fields, clock.now());
		support.install(scope);
		if (sink.isEnabled(StandardLevel.DEBUG)) {
			sink.emit(StandardLevel.DEBUG, support.threadName() + ": entering new context, replacing "
					+ (previous != null ? previous.fields() : "none"));
		}
		return new MetricsContext(this, scope);
	}

	/** Run {@code body} inside a fresh context. */
	public void runInContext(final Map<String, ?> fields, final Runnable body) {
		Objects.requireNonNull(body, "body");
		try (MetricsContext ignored = open(fields)) {
			body.run();
		}
	}

	/** Call {@code body} inside a fresh context and return its result. */
	public <T> T callInContext(final Map<String, ?> fields, final Callable<T> body) throws Exception {
		Objects.requireNonNull(body, "body");
		try (MetricsContext ignored = open(fields)) {
			return body.call();
		}
	}

	void finish(final ContextScope scope) {
		support.uninstall(scope);
		final double duration = clock.now() - scope.start();

		final Map<String, Object> fields = scope.fields();
		fields.put(MetricFields.EVENTS, scope.events());
		fields.put(MetricFields.START, scope.start());
		fields.put(MetricFields.DURATION, duration);

		final ContextRecord record = scope.toRecord(duration);
		sink.emit(StandardLevel.INFO, serializer.serialize(record));

		if (sink.isEnabled(StandardLevel.DEBUG)) {
			sink.emit(StandardLevel.DEBUG, support.threadName() + ": leaving context");
		}
	}
}
