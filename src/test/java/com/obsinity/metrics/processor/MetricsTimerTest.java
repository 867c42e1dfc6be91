package com.obsinity.metrics.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;

import org.apache.logging.log4j.spi.StandardLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.obsinity.metrics.model.MetricEvent;
import com.obsinity.metrics.receivers.RecordingMetricsSink;

class MetricsTimerTest {

	private final ManualClock clock = new ManualClock(500.0);
	private final RecordingMetricsSink sink = new RecordingMetricsSink();
	private MetricsContextSupport support;
	private EventRecorder recorder;
	private ContextScope scope;

	@BeforeEach
	void setUp() {
		support = new MetricsContextSupport();
		recorder = new EventRecorder(support, sink, clock);
		scope = new ContextScope(null, clock.now());
	}

	@Test
	void recordsOneEventSpanningTheBlock() {
		support.install(scope);
		try (MetricsTimer t = recorder.timer("foo", Map.of("d", 7))) {
			assertThat(t.fields()).containsEntry("d", 7);
			t.put("e", 8);
			clock.advance(0.25);
		} finally {
			support.uninstall(scope);
		}

		assertThat(scope.events()).hasSize(1);
		MetricEvent e = scope.events().get(0);
		assertThat(e.name()).isEqualTo("foo");
		assertThat(e.start()).isEqualTo(500.0);
		assertThat(e.duration()).isCloseTo(0.25, within(1e-9));
		assertThat(e.asMap()).containsEntry("d", 7).containsEntry("e", 8);
	}

	@Test
	void recordsWhenTheBlockThrowsAndRethrows() {
		support.install(scope);
		try {
			assertThatThrownBy(() -> {
				try (MetricsTimer t = recorder.timer("failing")) {
					clock.advance(1.5);
					throw new IllegalStateException("boom");
				}
			}).isInstanceOf(IllegalStateException.class).hasMessage("boom");
		} finally {
			support.uninstall(scope);
		}

		assertThat(scope.events()).hasSize(1);
		assertThat(scope.events().get(0).duration()).isCloseTo(1.5, within(1e-9));
	}

	@Test
	void closeIsIdempotent() {
		MetricsTimer t = recorder.timer(scope, "once", null);
		t.close();
		t.close();

		assertThat(t.isClosed()).isTrue();
		assertThat(t.recorded()).isNotNull();
		assertThat(scope.events()).hasSize(1);
	}

	@Test
	void withoutContextOnlyWarns() {
		try (MetricsTimer t = recorder.timer("orphan")) {
			t.put("x", 1);
		}

		assertThat(sink.messages(StandardLevel.WARN)).singleElement().asString().contains("orphan");
	}
}
