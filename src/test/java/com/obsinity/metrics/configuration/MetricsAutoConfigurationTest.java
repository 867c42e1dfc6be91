package com.obsinity.metrics.configuration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;

import com.obsinity.metrics.Metrics;
import com.obsinity.metrics.aspects.MetricsAspect;
import com.obsinity.metrics.processor.EventRecorder;
import com.obsinity.metrics.processor.MetricsContextManager;
import com.obsinity.metrics.processor.MetricsContextSupport;
import com.obsinity.metrics.processor.NestingPolicy;
import com.obsinity.metrics.receivers.LoggingMetricsSink;
import com.obsinity.metrics.receivers.MetricsSink;
import com.obsinity.metrics.receivers.RecordingMetricsSink;
import com.obsinity.metrics.web.RequestScopeAdapter;

class MetricsAutoConfigurationTest {

	private final ApplicationContextRunner runner = new ApplicationContextRunner()
			.withConfiguration(AutoConfigurations.of(MetricsAutoConfiguration.class));

	private final MetricsContextManager original = Metrics.manager();

	@AfterEach
	void restoreFacade() {
		Metrics.install(original);
	}

	@Test
	void defaultsToStrictNestingAndLoggingSink() {
		runner.run(ctx -> {
			assertThat(ctx).hasSingleBean(MetricsContextManager.class);
			assertThat(ctx).hasSingleBean(EventRecorder.class);
			assertThat(ctx).hasSingleBean(RequestScopeAdapter.class);
			assertThat(ctx).hasSingleBean(MetricsAspect.class);
			assertThat(ctx).doesNotHaveBean(FilterRegistrationBean.class);
			assertThat(ctx.getBean(MetricsContextSupport.class).policy()).isEqualTo(NestingPolicy.STRICT);
			assertThat(ctx.getBean(MetricsSink.class)).isInstanceOf(LoggingMetricsSink.class);
			assertThat(((LoggingMetricsSink) ctx.getBean(MetricsSink.class)).loggerName()).isEqualTo("metrics");
			assertThat(Metrics.manager()).isSameAs(ctx.getBean(MetricsContextManager.class));
		});
	}

	@Test
	void propertiesSelectPolicyAndLogger() {
		runner.withPropertyValues("obsinity.metrics.nesting-policy=permissive", "obsinity.metrics.logger-name=app.metrics")
				.run(ctx -> {
					assertThat(ctx.getBean(MetricsContextSupport.class).policy()).isEqualTo(NestingPolicy.PERMISSIVE);
					assertThat(((LoggingMetricsSink) ctx.getBean(MetricsSink.class)).loggerName())
							.isEqualTo("app.metrics");
				});
	}

	@Test
	void applicationSinkWins() {
		runner.withBean(MetricsSink.class, RecordingMetricsSink::new).run(ctx -> {
			assertThat(ctx).hasSingleBean(MetricsSink.class);
			assertThat(ctx.getBean(MetricsSink.class)).isInstanceOf(RecordingMetricsSink.class);
		});
	}

	@Test
	void servletApplicationsGetTheFilter() {
		new WebApplicationContextRunner()
				.withConfiguration(AutoConfigurations.of(MetricsAutoConfiguration.class))
				.run(ctx -> assertThat(ctx).hasSingleBean(FilterRegistrationBean.class));
	}

	@Test
	void filterCanBeSwitchedOff() {
		new WebApplicationContextRunner()
				.withConfiguration(AutoConfigurations.of(MetricsAutoConfiguration.class))
				.withPropertyValues("obsinity.metrics.filter.enabled=false")
				.run(ctx -> assertThat(ctx).doesNotHaveBean(FilterRegistrationBean.class));
	}
}
