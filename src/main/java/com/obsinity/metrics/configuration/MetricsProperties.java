package com.obsinity.metrics.configuration;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import com.obsinity.metrics.processor.NestingPolicy;
import com.obsinity.metrics.receivers.LoggingMetricsSink;

/** {@code obsinity.metrics.*} settings. */
@Getter
@Setter
@ConfigurationProperties(prefix = "obsinity.metrics")
public class MetricsProperties {

	/** Whether a thread may open a context while another is active. One policy per deployment. */
	private NestingPolicy nestingPolicy = NestingPolicy.STRICT;

	/** SLF4J logger receiving context records and diagnostics. */
	private String loggerName = LoggingMetricsSink.DEFAULT_LOGGER_NAME;

	private final Filter filter = new Filter();

	@Getter
	@Setter
	public static class Filter {

		/** Register {@code MetricsContextFilter} in servlet applications. */
		private boolean enabled = true;

		/** Filter order; runs early so the whole request is covered. */
		private int order = -100;
	}
}
