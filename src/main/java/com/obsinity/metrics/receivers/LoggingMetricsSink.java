package com.obsinity.metrics.receivers;

import org.apache.logging.log4j.spi.StandardLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default sink: forwards to an SLF4J logger, {@code metrics} unless configured otherwise. */
public class LoggingMetricsSink implements MetricsSink {

	public static final String DEFAULT_LOGGER_NAME = "metrics";

	private final Logger log;

	public LoggingMetricsSink() {
		this(DEFAULT_LOGGER_NAME);
	}

	public LoggingMetricsSink(String loggerName) {
		this.log = LoggerFactory.getLogger(
				(loggerName == null || loggerName.isBlank()) ? DEFAULT_LOGGER_NAME : loggerName);
	}

	public String loggerName() {
		return log.getName();
	}

	@Override
	public void emit(final StandardLevel level, final String message) {
		if (level == null) return;
		switch (level) {
			case FATAL, ERROR -> log.error("{}", message);
			case WARN -> log.warn("{}", message);
			case INFO -> log.info("{}", message);
			case DEBUG -> log.debug("{}", message);
			case TRACE, ALL -> log.trace("{}", message);
			case OFF -> {
				// muted
			}
		}
	}

	@Override
	public boolean isEnabled(final StandardLevel level) {
		if (level == null) return false;
		return switch (level) {
			case FATAL, ERROR -> log.isErrorEnabled();
			case WARN -> log.isWarnEnabled();
			case INFO -> log.isInfoEnabled();
			case DEBUG -> log.isDebugEnabled();
			case TRACE, ALL -> log.isTraceEnabled();
			case OFF -> false;
		};
	}
}
