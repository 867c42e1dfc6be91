package com.obsinity.metrics.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsinity.metrics.Metrics;
import com.obsinity.metrics.aspects.MetricsAspect;
import com.obsinity.metrics.processor.EventRecorder;
import com.obsinity.metrics.processor.MetricsClock;
import com.obsinity.metrics.processor.MetricsContextManager;
import com.obsinity.metrics.processor.MetricsContextSupport;
import com.obsinity.metrics.processor.MetricsRecordSerializer;
import com.obsinity.metrics.receivers.LoggingMetricsSink;
import com.obsinity.metrics.receivers.MetricsSink;
import com.obsinity.metrics.web.MetricsContextFilter;
import com.obsinity.metrics.web.RequestScopeAdapter;

/**
 * Wires the metrics core. Every bean backs off when the application defines its own. The manager built here also
 * becomes the one behind the static {@link Metrics} facade.
 */
@AutoConfiguration
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableConfigurationProperties(MetricsProperties.class)
public class MetricsAutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	MetricsClock metricsClock() {
		return MetricsClock.system();
	}

	@Bean
	@ConditionalOnMissingBean
	MetricsSink metricsSink(MetricsProperties properties) {
		return new LoggingMetricsSink(properties.getLoggerName());
	}

	@Bean
	@ConditionalOnMissingBean
	MetricsContextSupport metricsContextSupport(MetricsProperties properties) {
		return new MetricsContextSupport(properties.getNestingPolicy());
	}

	@Bean
	@ConditionalOnMissingBean
	MetricsRecordSerializer metricsRecordSerializer(ObjectProvider<ObjectMapper> mapper) {
		return new MetricsRecordSerializer(mapper.getIfAvailable());
	}

	@Bean
	@ConditionalOnMissingBean
	MetricsContextManager metricsContextManager(
			MetricsContextSupport support, MetricsRecordSerializer serializer, MetricsSink sink, MetricsClock clock) {
		MetricsContextManager manager = new MetricsContextManager(support, serializer, sink, clock);
		Metrics.install(manager);
		return manager;
	}

	@Bean
	@ConditionalOnMissingBean
	EventRecorder eventRecorder(MetricsContextManager manager) {
		return manager.recorder();
	}

	@Bean
	@ConditionalOnMissingBean
	RequestScopeAdapter requestScopeAdapter(MetricsContextManager manager) {
		return new RequestScopeAdapter(manager);
	}

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
	static class AspectConfiguration {

		@Bean
		@ConditionalOnMissingBean
		MetricsAspect metricsAspect(MetricsContextManager manager) {
			return new MetricsAspect(manager);
		}
	}

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
	@ConditionalOnClass(name = "org.springframework.web.filter.OncePerRequestFilter")
	@ConditionalOnProperty(prefix = "obsinity.metrics.filter", name = "enabled", matchIfMissing = true)
	static class ServletFilterConfiguration {

		@Bean
		@ConditionalOnMissingBean
		FilterRegistrationBean<MetricsContextFilter> metricsContextFilter(
				RequestScopeAdapter adapter, MetricsProperties properties) {
			FilterRegistrationBean<MetricsContextFilter> registration =
					new FilterRegistrationBean<>(new MetricsContextFilter(adapter));
			registration.setOrder(properties.getFilter().getOrder());
			registration.addUrlPatterns("/*");
			return registration;
		}
	}
}
