package com.obsinity.metrics.aspects;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.Signature;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

import com.obsinity.metrics.annotations.MetricsScoped;
import com.obsinity.metrics.annotations.Timed;
import com.obsinity.metrics.processor.MetricsContext;
import com.obsinity.metrics.processor.MetricsContextManager;
import com.obsinity.metrics.processor.MetricsTimer;

/**
 * Spring AOP aspect behind {@link Timed} and {@link MetricsScoped}.
 *
 * <p>Stateless; all state lives in the thread binding of {@link MetricsContextManager}. Exceptions thrown by the
 * intercepted method are rethrown unchanged after the timer or context has been closed.
 */
@Aspect
@RequiredArgsConstructor
public class MetricsAspect {

	public static final String CONTEXT_FIELD = "context";

	private final MetricsContextManager manager;

	@Around(value = "execution(* *(..)) && @annotation(timed)", argNames = "joinPoint,timed")
	public Object interceptTimed(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable { // NOSONAR
		final Signature sig = joinPoint.getSignature();
		final String name = timed.name().isBlank() ? sig.getName() : timed.name();

		try (MetricsTimer timer = manager.recorder().timer(name, baseFields(sig))) {
			try {
				final Object result = joinPoint.proceed();
				timer.put("result", "success");
				return result;
			} catch (final Throwable t) {
				timer.put("result", "error");
				timer.put("error.type", t.getClass().getName());
				throw t;
			}
		}
	}

	@Around(value = "execution(* *(..)) && @annotation(scoped)", argNames = "joinPoint,scoped")
	public Object interceptScoped(ProceedingJoinPoint joinPoint, MetricsScoped scoped) throws Throwable { // NOSONAR
		final Signature sig = joinPoint.getSignature();
		final Map<String, Object> fields = new LinkedHashMap<>();
		fields.put(CONTEXT_FIELD, scoped.name().isBlank() ? sig.getName() : scoped.name());
		fields.putAll(baseFields(sig));

		try (MetricsContext ignored = manager.open(fields)) {
			return joinPoint.proceed();
		}
	}

	private static Map<String, Object> baseFields(final Signature sig) {
		final Map<String, Object> base = new LinkedHashMap<>();
		base.put("class", sig.getDeclaringTypeName());
		base.put("method", sig.getName());
		return base;
	}
}
