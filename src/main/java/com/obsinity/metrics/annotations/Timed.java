package com.obsinity.metrics.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Records each invocation of the annotated method as a timed event in the caller's active metrics context.
 *
 * <p>The event carries {@code class}, {@code method} and {@code result} ({@code success} or {@code error}); failed
 * invocations also carry {@code error.type}. With no active context the event is logged at WARN and dropped.
 *
 * <h4>Usage example:</h4>
 *
 * <pre>{@code
 * @Timed(name = "inventory.reserve")
 * public Reservation reserve(Sku sku) {
 *     ...
 * }
 * }</pre>
 *
 * @see MetricsScoped
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

	/** Event name; the method name when blank. */
	String name() default "";
}
