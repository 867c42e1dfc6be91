package com.obsinity.metrics.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the annotated method inside its own metrics context, emitted when the method returns or throws.
 *
 * <p>Use it on job or message entry points. The context carries {@code context} (the name), {@code class} and
 * {@code method}.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface MetricsScoped {

	/** Context name; the method name when blank. */
	String name() default "";
}
