package com.obsinity.metrics.processor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-local binding of the active {@link ContextScope}.
 *
 * <p>Each thread owns a stack of scopes (top = current). Under {@link NestingPolicy#STRICT} the stack never holds more
 * than one entry. The thread-local is deliberately not inheritable: child threads start with no context.
 */
public class MetricsContextSupport {

	private static final Logger log = LoggerFactory.getLogger(MetricsContextSupport.class);

	private final NestingPolicy policy;
	private final Supplier<String> threadName;
	private final ThreadLocal<Deque<ContextScope>> ctx = new ThreadLocal<>();

	public MetricsContextSupport() {
		this(NestingPolicy.STRICT);
	}

	public MetricsContextSupport(NestingPolicy policy) {
		this(policy, () -> Thread.currentThread().getName());
	}

	public MetricsContextSupport(NestingPolicy policy, Supplier<String> threadName) {
		this.policy = Objects.requireNonNull(policy, "NestingPolicy must not be null");
		this.threadName = Objects.requireNonNull(threadName, "thread name supplier must not be null");
	}

	public NestingPolicy policy() {
		return policy;
	}

	/** Name of the calling thread, for diagnostics and the {@code thread} request field. */
	public String threadName() {
		return threadName.get();
	}

	/* --------------------- scope stack --------------------- */

	/** @return the innermost scope bound to this thread, or {@code null}. */
	public ContextScope current() {
		final Deque<ContextScope> d = ctx.get();
		return (d == null || d.isEmpty()) ? null : d.peekLast();
	}

	public boolean hasActiveContext() {
		return current() != null;
	}

	/** Depth of the scope stack on this thread; at most 1 under the strict policy. */
	public int depth() {
		final Deque<ContextScope> d = ctx.get();
		return d == null ? 0 : d.size();
	}

	/**
	 * Bind {@code scope} to the calling thread.
	 *
	 * @throws ContextAlreadyActiveException under the strict policy when a scope is already bound; nothing is changed
	 */
	void install(final ContextScope scope) {
		Objects.requireNonNull(scope, "scope");
		Deque<ContextScope> d = ctx.get();
		if (policy == NestingPolicy.STRICT && d != null && !d.isEmpty()) {
			throw new ContextAlreadyActiveException(threadName());
		}
		if (d == null) {
			d = new ArrayDeque<>();
			ctx.set(d);
		}
		d.addLast(scope);
	}

	/** Unbind {@code expectedTop}, restoring whatever it shadowed. */
	void uninstall(final ContextScope expectedTop) {
		final Deque<ContextScope> d = ctx.get();
		if (d == null) {
			return;
		}
		if (!d.isEmpty()) {
			if (d.peekLast() == expectedTop) {
				d.removeLast();
			} else {
				log.warn("{}: metrics contexts closed out of order; discarding {} bound context(s)",
						threadName(), d.size());
				d.clear();
			}
		}
		if (d.isEmpty()) {
			ctx.remove();
		}
	}
}
