package com.obsinity.metrics.processor;

/** Thrown when a context is opened on a thread that already has one and nesting is {@link NestingPolicy#STRICT}. */
public final class ContextAlreadyActiveException extends IllegalStateException {

	private final String threadName;

	public ContextAlreadyActiveException(String threadName) {
		super("Thread '" + threadName + "' already has an active metrics context; nesting is disabled");
		this.threadName = threadName;
	}

	public String threadName() {
		return threadName;
	}
}
