package com.obsinity.metrics.processor;

/** How a thread reacts to a context being opened while another one is already active. */
public enum NestingPolicy {
	/** Opening a second context fails with {@link ContextAlreadyActiveException}. */
	STRICT,
	/** The new context shadows the active one until it closes; events go to the innermost context only. */
	PERMISSIVE
}
