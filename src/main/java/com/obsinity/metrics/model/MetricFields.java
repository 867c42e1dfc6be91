package com.obsinity.metrics.model;

/** Field names with fixed meaning in emitted records. Everything else is caller-defined. */
public final class MetricFields {

	/** Event type; need not be unique within a context. */
	public static final String NAME = "name";

	/** Epoch seconds at which the event or context started. */
	public static final String START = "start";

	/** Elapsed seconds; set by timers and by the context on close. */
	public static final String DURATION = "duration";

	/** Ordered list of events recorded within a context. */
	public static final String EVENTS = "events";

	/* request-scoped context fields */
	public static final String REMOTE_ADDR = "REMOTE_ADDR";
	public static final String PATH_INFO = "PATH_INFO";
	public static final String QUERY_STRING = "QUERY_STRING";
	public static final String THREAD = "thread";

	private MetricFields() {}
}
