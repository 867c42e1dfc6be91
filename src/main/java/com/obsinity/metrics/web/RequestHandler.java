package com.obsinity.metrics.web;

import java.util.Map;

/**
 * A request handler that receives the request as an environment map (CGI-style keys such as {@code REMOTE_ADDR},
 * {@code PATH_INFO}, {@code QUERY_STRING}).
 *
 * @param <R> response type
 */
@FunctionalInterface
public interface RequestHandler<R> {
	R handle(Map<String, Object> environ) throws Exception;
}
