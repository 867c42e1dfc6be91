package com.obsinity.metrics.web;

import java.io.IOException;
import java.util.Map;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import com.obsinity.metrics.processor.MetricsContext;

/**
 * Servlet filter form of {@link RequestScopeAdapter}: one metrics context per request, emitted when the chain returns
 * or throws. The live field map is exposed as the request attribute {@value RequestScopeAdapter#CONTEXT_KEY}.
 */
public class MetricsContextFilter extends OncePerRequestFilter {

	private final RequestScopeAdapter adapter;
	private final UrlPathHelper pathHelper = new UrlPathHelper();

	public MetricsContextFilter(RequestScopeAdapter adapter) {
		this.adapter = adapter;
	}

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
			throws ServletException, IOException {
		final String query = request.getQueryString();
		final Map<String, Object> fields = adapter.requestFields(
				request.getRemoteAddr(),
				pathHelper.getPathWithinApplication(request),
				query != null ? query : "");

		try (MetricsContext context = adapter.manager().open(fields)) {
			request.setAttribute(RequestScopeAdapter.CONTEXT_KEY, context.fields());
			chain.doFilter(request, response);
		}
	}
}
