package com.obsinity.metrics.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

class MetricsContextSupportTest {

	@Test
	void strictPolicyRejectsSecondScopeWithoutChangingState() {
		MetricsContextSupport support = new MetricsContextSupport(NestingPolicy.STRICT, () -> "worker-1");
		ContextScope outer = new ContextScope(Map.of("a", 1), 0.0);
		ContextScope inner = new ContextScope(Map.of("b", 2), 0.0);

		support.install(outer);

		assertThatThrownBy(() -> support.install(inner))
				.isInstanceOf(ContextAlreadyActiveException.class)
				.hasMessageContaining("worker-1");
		assertThat(support.current()).isSameAs(outer);
		assertThat(support.depth()).isEqualTo(1);

		support.uninstall(outer);
		assertThat(support.hasActiveContext()).isFalse();
	}

	@Test
	void permissivePolicyRestoresShadowedScope() {
		MetricsContextSupport support = new MetricsContextSupport(NestingPolicy.PERMISSIVE);
		ContextScope outer = new ContextScope(null, 0.0);
		ContextScope inner = new ContextScope(null, 0.0);

		support.install(outer);
		support.install(inner);
		assertThat(support.current()).isSameAs(inner);
		assertThat(support.depth()).isEqualTo(2);

		support.uninstall(inner);
		assertThat(support.current()).isSameAs(outer);

		support.uninstall(outer);
		assertThat(support.current()).isNull();
	}

	@Test
	void outOfOrderUninstallResetsTheThread() {
		MetricsContextSupport support = new MetricsContextSupport(NestingPolicy.PERMISSIVE);
		ContextScope outer = new ContextScope(null, 0.0);
		ContextScope inner = new ContextScope(null, 0.0);
		support.install(outer);
		support.install(inner);

		support.uninstall(outer);

		assertThat(support.depth()).isZero();
		support.uninstall(inner); // no-op
		assertThat(support.current()).isNull();
	}

	@Test
	void bindingIsNotVisibleToOtherThreads() throws Exception {
		MetricsContextSupport support = new MetricsContextSupport();
		ContextScope scope = new ContextScope(null, 0.0);
		support.install(scope);

		ExecutorService pool = Executors.newSingleThreadExecutor();
		try {
			ContextScope seen = CompletableFuture.supplyAsync(support::current, pool).get();
			assertThat(seen).isNull();
		} finally {
			pool.shutdownNow();
			support.uninstall(scope);
		}
	}
}
