package com.study.webflux.orchestrator.infrastructure.monitoring;

import org.springframework.stereotype.Component;

import com.study.webflux.orchestrator.infrastructure.provider.pool.ProviderPool;
import com.study.webflux.orchestrator.infrastructure.provider.pool.ProviderPoolManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 프로바이더 풀 점유 상태를 Gauge로 노출합니다.
 */
@Component
public class ProviderPoolMetrics {

	public ProviderPoolMetrics(MeterRegistry meterRegistry, ProviderPoolManager poolManager) {
		for (ProviderPool pool : poolManager.pools()) {
			String role = pool.role().getValue();

			Gauge.builder("provider.pool.active", pool, ProviderPool::activeCount)
				.tag("role", role)
				.description("In-flight provider calls holding a pool slot")
				.register(meterRegistry);

			Gauge.builder("provider.pool.waiting", pool, ProviderPool::waitingCount)
				.tag("role", role)
				.description("Provider calls queued for a pool slot")
				.register(meterRegistry);

			Gauge.builder("provider.pool.capacity", pool, ProviderPool::capacity)
				.tag("role", role)
				.description("Configured concurrency limit of the provider pool")
				.register(meterRegistry);
		}
	}
}
