package com.study.webflux.orchestrator.application.provider;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import com.study.webflux.orchestrator.domain.provider.port.LlmPortRegistry;
import com.study.webflux.orchestrator.infrastructure.provider.pool.ProviderPoolManager;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 프로바이더 호출을 역할별 풀 슬롯 안에서 실행합니다.
 */
@Service
@RequiredArgsConstructor
public class ProviderDispatcher {

	private final ProviderPoolManager poolManager;
	private final LlmPortRegistry portRegistry;

	public Mono<String> complete(ProviderTask task) {
		return poolManager.schedule(task.role(),
			() -> portRegistry.get(task.role()).complete(task));
	}

	public Flux<String> stream(ProviderTask task) {
		return poolManager.scheduleMany(task.role(),
			() -> portRegistry.get(task.role()).streamCompletion(task));
	}
}
