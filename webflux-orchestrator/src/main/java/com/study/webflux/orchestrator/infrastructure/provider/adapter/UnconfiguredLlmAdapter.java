package com.study.webflux.orchestrator.infrastructure.provider.adapter;

import com.study.webflux.orchestrator.domain.provider.exception.ProviderUnavailableException;
import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import com.study.webflux.orchestrator.domain.provider.port.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** API 키가 없는 역할에 연결되는 어댑터입니다. 모든 호출이 실패합니다. */
public class UnconfiguredLlmAdapter implements LlmPort {

	private final ProviderRole role;

	public UnconfiguredLlmAdapter(ProviderRole role) {
		this.role = role;
	}

	@Override
	public Flux<String> streamCompletion(ProviderTask task) {
		return Flux.error(new ProviderUnavailableException(role));
	}

	@Override
	public Mono<String> complete(ProviderTask task) {
		return Mono.error(new ProviderUnavailableException(role));
	}
}
