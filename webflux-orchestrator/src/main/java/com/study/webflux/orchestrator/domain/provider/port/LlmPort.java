package com.study.webflux.orchestrator.domain.provider.port;

import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface LlmPort {
	Flux<String> streamCompletion(ProviderTask task);

	Mono<String> complete(ProviderTask task);
}
