package com.study.webflux.orchestrator.infrastructure.retrieval.adapter;

import java.util.List;

import com.study.webflux.orchestrator.domain.retrieval.model.ContextSnippet;
import com.study.webflux.orchestrator.domain.retrieval.port.RetrievalPort;
import reactor.core.publisher.Mono;

/** 검색 저장소가 설정되지 않았을 때 항상 빈 결과를 반환합니다. */
public class NoopRetrievalAdapter implements RetrievalPort {

	@Override
	public Mono<List<ContextSnippet>> search(String query, int topK) {
		return Mono.just(List.of());
	}
}
