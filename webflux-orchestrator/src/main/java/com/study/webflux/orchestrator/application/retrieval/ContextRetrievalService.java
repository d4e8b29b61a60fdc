package com.study.webflux.orchestrator.application.retrieval;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.orchestrator.domain.retrieval.model.ContextSnippet;
import com.study.webflux.orchestrator.domain.retrieval.model.RetrievedContext;
import com.study.webflux.orchestrator.domain.retrieval.port.RetrievalPort;
import com.study.webflux.orchestrator.domain.retrieval.service.ContextPacker;
import com.study.webflux.orchestrator.infrastructure.config.properties.OrchestratorProperties;
import reactor.core.publisher.Mono;

/**
 * 요청당 한 번 컨텍스트를 검색하고 문자 예산에 맞춰 패킹합니다.
 *
 * <p>
 * 검색은 best-effort입니다. 저장소 오류는 빈 결과로 대체되며 예외로 전파되지 않습니다.
 */
@Slf4j
@Service
public class ContextRetrievalService {

	private final RetrievalPort retrievalPort;
	private final int maxContextChars;

	public ContextRetrievalService(RetrievalPort retrievalPort, OrchestratorProperties properties) {
		this.retrievalPort = retrievalPort;
		this.maxContextChars = properties.getRetrieval().getMaxContextChars();
	}

	public Mono<List<ContextSnippet>> retrieve(String query, int topK) {
		if (topK <= 0) {
			return Mono.just(List.of());
		}
		return Mono.defer(() -> retrievalPort.search(query, topK))
			.map(snippets -> snippets.size() > topK ? snippets.subList(0, topK) : snippets)
			.defaultIfEmpty(List.of())
			.onErrorResume(error -> {
				log.warn("컨텍스트 검색 실패, 빈 컨텍스트로 진행합니다: {}", error.getMessage());
				return Mono.just(List.of());
			});
	}

	/**
	 * 검색 후 패킹까지 수행합니다. hits는 패킹 전 검색된 스니펫 수입니다.
	 */
	public Mono<RetrievedContext> retrieveAndPack(String query, int topK) {
		return retrieve(query, topK)
			.map(snippets -> new RetrievedContext(snippets.size(),
				ContextPacker.pack(snippets, maxContextChars)));
	}
}
