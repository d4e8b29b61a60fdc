package com.study.webflux.orchestrator.domain.retrieval.port;

import java.util.List;

import com.study.webflux.orchestrator.domain.retrieval.model.ContextSnippet;
import reactor.core.publisher.Mono;

/**
 * 외부 유사도 검색 저장소에 대한 도메인 포트입니다.
 */
public interface RetrievalPort {

	/**
	 * 질의와 가장 유사한 상위 K개의 스니펫을 검색합니다.
	 *
	 * @param query
	 *            검색 쿼리
	 * @param topK
	 *            검색할 상위 스니펫 수 (1 이상)
	 * @return 유사도 순으로 정렬된 스니펫 목록
	 */
	Mono<List<ContextSnippet>> search(String query, int topK);
}
