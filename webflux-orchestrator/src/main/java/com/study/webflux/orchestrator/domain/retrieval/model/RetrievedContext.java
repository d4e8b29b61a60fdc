package com.study.webflux.orchestrator.domain.retrieval.model;

/**
 * 검색 히트 수와 패킹된 컨텍스트를 함께 전달합니다.
 */
public record RetrievedContext(
	int hits,
	PackedContext packed
) {
	public RetrievedContext {
		if (hits < 0) {
			throw new IllegalArgumentException("hits cannot be negative");
		}
		if (packed == null) {
			throw new IllegalArgumentException("packed cannot be null");
		}
	}

	public static RetrievedContext empty(int budget) {
		return new RetrievedContext(0, PackedContext.empty(budget));
	}
}
