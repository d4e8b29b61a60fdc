package com.study.webflux.orchestrator.infrastructure.retrieval.config;

import lombok.extern.slf4j.Slf4j;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.orchestrator.domain.retrieval.port.RetrievalPort;
import com.study.webflux.orchestrator.infrastructure.config.properties.OrchestratorProperties;
import com.study.webflux.orchestrator.infrastructure.retrieval.adapter.NoopRetrievalAdapter;
import com.study.webflux.orchestrator.infrastructure.retrieval.adapter.SupabaseRpcRetrievalAdapter;

/** 유사도 검색 저장소 어댑터 구성을 제공합니다. */
@Slf4j
@Configuration
public class RetrievalConfiguration {

	/** 검색 URL이 설정되어 있으면 RPC 어댑터를, 아니면 빈 결과 어댑터를 생성합니다. */
	@Bean
	public RetrievalPort retrievalPort(OrchestratorProperties properties,
		WebClient.Builder webClientBuilder) {
		OrchestratorProperties.Retrieval retrieval = properties.getRetrieval();
		if (!retrieval.isConfigured()) {
			log.warn("검색 저장소 URL이 설정되지 않아 컨텍스트 검색을 생략합니다");
			return new NoopRetrievalAdapter();
		}
		return new SupabaseRpcRetrievalAdapter(webClientBuilder.clone(),
			retrieval.getUrl(),
			retrieval.getServiceKey(),
			retrieval.getFunction());
	}
}
