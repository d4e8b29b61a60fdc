package com.study.webflux.orchestrator.infrastructure.retrieval.adapter;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.orchestrator.domain.retrieval.model.ContextSnippet;
import com.study.webflux.orchestrator.domain.retrieval.port.RetrievalPort;
import reactor.core.publisher.Mono;

/** pgvector 유사도 검색 RPC(PostgREST)를 호출하는 검색 어댑터입니다. */
@Slf4j
public class SupabaseRpcRetrievalAdapter implements RetrievalPort {

	private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS = new ParameterizedTypeReference<>() {
	};

	private final WebClient webClient;
	private final String function;

	public SupabaseRpcRetrievalAdapter(WebClient.Builder webClientBuilder,
		String baseUrl,
		String serviceKey,
		String function) {
		this.function = function;
		WebClient.Builder builder = webClientBuilder.baseUrl(normalizeBaseUrl(baseUrl));
		if (serviceKey != null && !serviceKey.isBlank()) {
			builder.defaultHeader("apikey", serviceKey)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + serviceKey);
		}
		this.webClient = builder.build();
	}

	@Override
	public Mono<List<ContextSnippet>> search(String query, int topK) {
		return webClient.post()
			.uri("/rest/v1/rpc/{function}", function)
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("query_text", query, "match_count", topK))
			.retrieve()
			.onStatus(status -> status.is4xxClientError() || status.is5xxServerError(),
				response -> response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.doOnNext(body -> log.error("검색 RPC 에러 - status: {}, body: {}",
						response.statusCode(),
						body))
					.then(Mono.error(new IllegalStateException(
						"검색 RPC 에러: " + response.statusCode()))))
			.bodyToMono(ROWS)
			.map(this::toSnippets)
			.doOnNext(snippets -> log.debug("검색 완료: {} hits", snippets.size()));
	}

	private List<ContextSnippet> toSnippets(List<Map<String, Object>> rows) {
		return rows.stream()
			.filter(Objects::nonNull)
			.map(this::toSnippet)
			.filter(Objects::nonNull)
			.toList();
	}

	private ContextSnippet toSnippet(Map<String, Object> row) {
		String text = firstNonBlank(row.get("content"), row.get("text"));
		if (text == null) {
			return null;
		}
		return ContextSnippet.of(text, resolveSource(row));
	}

	private String resolveSource(Map<String, Object> row) {
		Object source = row.get("source");
		if (source == null && row.get("metadata") instanceof Map<?, ?> metadata) {
			source = metadata.get("source");
		}
		return source == null ? null : source.toString();
	}

	private String firstNonBlank(Object... candidates) {
		for (Object candidate : candidates) {
			if (candidate != null && !candidate.toString().isBlank()) {
				return candidate.toString();
			}
		}
		return null;
	}

	private String normalizeBaseUrl(String baseUrl) {
		String normalized = baseUrl.trim();
		if (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}
}
