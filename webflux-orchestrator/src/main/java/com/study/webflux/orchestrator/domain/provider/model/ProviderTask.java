package com.study.webflux.orchestrator.domain.provider.model;

/**
 * 풀에서 스케줄링되는 단일 프로바이더 호출입니다.
 */
public record ProviderTask(
	ProviderRole role,
	String systemPrompt,
	String userPrompt,
	ModelOptions options
) {
	public ProviderTask {
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (userPrompt == null || userPrompt.isBlank()) {
			throw new IllegalArgumentException("userPrompt cannot be null or blank");
		}
		if (systemPrompt == null) {
			systemPrompt = "";
		}
		if (options == null) {
			options = ModelOptions.defaults();
		}
	}

	public static ProviderTask of(ProviderRole role, String systemPrompt, String userPrompt) {
		return new ProviderTask(role, systemPrompt, userPrompt, ModelOptions.defaults());
	}
}
