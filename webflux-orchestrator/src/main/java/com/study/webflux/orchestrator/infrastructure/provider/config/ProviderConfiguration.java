package com.study.webflux.orchestrator.infrastructure.provider.config;

import java.util.EnumMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import com.study.webflux.orchestrator.domain.provider.port.LlmPort;
import com.study.webflux.orchestrator.domain.provider.port.LlmPortRegistry;
import com.study.webflux.orchestrator.infrastructure.config.properties.OrchestratorProperties;
import com.study.webflux.orchestrator.infrastructure.provider.adapter.SpringAiLlmAdapter;
import com.study.webflux.orchestrator.infrastructure.provider.adapter.UnconfiguredLlmAdapter;
import com.study.webflux.orchestrator.infrastructure.provider.pool.ProviderPoolManager;

/**
 * 세 가지 고정 프로바이더 역할(FAST: Groq, PRIMARY: OpenAI, PRECISION: Anthropic)의 모델과 풀을 구성합니다.
 */
@Slf4j
@Configuration
public class ProviderConfiguration {

	/** 역할별 동시성 한도를 가진 풀 매니저를 생성합니다. */
	@Bean
	public ProviderPoolManager providerPoolManager(OrchestratorProperties properties) {
		Map<ProviderRole, Integer> limits = new EnumMap<>(ProviderRole.class);
		for (ProviderRole role : ProviderRole.values()) {
			int concurrency = properties.getProviders().get(role).getConcurrency();
			limits.put(role, concurrency);
			log.info("{} 프로바이더 풀 동시성 한도: {}", role.getValue(), concurrency);
		}
		return new ProviderPoolManager(limits);
	}

	/** 역할별 LLM 포트를 생성합니다. API 키가 없는 역할은 항상 실패하는 어댑터를 사용합니다. */
	@Bean
	public LlmPortRegistry llmPortRegistry(OrchestratorProperties properties,
		WebClient.Builder webClientBuilder) {
		Map<ProviderRole, LlmPort> ports = new EnumMap<>(ProviderRole.class);
		for (ProviderRole role : ProviderRole.values()) {
			OrchestratorProperties.Provider config = properties.getProviders().get(role);
			if (!config.hasApiKey()) {
				log.warn("{} 프로바이더 API 키가 설정되지 않았습니다. 호출은 unavailable로 처리됩니다",
					role.getValue());
				ports.put(role, new UnconfiguredLlmAdapter(role));
				continue;
			}
			ChatModel chatModel = createChatModel(role, config, webClientBuilder.clone());
			ports.put(role, new SpringAiLlmAdapter(role, chatModel, config.getModel()));
		}
		return new LlmPortRegistry(ports);
	}

	private ChatModel createChatModel(ProviderRole role,
		OrchestratorProperties.Provider config,
		WebClient.Builder webClientBuilder) {
		return switch (role) {
			case FAST, PRIMARY -> openAiCompatibleModel(config, webClientBuilder);
			case PRECISION -> anthropicModel(config, webClientBuilder);
		};
	}

	private ChatModel openAiCompatibleModel(OrchestratorProperties.Provider config,
		WebClient.Builder webClientBuilder) {
		OpenAiApi api = OpenAiApi.builder()
			.baseUrl(config.getBaseUrl())
			.apiKey(config.getApiKey())
			.webClientBuilder(webClientBuilder)
			.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
			.model(config.getModel())
			.temperature(config.getTemperature())
			.maxTokens(config.getMaxTokens())
			.build();
		return OpenAiChatModel.builder()
			.openAiApi(api)
			.defaultOptions(options)
			.retryTemplate(singleAttempt())
			.build();
	}

	private ChatModel anthropicModel(OrchestratorProperties.Provider config,
		WebClient.Builder webClientBuilder) {
		AnthropicApi api = AnthropicApi.builder()
			.baseUrl(config.getBaseUrl())
			.apiKey(config.getApiKey())
			.webClientBuilder(webClientBuilder)
			.build();
		AnthropicChatOptions options = AnthropicChatOptions.builder()
			.model(config.getModel())
			.temperature(config.getTemperature())
			.maxTokens(config.getMaxTokens())
			.build();
		return AnthropicChatModel.builder()
			.anthropicApi(api)
			.defaultOptions(options)
			.retryTemplate(singleAttempt())
			.build();
	}

	/** 자동 재시도는 하지 않습니다. 패널 페르소나의 단일 fallback만 재시도로 취급합니다. */
	private RetryTemplate singleAttempt() {
		return RetryTemplate.builder().maxAttempts(1).build();
	}
}
