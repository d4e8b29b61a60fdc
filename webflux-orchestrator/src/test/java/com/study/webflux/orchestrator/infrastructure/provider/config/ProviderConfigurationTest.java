package com.study.webflux.orchestrator.infrastructure.provider.config;

import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.orchestrator.domain.provider.exception.ProviderUnavailableException;
import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import com.study.webflux.orchestrator.domain.provider.port.LlmPortRegistry;
import com.study.webflux.orchestrator.infrastructure.config.properties.OrchestratorProperties;
import com.study.webflux.orchestrator.infrastructure.provider.adapter.SpringAiLlmAdapter;
import com.study.webflux.orchestrator.infrastructure.provider.adapter.UnconfiguredLlmAdapter;
import com.study.webflux.orchestrator.infrastructure.provider.pool.ProviderPoolManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderConfigurationTest {

	private final ProviderConfiguration configuration = new ProviderConfiguration();

	@Test
	@DisplayName("API 키가 없는 역할은 unavailable 어댑터로 연결된다")
	void llmPortRegistry_withoutKeys() {
		LlmPortRegistry registry = configuration.llmPortRegistry(new OrchestratorProperties(),
			WebClient.builder());

		for (ProviderRole role : ProviderRole.values()) {
			assertThat(registry.get(role)).isInstanceOf(UnconfiguredLlmAdapter.class);
		}
		StepVerifier.create(registry.get(ProviderRole.FAST)
			.complete(ProviderTask.of(ProviderRole.FAST, "", "plan")))
			.expectError(ProviderUnavailableException.class)
			.verify();
	}

	@Test
	@DisplayName("API 키가 있는 역할은 Spring AI 어댑터로 연결된다")
	void llmPortRegistry_withKeys() {
		OrchestratorProperties properties = new OrchestratorProperties();
		properties.getProviders().getFast().setApiKey("gsk-test");
		properties.getProviders().getPrecision().setApiKey("sk-ant-test");

		LlmPortRegistry registry = configuration.llmPortRegistry(properties, WebClient.builder());

		assertThat(registry.get(ProviderRole.FAST)).isInstanceOf(SpringAiLlmAdapter.class);
		assertThat(registry.get(ProviderRole.PRIMARY)).isInstanceOf(UnconfiguredLlmAdapter.class);
		assertThat(registry.get(ProviderRole.PRECISION)).isInstanceOf(SpringAiLlmAdapter.class);
	}

	@Test
	@DisplayName("풀 한도는 역할별 설정값을 따른다")
	void providerPoolManager_usesConfiguredLimits() {
		OrchestratorProperties properties = new OrchestratorProperties();
		properties.getProviders().getPrimary().setConcurrency(3);

		ProviderPoolManager poolManager = configuration.providerPoolManager(properties);

		assertThat(poolManager.pool(ProviderRole.FAST).capacity()).isEqualTo(50);
		assertThat(poolManager.pool(ProviderRole.PRIMARY).capacity()).isEqualTo(3);
		assertThat(poolManager.pool(ProviderRole.PRECISION).capacity()).isEqualTo(20);
	}
}
