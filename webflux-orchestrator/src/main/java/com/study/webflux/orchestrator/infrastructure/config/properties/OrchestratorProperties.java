package com.study.webflux.orchestrator.infrastructure.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;

/**
 * 프로세스 시작 시 한 번 읽는 오케스트레이터 설정입니다. 값은 환경 변수에서 주입됩니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

	private Providers providers = new Providers();
	private Retrieval retrieval = new Retrieval();
	private Stream stream = new Stream();

	@Getter
	@Setter
	public static class Providers {
		private Provider fast = new Provider("https://api.groq.com/openai", "llama3-8b-8192", 50,
			0.3, 800);
		private Provider primary = new Provider("https://api.openai.com", "gpt-4.1", 20, 0.4,
			1200);
		private Provider precision = new Provider("https://api.anthropic.com",
			"claude-3-5-sonnet-20240620", 20, 0.2, 1200);

		public Provider get(ProviderRole role) {
			return switch (role) {
				case FAST -> fast;
				case PRIMARY -> primary;
				case PRECISION -> precision;
			};
		}
	}

	@Getter
	@Setter
	public static class Provider {
		private String apiKey;
		private String baseUrl;
		private String model;
		private int concurrency;
		private double temperature;
		private int maxTokens;

		public Provider() {
		}

		public Provider(String baseUrl, String model, int concurrency, double temperature,
			int maxTokens) {
			this.baseUrl = baseUrl;
			this.model = model;
			this.concurrency = concurrency;
			this.temperature = temperature;
			this.maxTokens = maxTokens;
		}

		public boolean hasApiKey() {
			return apiKey != null && !apiKey.isBlank();
		}
	}

	@Getter
	@Setter
	public static class Retrieval {
		private String url;
		private String serviceKey;
		private String function = "match_documents";
		private int maxContextChars = 6000;

		public boolean isConfigured() {
			return url != null && !url.isBlank();
		}
	}

	@Getter
	@Setter
	public static class Stream {
		private Duration keepAliveInterval = Duration.ofSeconds(15);
	}
}
