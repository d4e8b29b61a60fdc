package com.study.webflux.orchestrator.infrastructure.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfiguration {

	@Bean
	public OpenAPI openAPI() {
		return new OpenAPI()
			.info(new Info()
				.title("Boardroom Orchestrator API")
				.description("Streaming chain and panel orchestration over multiple LLM providers")
				.version("0.1.0"));
	}
}
