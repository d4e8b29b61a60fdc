package com.study.webflux.orchestrator.infrastructure.common.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

@Configuration
public class WebFluxCorsConfiguration implements WebFluxConfigurer {

	private static final List<String> STREAM_PATHS = List.of("/v1/**", "/api/**");

	private final List<String> allowedOrigins;

	public WebFluxCorsConfiguration(
		@Value("${web.cors.allowed-origins:}") List<String> allowedOrigins) {
		this.allowedOrigins = allowedOrigins.stream().map(String::trim)
			.filter(origin -> !origin.isBlank()).toList();
	}

	@Override
	public void addCorsMappings(CorsRegistry registry) {
		if (allowedOrigins.isEmpty()) {
			return;
		}

		for (String path : STREAM_PATHS) {
			registry.addMapping(path)
				.allowedOrigins(allowedOrigins.toArray(String[]::new))
				.allowedMethods("GET", "POST", "OPTIONS")
				.allowedHeaders("*")
				.exposedHeaders("X-Request-Id")
				.maxAge(3600);
		}
	}
}
