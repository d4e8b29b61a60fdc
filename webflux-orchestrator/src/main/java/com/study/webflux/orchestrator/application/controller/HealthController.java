package com.study.webflux.orchestrator.application.controller;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@Tag(name = "헬스체크 API", description = "프로세스 생존 확인")
@RestController
public class HealthController {

	private final Instant startedAt = Instant.now();

	@Operation(summary = "헬스체크", description = "부수 효과 없이 프로세스 상태와 가동 시간을 반환합니다")
	@GetMapping({"/health", "/healthz"})
	public Mono<Map<String, Object>> health() {
		Instant now = Instant.now();
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("ok", true);
		body.put("timestamp", now.toString());
		body.put("uptimeSeconds", Duration.between(startedAt, now).toSeconds());
		return Mono.just(body);
	}
}
