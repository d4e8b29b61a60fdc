package com.study.webflux.orchestrator.application.controller;

import java.util.Map;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

import com.study.webflux.orchestrator.application.chain.ChainOrchestrator;
import com.study.webflux.orchestrator.application.controller.docs.OrchestrationApi;
import com.study.webflux.orchestrator.application.dto.ChainRequest;
import com.study.webflux.orchestrator.application.dto.PanelRequest;
import com.study.webflux.orchestrator.application.panel.PanelOrchestrator;
import com.study.webflux.orchestrator.application.stream.DeltaStreamer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class OrchestrationController implements OrchestrationApi {

	static final String REQUEST_ID_HEADER = "X-Request-Id";

	private final DeltaStreamer deltaStreamer;
	private final ChainOrchestrator chainOrchestrator;
	private final PanelOrchestrator panelOrchestrator;

	@PostMapping(path = {"/v1/debate", "/api/v1/debate"},
		produces = MediaType.TEXT_EVENT_STREAM_VALUE)
	public Flux<ServerSentEvent<Map<String, Object>>> debate(
		@RequestBody(required = false) Mono<ChainRequest> request,
		ServerHttpResponse response) {
		applyStreamHeaders(response);
		return deltaStreamer.stream(request,
			chainOrchestrator::orchestrate,
			requestId -> response.getHeaders().set(REQUEST_ID_HEADER, requestId));
	}

	@PostMapping(path = {"/v1/boardroom", "/api/v1/boardroom"},
		produces = MediaType.TEXT_EVENT_STREAM_VALUE)
	public Flux<ServerSentEvent<Map<String, Object>>> boardroom(
		@RequestBody(required = false) Mono<PanelRequest> request,
		ServerHttpResponse response) {
		applyStreamHeaders(response);
		return deltaStreamer.stream(request,
			panelOrchestrator::orchestrate,
			requestId -> response.getHeaders().set(REQUEST_ID_HEADER, requestId));
	}

	/** JSON이 아닌 본문도 스트림 응답의 error 이벤트 하나로 거부합니다. */
	@ExceptionHandler(UnsupportedMediaTypeStatusException.class)
	public ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>> handleUnsupportedMediaType(
		UnsupportedMediaTypeStatusException exception,
		ServerHttpResponse response) {
		applyStreamHeaders(response);
		return ResponseEntity.ok()
			.contentType(MediaType.TEXT_EVENT_STREAM)
			.body(deltaStreamer.reject(exception));
	}

	private void applyStreamHeaders(ServerHttpResponse response) {
		HttpHeaders headers = response.getHeaders();
		headers.setCacheControl("no-cache, no-transform");
		headers.set("X-Accel-Buffering", "no");
	}
}
