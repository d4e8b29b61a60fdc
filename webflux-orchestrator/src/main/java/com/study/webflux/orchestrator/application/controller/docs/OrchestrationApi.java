package com.study.webflux.orchestrator.application.controller.docs;

import java.util.Map;

import com.study.webflux.orchestrator.application.dto.ChainRequest;
import com.study.webflux.orchestrator.application.dto.PanelRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(
	name = "오케스트레이션 API",
	description = "여러 LLM 프로바이더를 조합한 체인/패널 스트리밍 오케스트레이션"
)
public interface OrchestrationApi {

	@Operation(
		summary = "체인 오케스트레이션 스트리밍",
		description = "retrieval → planner → primary → refiner 순서로 실행하며 각 홉의 결과를 SSE 이벤트로 반환합니다. "
			+ "strategy가 single_pass이면 refiner가 토큰 단위로 스트리밍합니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "SSE 이벤트 스트림 (accepted, start, phase, delta, error, done). 잘못된 요청도 error 이벤트 하나로 응답합니다",
		content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)
	)
	Flux<ServerSentEvent<Map<String, Object>>> debate(
		Mono<ChainRequest> request,
		ServerHttpResponse response
	);

	@Operation(
		summary = "보드룸 패널 스트리밍",
		description = "요청한 페르소나들이 병렬로 응답하며 페르소나별 토큰이 섞여서 전달됩니다. "
			+ "모든 페르소나가 끝나면 done 이벤트를 한 번 보냅니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "SSE 이벤트 스트림 (accepted, start, phase, delta, error, done)",
		content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)
	)
	Flux<ServerSentEvent<Map<String, Object>>> boardroom(
		Mono<PanelRequest> request,
		ServerHttpResponse response
	);
}
