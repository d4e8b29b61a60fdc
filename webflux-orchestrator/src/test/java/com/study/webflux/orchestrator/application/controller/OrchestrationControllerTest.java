package com.study.webflux.orchestrator.application.controller;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.study.webflux.orchestrator.application.chain.ChainOrchestrator;
import com.study.webflux.orchestrator.application.dto.ChainRequest;
import com.study.webflux.orchestrator.application.dto.ChainStrategy;
import com.study.webflux.orchestrator.application.dto.PanelRequest;
import com.study.webflux.orchestrator.application.panel.PanelOrchestrator;
import com.study.webflux.orchestrator.application.stream.DeltaStreamer;
import com.study.webflux.orchestrator.config.annotation.ControllerWebFluxTest;
import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;
import com.study.webflux.orchestrator.infrastructure.common.config.JacksonConfiguration;
import com.study.webflux.orchestrator.infrastructure.config.properties.OrchestratorProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.core.publisher.Flux;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ControllerWebFluxTest(OrchestrationController.class)
@Import({DeltaStreamer.class, JacksonConfiguration.class})
@EnableConfigurationProperties(OrchestratorProperties.class)
class OrchestrationControllerTest {

	private static final ParameterizedTypeReference<ServerSentEvent<Map<String, Object>>> SSE_TYPE = new ParameterizedTypeReference<>() {
	};

	@Autowired
	private WebTestClient webTestClient;

	@MockitoBean
	private ChainOrchestrator chainOrchestrator;

	@MockitoBean
	private PanelOrchestrator panelOrchestrator;

	@Test
	@DisplayName("체인 요청은 스트림 헤더와 함께 accepted부터 done까지 SSE로 응답한다")
	void debate_streamsEvents() {
		when(chainOrchestrator.orchestrate(any(ChainRequest.class))).thenReturn(Flux.just(
			StreamEvent.phaseBegin("planner"),
			StreamEvent.delta("Planner", "1. fix checkout"),
			StreamEvent.done()));

		FluxExchangeResult<ServerSentEvent<Map<String, Object>>> result = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "How do we lift conversion?"))
			.exchange()
			.expectStatus().isOk()
			.expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
			.expectHeader().valueEquals("Cache-Control", "no-cache, no-transform")
			.expectHeader().valueEquals("X-Accel-Buffering", "no")
			.returnResult(SSE_TYPE);

		List<ServerSentEvent<Map<String, Object>>> frames = result.getResponseBody()
			.collectList()
			.block();
		String requestId = result.getResponseHeaders().getFirst("X-Request-Id");

		assertThat(requestId).isNotBlank();
		assertThat(frames).extracting(ServerSentEvent::event)
			.containsExactly("accepted", "phase", "delta", "done");
		assertThat(frames.get(0).data()).containsEntry("requestId", requestId);
		assertThat(frames.get(2).data()).containsEntry("label", "Planner")
			.containsEntry("text", "1. fix checkout");
	}

	@Test
	@DisplayName("기본값이 채워진 요청이 오케스트레이터로 전달된다")
	void debate_appliesDefaults() {
		when(chainOrchestrator.orchestrate(any(ChainRequest.class)))
			.thenReturn(Flux.just(StreamEvent.done()));

		webTestClient.post()
			.uri("/api/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "  pricing page  "))
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.blockLast();

		verify(chainOrchestrator).orchestrate(new ChainRequest("pricing page", 6,
			ChainStrategy.DEFAULT));
	}

	@Test
	@DisplayName("검증에 실패한 요청도 200으로 error 이벤트 하나만 보낸다")
	void debate_invalidRequest() {
		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "hi", "topK", 21))
			.exchange()
			.expectStatus().isOk()
			.expectHeader().doesNotExist("X-Request-Id")
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).hasSize(1);
		assertThat(frames.get(0).event()).isEqualTo("error");
		verify(chainOrchestrator, never()).orchestrate(any(ChainRequest.class));
	}

	@Test
	@DisplayName("알 수 없는 strategy는 error 이벤트로 거부된다")
	void debate_unknownStrategy() {
		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "How do we lift conversion?", "strategy", "turbo"))
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event).containsExactly("error");
		assertThat(String.valueOf(frames.get(0).data().get("message")))
			.contains("strategy must be one of");
	}

	@Test
	@DisplayName("정수가 아닌 topK는 error 이벤트로 거부된다")
	void debate_fractionalTopK() {
		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue("{\"prompt\":\"How do we lift conversion?\",\"topK\":6.5}")
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event).containsExactly("error");
		verify(chainOrchestrator, never()).orchestrate(any(ChainRequest.class));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{\"prompt\":\"How do we lift conversion?\",\"topK\":\"6\"}",
		"{\"prompt\":12345}",
		"{\"prompt\":true}"
	})
	@DisplayName("필드 타입이 맞지 않으면 변환하지 않고 error 이벤트로 거부된다")
	void debate_rejectsScalarCoercion(String body) {
		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(body)
			.exchange()
			.expectStatus().isOk()
			.expectHeader().doesNotExist("X-Request-Id")
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event).containsExactly("error");
		verify(chainOrchestrator, never()).orchestrate(any(ChainRequest.class));
	}

	@Test
	@DisplayName("JSON이 아닌 Content-Type도 200 스트림의 error 이벤트로 거부된다")
	void debate_unsupportedContentType() {
		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.TEXT_PLAIN)
			.bodyValue("{\"prompt\":\"abcd\"}")
			.exchange()
			.expectStatus().isOk()
			.expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
			.expectHeader().valueEquals("Cache-Control", "no-cache, no-transform")
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event).containsExactly("error");
		assertThat(frames.get(0).data()).containsEntry("message", "request body must be application/json");
		verify(chainOrchestrator, never()).orchestrate(any(ChainRequest.class));
	}

	@Test
	@DisplayName("보드룸도 JSON이 아닌 본문과 빈 페르소나 이름을 error 이벤트로 거부한다")
	void boardroom_rejectsInvalidBodies() {
		List<ServerSentEvent<Map<String, Object>>> plainText = webTestClient.post()
			.uri("/v1/boardroom")
			.contentType(MediaType.TEXT_PLAIN)
			.bodyValue("prompt=What should we fix first?")
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();
		List<ServerSentEvent<Map<String, Object>>> blankNames = webTestClient.post()
			.uri("/v1/boardroom")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "What should we fix first?", "personas", List.of("", "")))
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(plainText).extracting(ServerSentEvent::event).containsExactly("error");
		assertThat(blankNames).extracting(ServerSentEvent::event).containsExactly("error");
		verify(panelOrchestrator, never()).orchestrate(any(PanelRequest.class));
	}

	@Test
	@DisplayName("본문이 비어 있으면 error 이벤트로 거부된다")
	void debate_emptyBody() {
		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/debate")
			.contentType(MediaType.APPLICATION_JSON)
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event).containsExactly("error");
	}

	@Test
	@DisplayName("보드룸 요청은 패널 오케스트레이터로 전달된다")
	void boardroom_streamsEvents() {
		when(panelOrchestrator.orchestrate(any(PanelRequest.class))).thenReturn(Flux.just(
			StreamEvent.start(Map.of("personas", 2)),
			StreamEvent.delta("cmo", "token"),
			StreamEvent.error("cfo", "overloaded"),
			StreamEvent.done()));

		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/api/v1/boardroom")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "What should we fix first?", "personas", List.of("cmo", "cfo"),
				"topK", 0))
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event)
			.containsExactly("accepted", "start", "delta", "error", "done");
		verify(panelOrchestrator).orchestrate(new PanelRequest("What should we fix first?",
			List.of("cmo", "cfo"), 0, 0.2));
	}

	@Test
	@DisplayName("페르소나가 12명을 넘으면 error 이벤트로 거부된다")
	void boardroom_tooManyPersonas() {
		List<String> personas = IntStream.range(0, 13).mapToObj(i -> "p" + i).toList();

		List<ServerSentEvent<Map<String, Object>>> frames = webTestClient.post()
			.uri("/v1/boardroom")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(Map.of("prompt", "What should we fix first?", "personas", personas))
			.exchange()
			.expectStatus().isOk()
			.returnResult(SSE_TYPE)
			.getResponseBody()
			.collectList()
			.block();

		assertThat(frames).extracting(ServerSentEvent::event).containsExactly("error");
		verify(panelOrchestrator, never()).orchestrate(any(PanelRequest.class));
	}
}
