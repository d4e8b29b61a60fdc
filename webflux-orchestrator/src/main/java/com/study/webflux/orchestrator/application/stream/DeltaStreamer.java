package com.study.webflux.orchestrator.application.stream;

import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

import com.study.webflux.orchestrator.domain.stream.exception.RequestValidationException;
import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;
import com.study.webflux.orchestrator.infrastructure.config.properties.OrchestratorProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 요청 본문을 검증하고 오케스트레이션 이벤트를 SSE 프레임으로 중계합니다.
 *
 * <p>
 * 잘못된 요청도 200 스트림으로 응답하며 error 이벤트 하나만 보냅니다. 수락된 요청은 accepted 이벤트로 시작해 정확히 하나의 종료 이벤트(done 또는 error)로 끝납니다.
 */
@Slf4j
@Component
public class DeltaStreamer {

	static final String KEEP_ALIVE_COMMENT = "keep-alive";
	static final String MISSING_BODY_MESSAGE = "request body is required";
	static final String INVALID_BODY_MESSAGE = "invalid request body";
	static final String UNSUPPORTED_CONTENT_TYPE_MESSAGE = "request body must be application/json";

	private final Validator validator;
	private final Duration keepAliveInterval;

	public DeltaStreamer(Validator validator, OrchestratorProperties properties) {
		this.validator = validator;
		this.keepAliveInterval = properties.getStream().getKeepAliveInterval();
	}

	/**
	 * @param body 디코딩 전 요청 본문
	 * @param orchestration 검증된 요청으로 이벤트 스트림을 만드는 함수
	 * @param onAccepted 요청이 수락되어 requestId가 발급될 때 호출됩니다
	 */
	public <T> Flux<ServerSentEvent<Map<String, Object>>> stream(Mono<T> body,
		Function<T, Flux<StreamEvent>> orchestration,
		Consumer<String> onAccepted) {
		return body
			.switchIfEmpty(Mono.error(() -> new RequestValidationException(MISSING_BODY_MESSAGE)))
			.map(this::validate)
			.flatMapMany(request -> open(request, orchestration, onAccepted))
			.onErrorResume(this::isRejection, this::reject);
	}

	/**
	 * 요청을 거부하는 error 프레임 하나를 만듭니다. 본문 해석 이전에 실패한 요청에도 사용합니다.
	 */
	public Flux<ServerSentEvent<Map<String, Object>>> reject(Throwable error) {
		String message = rejectionMessage(error);
		log.info("요청 거부: {}", message);
		return Flux.just(toServerSentEvent(StreamEvent.error(message)));
	}

	private <T> Flux<ServerSentEvent<Map<String, Object>>> open(T request,
		Function<T, Flux<StreamEvent>> orchestration,
		Consumer<String> onAccepted) {
		String requestId = UUID.randomUUID().toString();
		onAccepted.accept(requestId);
		log.info("요청 수락 - requestId: {}, type: {}", requestId, request.getClass().getSimpleName());

		EventChannel channel = new EventChannel();
		channel.emit(StreamEvent.accepted(requestId));
		Flux.defer(() -> orchestration.apply(request))
			.subscribe(channel::emit, channel::fail, channel::complete);

		Flux<ServerSentEvent<Map<String, Object>>> events = channel.events()
			.map(this::toServerSentEvent)
			.doOnComplete(() -> log.info("스트림 종료 - requestId: {}", requestId));

		Flux<ServerSentEvent<Map<String, Object>>> heartbeat = Flux.interval(keepAliveInterval)
			.map(tick -> ServerSentEvent.<Map<String, Object>>builder()
				.comment(KEEP_ALIVE_COMMENT)
				.build())
			.takeUntilOther(channel.whenTerminated());

		return Flux.merge(events, heartbeat)
			.doOnCancel(() -> {
				log.debug("클라이언트 연결 종료 - requestId: {}", requestId);
				channel.close();
			});
	}

	private <T> T validate(T request) {
		Set<ConstraintViolation<T>> violations = validator.validate(request);
		if (violations.isEmpty()) {
			return request;
		}
		String message = violations.stream()
			.sorted(Comparator
				.comparing((ConstraintViolation<T> violation) -> violation.getPropertyPath().toString())
				.thenComparing(ConstraintViolation::getMessage))
			.map(ConstraintViolation::getMessage)
			.collect(Collectors.joining(", "));
		throw new RequestValidationException(message);
	}

	private boolean isRejection(Throwable error) {
		return error instanceof RequestValidationException
			|| error instanceof ServerWebInputException
			|| error instanceof DecodingException;
	}

	private String rejectionMessage(Throwable error) {
		if (error instanceof RequestValidationException) {
			return error.getMessage();
		}
		if (error instanceof UnsupportedMediaTypeStatusException) {
			return UNSUPPORTED_CONTENT_TYPE_MESSAGE;
		}
		Throwable cause = NestedExceptionUtils.getMostSpecificCause(error);
		if (cause instanceof IllegalArgumentException && cause.getMessage() != null) {
			return INVALID_BODY_MESSAGE + ": " + cause.getMessage();
		}
		return INVALID_BODY_MESSAGE;
	}

	ServerSentEvent<Map<String, Object>> toServerSentEvent(StreamEvent event) {
		return ServerSentEvent.<Map<String, Object>>builder()
			.event(event.kind().getWireName())
			.data(event.toData())
			.build();
	}
}
