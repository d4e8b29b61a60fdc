package com.study.webflux.orchestrator.application.stream;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 요청 하나의 이벤트를 클라이언트 연결로 전달하는 채널입니다.
 *
 * <p>
 * 첫 번째 종료 이벤트 이후와 채널이 닫힌 이후의 이벤트는 버립니다. 오케스트레이션은 채널과 분리되어 구독되므로 채널이 닫혀도 진행 중인 프로바이더 호출은 계속됩니다.
 */
@Slf4j
public class EventChannel {

	static final String MISSING_TERMINAL_MESSAGE = "orchestration ended without a terminal event";

	private final Sinks.Many<StreamEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
	private final Sinks.Empty<Void> terminated = Sinks.empty();
	private boolean terminal;
	private boolean closed;

	/**
	 * 이벤트를 기록합니다. 종료 이벤트이면 채널을 완료합니다.
	 *
	 * @return 이벤트가 클라이언트로 전달될 수 있으면 true
	 */
	public synchronized boolean emit(StreamEvent event) {
		if (terminal || closed) {
			log.debug("채널 종료 후 이벤트 무시 - kind: {}", event.kind());
			return false;
		}
		sink.tryEmitNext(event);
		if (event.isTerminal()) {
			terminal = true;
			sink.tryEmitComplete();
			terminated.tryEmitEmpty();
		}
		return true;
	}

	/** 오케스트레이션에서 새어 나온 예외를 종료 error 이벤트로 바꿉니다. */
	public void fail(Throwable error) {
		log.error("오케스트레이션 실패: {}", error.getMessage(), error);
		emit(StreamEvent.error(error.getMessage() != null
			? error.getMessage()
			: error.getClass().getSimpleName()));
	}

	/** 오케스트레이션이 종료 이벤트 없이 끝나면 종료 error 이벤트를 보냅니다. */
	public void complete() {
		if (!isTerminated()) {
			emit(StreamEvent.error(MISSING_TERMINAL_MESSAGE));
		}
	}

	/** 클라이언트 연결이 끊겼을 때 호출합니다. */
	public synchronized void close() {
		if (closed) {
			return;
		}
		closed = true;
		terminated.tryEmitEmpty();
	}

	public synchronized boolean isTerminated() {
		return terminal;
	}

	public synchronized boolean isClosed() {
		return closed;
	}

	public Flux<StreamEvent> events() {
		return sink.asFlux();
	}

	/** 종료 이벤트가 나가거나 채널이 닫히면 완료됩니다. */
	public Mono<Void> whenTerminated() {
		return terminated.asMono();
	}
}
