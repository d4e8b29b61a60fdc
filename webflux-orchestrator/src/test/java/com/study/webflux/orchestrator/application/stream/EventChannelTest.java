package com.study.webflux.orchestrator.application.stream;

import com.study.webflux.orchestrator.domain.stream.model.EventKind;
import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class EventChannelTest {

	@Test
	@DisplayName("첫 종료 이벤트 이후의 이벤트는 버린다")
	void emit_dropsEventsAfterTerminal() {
		EventChannel channel = new EventChannel();

		assertThat(channel.emit(StreamEvent.delta("Planner", "plan"))).isTrue();
		assertThat(channel.emit(StreamEvent.done())).isTrue();
		assertThat(channel.emit(StreamEvent.delta("Planner", "late"))).isFalse();
		assertThat(channel.emit(StreamEvent.error("late"))).isFalse();

		StepVerifier.create(channel.events())
			.expectNextMatches(event -> event.kind() == EventKind.DELTA)
			.expectNextMatches(event -> event.kind() == EventKind.DONE)
			.verifyComplete();
	}

	@Test
	@DisplayName("label이 있는 error는 스트림을 끝내지 않는다")
	void emit_labeledErrorIsNotTerminal() {
		EventChannel channel = new EventChannel();

		channel.emit(StreamEvent.error("cmo", "overloaded"));

		assertThat(channel.isTerminated()).isFalse();
		assertThat(channel.emit(StreamEvent.delta("cmo", "retry"))).isTrue();
	}

	@Test
	@DisplayName("종료 이벤트 없이 완료되면 종료 error를 보낸다")
	void complete_withoutTerminalEmitsError() {
		EventChannel channel = new EventChannel();
		channel.emit(StreamEvent.phaseBegin("planner"));

		channel.complete();

		StepVerifier.create(channel.events())
			.expectNextMatches(event -> event.kind() == EventKind.PHASE)
			.expectNextMatches(event -> event.kind() == EventKind.ERROR
				&& EventChannel.MISSING_TERMINAL_MESSAGE.equals(event.payload().get("message")))
			.verifyComplete();
	}

	@Test
	@DisplayName("이미 done을 보냈다면 완료 시 추가 이벤트가 없다")
	void complete_afterDoneIsNoop() {
		EventChannel channel = new EventChannel();
		channel.emit(StreamEvent.done());

		channel.complete();

		StepVerifier.create(channel.events()).expectNextCount(1).verifyComplete();
	}

	@Test
	@DisplayName("예외는 메시지를 담은 종료 error로 바뀐다")
	void fail_emitsTerminalError() {
		EventChannel channel = new EventChannel();

		channel.fail(new IllegalStateException("boom"));

		assertThat(channel.isTerminated()).isTrue();
		StepVerifier.create(channel.events())
			.expectNextMatches(event -> "boom".equals(event.payload().get("message")))
			.verifyComplete();
	}

	@Test
	@DisplayName("채널이 닫히면 이후 이벤트를 버리고 종료 신호를 보낸다")
	void close_dropsFurtherEvents() {
		EventChannel channel = new EventChannel();

		channel.close();

		assertThat(channel.isClosed()).isTrue();
		assertThat(channel.emit(StreamEvent.delta("Primary", "text"))).isFalse();
		StepVerifier.create(channel.whenTerminated()).verifyComplete();
	}
}
