package com.study.webflux.orchestrator.fixture;

import java.util.List;

import com.study.webflux.orchestrator.domain.stream.model.EventKind;
import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;

public final class StreamEventFixture {

	private StreamEventFixture() {
	}

	public static List<StreamEvent> ofKind(List<StreamEvent> events, EventKind kind) {
		return events.stream().filter(event -> event.kind() == kind).toList();
	}

	public static List<StreamEvent> labeled(List<StreamEvent> events, String label) {
		return events.stream().filter(event -> label.equals(event.label())).toList();
	}

	public static String status(StreamEvent event) {
		return String.valueOf(event.payload().get("status"));
	}

	public static String text(StreamEvent event) {
		return String.valueOf(event.payload().get("text"));
	}
}
