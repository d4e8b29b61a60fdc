package com.study.webflux.orchestrator.domain.stream.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 클라이언트 연결로 전달되는 유일한 산출물입니다.
 *
 * <p>
 * label이 없는 error와 done만 스트림을 종료하는 이벤트로 취급합니다. 페르소나 label이 붙은 error는 해당 페르소나의 진행 상황일 뿐입니다.
 */
public record StreamEvent(
	EventKind kind,
	String label,
	Map<String, Object> payload,
	Instant timestamp
) {
	public StreamEvent {
		if (kind == null) {
			throw new IllegalArgumentException("kind cannot be null");
		}
		payload = payload == null
			? Map.of()
			: Collections.unmodifiableMap(new LinkedHashMap<>(payload));
		if (timestamp == null) {
			timestamp = Instant.now();
		}
	}

	public static StreamEvent accepted(String requestId) {
		return of(EventKind.ACCEPTED, null, Map.of("requestId", requestId));
	}

	public static StreamEvent start(Map<String, Object> metadata) {
		return of(EventKind.START, null, metadata);
	}

	public static StreamEvent phaseBegin(String label) {
		return of(EventKind.PHASE, label, Map.of("status", PhaseStatus.BEGIN.getValue()));
	}

	public static StreamEvent phaseEnd(String label) {
		return of(EventKind.PHASE, label, Map.of("status", PhaseStatus.END.getValue()));
	}

	public static StreamEvent phaseEnd(String label, int hits) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("status", PhaseStatus.END.getValue());
		payload.put("hits", hits);
		return of(EventKind.PHASE, label, payload);
	}

	public static StreamEvent delta(String label, String text) {
		return of(EventKind.DELTA, label, Map.of("text", text == null ? "" : text));
	}

	public static StreamEvent error(String message) {
		return of(EventKind.ERROR, null, Map.of("message", safeMessage(message)));
	}

	public static StreamEvent error(String label, String message) {
		return of(EventKind.ERROR, label, Map.of("message", safeMessage(message)));
	}

	public static StreamEvent done() {
		return of(EventKind.DONE, null, Map.of("ok", true));
	}

	public boolean isTerminal() {
		return kind == EventKind.DONE || (kind == EventKind.ERROR && label == null);
	}

	public boolean hasLabel() {
		return label != null;
	}

	/**
	 * SSE data 프레임에 직렬화될 JSON 객체를 만듭니다.
	 */
	public Map<String, Object> toData() {
		Map<String, Object> data = new LinkedHashMap<>();
		if (label != null) {
			data.put("label", label);
		}
		data.putAll(payload);
		data.put("ts", timestamp.toEpochMilli());
		return data;
	}

	private static StreamEvent of(EventKind kind, String label, Map<String, Object> payload) {
		return new StreamEvent(kind, label, payload, Instant.now());
	}

	private static String safeMessage(String message) {
		return message == null || message.isBlank() ? "unknown error" : message;
	}
}
