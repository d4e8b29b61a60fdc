package com.study.webflux.orchestrator.domain.stream.model;

public enum EventKind {
	ACCEPTED("accepted"),
	START("start"),
	PHASE("phase"),
	DELTA("delta"),
	ERROR("error"),
	DONE("done");

	private final String wireName;

	EventKind(String wireName) {
		this.wireName = wireName;
	}

	public String getWireName() {
		return wireName;
	}
}
