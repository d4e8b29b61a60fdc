package com.study.webflux.orchestrator.domain.stream.model;

public enum PhaseStatus {
	BEGIN("begin"),
	END("end");

	private final String value;

	PhaseStatus(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}
}
