package com.study.webflux.orchestrator.domain.provider.model;

/**
 * 오케스트레이터에 연결된 세 가지 고정 프로바이더 역할입니다.
 */
public enum ProviderRole {
	FAST("fast"),
	PRIMARY("primary"),
	PRECISION("precision");

	private final String value;

	ProviderRole(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}
}
