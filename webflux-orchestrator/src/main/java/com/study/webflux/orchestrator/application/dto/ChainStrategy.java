package com.study.webflux.orchestrator.application.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 체인 실행 전략입니다. DEFAULT는 planner → primary → refiner, SINGLE_PASS는 planner → 스트리밍 refiner입니다.
 */
public enum ChainStrategy {
	DEFAULT("default"),
	SINGLE_PASS("single_pass");

	private final String value;

	ChainStrategy(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	@JsonCreator
	public static ChainStrategy fromValue(String value) {
		for (ChainStrategy strategy : values()) {
			if (strategy.value.equals(value)) {
				return strategy;
			}
		}
		throw new IllegalArgumentException("strategy must be one of: default, single_pass");
	}
}
