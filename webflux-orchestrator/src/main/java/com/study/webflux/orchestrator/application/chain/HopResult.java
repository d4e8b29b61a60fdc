package com.study.webflux.orchestrator.application.chain;

import com.study.webflux.orchestrator.domain.provider.exception.ProviderUnavailableException;

/**
 * 홉 하나의 결과입니다. 실패한 홉은 다음 홉의 입력으로 쓰일 placeholder 텍스트를 가집니다.
 */
public record HopResult(
	ChainPhase phase,
	String text,
	boolean failed
) {
	public static HopResult success(ChainPhase phase, String text) {
		return new HopResult(phase, text == null ? "" : text, false);
	}

	public static HopResult failure(ChainPhase phase, Throwable error) {
		return new HopResult(phase, placeholder(phase, error), true);
	}

	static String placeholder(ChainPhase phase, Throwable error) {
		if (error instanceof ProviderUnavailableException) {
			return "[" + phase.label() + " unavailable]";
		}
		String message = error.getMessage() != null
			? error.getMessage()
			: error.getClass().getSimpleName();
		return "[" + phase.label() + " error] " + message;
	}
}
