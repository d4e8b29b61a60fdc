package com.study.webflux.orchestrator.domain.stream.exception;

/**
 * 인바운드 요청 본문이 스키마를 위반했을 때 발생합니다. 재시도하지 않습니다.
 */
public class RequestValidationException extends RuntimeException {

	public RequestValidationException(String message) {
		super(message);
	}

	public RequestValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
