package com.study.webflux.orchestrator.domain.provider.exception;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;

/**
 * 단일 프로바이더 호출 실패를 나타냅니다.
 */
public class ProviderException extends RuntimeException {

	private final ProviderRole role;

	public ProviderException(ProviderRole role, String message) {
		super(message);
		this.role = role;
	}

	public ProviderException(ProviderRole role, String message, Throwable cause) {
		super(message, cause);
		this.role = role;
	}

	public ProviderRole getRole() {
		return role;
	}
}
