package com.study.webflux.orchestrator.domain.provider.exception;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;

/**
 * 자격 증명이 설정되지 않아 호출할 수 없는 프로바이더를 나타냅니다.
 */
public class ProviderUnavailableException extends ProviderException {

	public ProviderUnavailableException(ProviderRole role) {
		super(role, role.getValue() + " provider is not configured");
	}
}
