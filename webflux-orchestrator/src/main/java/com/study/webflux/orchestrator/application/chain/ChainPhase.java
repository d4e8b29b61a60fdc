package com.study.webflux.orchestrator.application.chain;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;

/**
 * 체인 파이프라인의 홉입니다. phase 이벤트 label, delta 이벤트 label, 담당 프로바이더 역할을 함께 가집니다.
 */
public enum ChainPhase {
	RETRIEVAL("retrieval", null, null, null),
	PLANNER("planner", "Planner", ProviderRole.FAST, "planner-system"),
	PRIMARY("primary", "Primary", ProviderRole.PRIMARY, "primary-system"),
	REFINER("refiner", "Refiner", ProviderRole.PRECISION, "refiner-system");

	private final String label;
	private final String deltaLabel;
	private final ProviderRole role;
	private final String systemTemplate;

	ChainPhase(String label, String deltaLabel, ProviderRole role, String systemTemplate) {
		this.label = label;
		this.deltaLabel = deltaLabel;
		this.role = role;
		this.systemTemplate = systemTemplate;
	}

	public String label() {
		return label;
	}

	public String deltaLabel() {
		return deltaLabel;
	}

	public ProviderRole role() {
		return role;
	}

	public String systemTemplate() {
		return systemTemplate;
	}
}
