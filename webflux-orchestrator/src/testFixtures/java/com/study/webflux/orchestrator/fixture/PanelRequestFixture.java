package com.study.webflux.orchestrator.fixture;

import java.util.List;

import com.study.webflux.orchestrator.application.dto.PanelRequest;

public final class PanelRequestFixture {

	public static final String DEFAULT_PROMPT = "What should we fix first?";

	private PanelRequestFixture() {
	}

	public static PanelRequest create(String... personas) {
		return new PanelRequest(DEFAULT_PROMPT, List.of(personas), 0, 0.2);
	}

	public static PanelRequest withTopK(int topK, String... personas) {
		return new PanelRequest(DEFAULT_PROMPT, List.of(personas), topK, 0.2);
	}

	public static PanelRequest defaultRoster() {
		return new PanelRequest(DEFAULT_PROMPT, List.of(), 0, 0.2);
	}
}
