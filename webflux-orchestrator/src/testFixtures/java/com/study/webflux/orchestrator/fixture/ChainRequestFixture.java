package com.study.webflux.orchestrator.fixture;

import com.study.webflux.orchestrator.application.dto.ChainRequest;
import com.study.webflux.orchestrator.application.dto.ChainStrategy;

public final class ChainRequestFixture {

	public static final String DEFAULT_PROMPT = "How do we lift checkout conversion?";

	private ChainRequestFixture() {
	}

	public static ChainRequest create() {
		return new ChainRequest(DEFAULT_PROMPT, 6, ChainStrategy.DEFAULT);
	}

	public static ChainRequest withoutRetrieval() {
		return new ChainRequest(DEFAULT_PROMPT, 0, ChainStrategy.DEFAULT);
	}

	public static ChainRequest singlePass() {
		return new ChainRequest(DEFAULT_PROMPT, 0, ChainStrategy.SINGLE_PASS);
	}
}
