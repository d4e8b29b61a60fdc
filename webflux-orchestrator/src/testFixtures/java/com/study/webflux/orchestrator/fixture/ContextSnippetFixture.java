package com.study.webflux.orchestrator.fixture;

import java.util.ArrayList;
import java.util.List;

import com.study.webflux.orchestrator.domain.retrieval.model.ContextSnippet;
import com.study.webflux.orchestrator.domain.retrieval.model.PackedContext;
import com.study.webflux.orchestrator.domain.retrieval.model.RetrievedContext;

public final class ContextSnippetFixture {

	private ContextSnippetFixture() {
	}

	public static ContextSnippet create(String text) {
		return ContextSnippet.of(text, "kb");
	}

	public static List<ContextSnippet> createList(int count) {
		List<ContextSnippet> snippets = new ArrayList<>(count);
		for (int i = 1; i <= count; i++) {
			snippets.add(create("snippet " + i));
		}
		return snippets;
	}

	public static ContextSnippet ofLength(int length) {
		return ContextSnippet.of("a".repeat(length));
	}

	public static RetrievedContext retrieved(String... texts) {
		List<ContextSnippet> snippets = new ArrayList<>();
		for (String text : texts) {
			snippets.add(create(text));
		}
		return new RetrievedContext(snippets.size(), new PackedContext(snippets, 6000));
	}
}
