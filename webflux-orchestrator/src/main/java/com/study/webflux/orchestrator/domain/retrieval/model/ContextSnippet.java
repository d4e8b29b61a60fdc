package com.study.webflux.orchestrator.domain.retrieval.model;

public record ContextSnippet(
	String text,
	String source
) {
	public ContextSnippet {
		if (text == null) {
			throw new IllegalArgumentException("text cannot be null");
		}
	}

	public static ContextSnippet of(String text) {
		return new ContextSnippet(text, null);
	}

	public static ContextSnippet of(String text, String source) {
		return new ContextSnippet(text, source);
	}

	public boolean hasSource() {
		return source != null && !source.isBlank();
	}
}
