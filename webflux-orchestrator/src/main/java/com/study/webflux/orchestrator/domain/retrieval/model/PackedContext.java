package com.study.webflux.orchestrator.domain.retrieval.model;

import java.util.List;
import java.util.StringJoiner;

/**
 * 문자 예산 안에 들어오는 스니펫만 순서대로 담은 컨텍스트입니다.
 *
 * <p>
 * 요청당 한 번만 생성되며 모든 홉/페르소나 태스크가 같은 인스턴스를 읽기 전용으로 공유합니다.
 */
public record PackedContext(
	List<ContextSnippet> snippets,
	int budget
) {
	/** 스니펫 하나당 구분자로 계산되는 문자 수입니다. */
	public static final int SEPARATOR_LENGTH = 2;

	private static final String EMPTY_BLOCK = "Context: (none provided)";

	public PackedContext {
		snippets = snippets == null ? List.of() : List.copyOf(snippets);
		if (budget < 0) {
			throw new IllegalArgumentException("budget cannot be negative");
		}
		int used = packedLength(snippets);
		if (used > budget) {
			throw new IllegalArgumentException(
				"packed length " + used + " exceeds budget " + budget);
		}
	}

	public static PackedContext empty(int budget) {
		return new PackedContext(List.of(), budget);
	}

	public boolean isEmpty() {
		return snippets.isEmpty();
	}

	public int size() {
		return snippets.size();
	}

	/** 포함된 스니펫 길이와 구분자 길이의 합입니다. */
	public int packedLength() {
		return packedLength(snippets);
	}

	/**
	 * LLM 프롬프트에 주입할 컨텍스트 블록을 생성합니다.
	 */
	public String render() {
		if (snippets.isEmpty()) {
			return EMPTY_BLOCK;
		}
		StringJoiner joiner = new StringJoiner("\n\n", "Context:\n", "");
		for (int i = 0; i < snippets.size(); i++) {
			joiner.add("(" + (i + 1) + ") " + snippets.get(i).text());
		}
		return joiner.toString();
	}

	private static int packedLength(List<ContextSnippet> snippets) {
		int total = 0;
		for (ContextSnippet snippet : snippets) {
			total += snippet.text().length() + SEPARATOR_LENGTH;
		}
		return total;
	}
}
