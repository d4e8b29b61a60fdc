package com.study.webflux.orchestrator.domain.retrieval.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.study.webflux.orchestrator.domain.retrieval.model.ContextSnippet;
import com.study.webflux.orchestrator.domain.retrieval.model.PackedContext;

/**
 * 스니펫 목록을 문자 예산에 맞춰 잘라내는 순수 함수입니다.
 *
 * <p>
 * 스니펫은 통째로만 포함되며, 다음 스니펫이 예산을 넘기면 그 지점에서 패킹을 멈춥니다.
 */
public final class ContextPacker {

	public static final int DEFAULT_MAX_CHARS = 6000;

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final int OVERFLOW_MARGIN = 4;

	private ContextPacker() {
	}

	public static PackedContext pack(List<ContextSnippet> snippets) {
		return pack(snippets, DEFAULT_MAX_CHARS);
	}

	public static PackedContext pack(List<ContextSnippet> snippets, int maxChars) {
		if (maxChars < 0) {
			throw new IllegalArgumentException("maxChars cannot be negative");
		}
		if (snippets == null || snippets.isEmpty()) {
			return PackedContext.empty(maxChars);
		}

		List<ContextSnippet> packed = new ArrayList<>();
		int used = 0;
		for (ContextSnippet raw : snippets) {
			if (raw == null) {
				continue;
			}
			String text = normalize(raw.text());
			if (text.isEmpty()) {
				continue;
			}
			if (used + text.length() + OVERFLOW_MARGIN > maxChars) {
				break;
			}
			packed.add(new ContextSnippet(text, raw.source()));
			used += text.length() + PackedContext.SEPARATOR_LENGTH;
		}
		return new PackedContext(packed, maxChars);
	}

	static String normalize(String text) {
		if (text == null) {
			return "";
		}
		return WHITESPACE.matcher(text).replaceAll(" ").trim();
	}
}
