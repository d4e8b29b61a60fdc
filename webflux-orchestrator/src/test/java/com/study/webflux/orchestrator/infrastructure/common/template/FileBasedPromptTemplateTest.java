package com.study.webflux.orchestrator.infrastructure.common.template;

import java.io.UncheckedIOException;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileBasedPromptTemplateTest {

	private final FileBasedPromptTemplate promptTemplate = new FileBasedPromptTemplate();

	@Test
	@DisplayName("템플릿 변수를 치환한다")
	void load_replacesVariables() {
		String prompt = promptTemplate.load("persona-base", Map.of("persona", "Copy Chief"));

		assertThat(prompt).startsWith("You are Copy Chief.").doesNotContain("{{persona}}");
	}

	@Test
	@DisplayName("체인 시스템 프롬프트를 읽는다")
	void load_chainSystemPrompts() {
		assertThat(promptTemplate.load("planner-system")).startsWith("You are Planner");
		assertThat(promptTemplate.load("primary-system")).startsWith("You are the Primary Strategist");
		assertThat(promptTemplate.load("refiner-system")).startsWith("You are the Refiner");
	}

	@Test
	@DisplayName("없는 템플릿은 예외를 던진다")
	void load_missingTemplate() {
		assertThatThrownBy(() -> promptTemplate.load("does-not-exist"))
			.isInstanceOf(UncheckedIOException.class)
			.hasMessageContaining("does-not-exist");
	}
}
