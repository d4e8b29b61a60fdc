package com.study.webflux.orchestrator.infrastructure.persona;

import com.study.webflux.orchestrator.infrastructure.common.template.FileBasedPromptTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StaticPersonaRegistryTest {

	private StaticPersonaRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new StaticPersonaRegistry(new FileBasedPromptTemplate());
	}

	@Test
	@DisplayName("기본 로스터는 12명의 페르소나를 정해진 순서로 반환한다")
	void defaultRoster() {
		assertThat(registry.defaultRoster()).hasSize(12)
			.startsWith("ROI Analyst", "Emotion Scientist")
			.endsWith("CEO Provocateur");
	}

	@Test
	@DisplayName("알려진 페르소나는 베이스 템플릿에 초점 문장을 덧붙인다")
	void systemPromptFor_knownPersona() {
		String prompt = registry.systemPromptFor("Data Skeptic");

		assertThat(prompt).startsWith("You are Data Skeptic. Be concise, concrete, and accountable.")
			.contains("Always end with 3 prioritized actions")
			.endsWith("Call out weak evidence and hidden risks. Suggest a falsification step.");
	}

	@Test
	@DisplayName("알 수 없는 페르소나는 일반 프롬프트를 사용한다")
	void systemPromptFor_unknownPersona() {
		String prompt = registry.systemPromptFor("cmo");

		assertThat(prompt).startsWith("You are cmo.")
			.endsWith("If context is thin, state assumptions explicitly first.");
		assertThat(registry.find("cmo")).isEmpty();
	}

	@Test
	@DisplayName("페르소나 정의를 이름으로 조회한다")
	void find_knownPersona() {
		assertThat(registry.find("Copy Chief")).hasValueSatisfying(
			definition -> assertThat(definition.promptTemplate()).contains("microcopy"));
	}
}
