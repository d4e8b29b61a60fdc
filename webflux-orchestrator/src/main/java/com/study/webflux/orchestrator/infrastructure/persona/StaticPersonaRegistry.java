package com.study.webflux.orchestrator.infrastructure.persona;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.orchestrator.domain.persona.PersonaDefinition;
import com.study.webflux.orchestrator.domain.persona.PersonaRegistry;
import com.study.webflux.orchestrator.infrastructure.common.template.FileBasedPromptTemplate;

/**
 * 기본 보드룸 로스터와 페르소나별 시스템 프롬프트를 제공하는 정적 레지스트리입니다.
 *
 * <p>
 * 공통 베이스 템플릿(templates/persona-base.md)에 페르소나별 초점 문장을 덧붙여 프롬프트를 구성합니다.
 */
@Slf4j
@Component
public class StaticPersonaRegistry implements PersonaRegistry {

	static final String BASE_TEMPLATE = "persona-base";
	private static final String PERSONA_VARIABLE = "persona";

	private static final Map<String, String> FOCUS = createFocusTable();

	private final FileBasedPromptTemplate promptTemplate;
	private final Map<String, PersonaDefinition> definitions;

	public StaticPersonaRegistry(FileBasedPromptTemplate promptTemplate) {
		this.promptTemplate = promptTemplate;
		Map<String, PersonaDefinition> loaded = new LinkedHashMap<>();
		FOCUS.forEach((name, focus) -> loaded.put(name,
			new PersonaDefinition(name, basePrompt(name) + "\n" + focus)));
		this.definitions = Map.copyOf(loaded);
		log.info("페르소나 레지스트리 초기화 완료: {}명", definitions.size());
	}

	@Override
	public List<String> defaultRoster() {
		return List.copyOf(FOCUS.keySet());
	}

	@Override
	public Optional<PersonaDefinition> find(String name) {
		return Optional.ofNullable(name).map(definitions::get);
	}

	@Override
	public String systemPromptFor(String name) {
		return find(name).map(PersonaDefinition::promptTemplate)
			.orElseGet(() -> basePrompt(name));
	}

	private String basePrompt(String name) {
		return promptTemplate.load(BASE_TEMPLATE, Map.of(PERSONA_VARIABLE, name));
	}

	private static Map<String, String> createFocusTable() {
		Map<String, String> focus = new LinkedHashMap<>();
		focus.put("ROI Analyst", "Focus on lift, cost, and time-to-impact. Include rough ROI math.");
		focus.put("Emotion Scientist",
			"Ground claims in Plutchik emotions (joy, anger, fear, trust).");
		focus.put("CRO Specialist", "Prioritize friction removal and confidence building.");
		focus.put("Copy Chief",
			"Tighten headlines, body, and microcopy. Use voice & tone guidance.");
		focus.put("Performance Engineer",
			"Attack latency, CLS, and payload. Give Lighthouse-friendly fixes.");
		focus.put("Brand Strategist", "Protect perception. Tie actions to brand promise.");
		focus.put("UX Researcher", "Hypothesize user intent; propose a quick test to validate.");
		focus.put("Data Skeptic",
			"Call out weak evidence and hidden risks. Suggest a falsification step.");
		focus.put("Compliance Counsel",
			"Flag privacy, accessibility, and claims risk. Offer compliant wording.");
		focus.put("Social Strategist", "Turn insight into content hooks and distribution.");
		focus.put("Customer Success", "Reduce anxiety; propose onboarding/education steps.");
		focus.put("CEO Provocateur", "Challenge defaults; pick one bet and push for speed.");
		return Collections.unmodifiableMap(focus);
	}
}
