package com.study.webflux.orchestrator.domain.persona;

import java.util.List;
import java.util.Optional;

/**
 * 페르소나 이름과 시스템 프롬프트 템플릿의 정적 매핑을 제공합니다.
 *
 * <p>
 * 화이트리스트가 아니므로 등록되지 않은 이름도 일반 시스템 프롬프트로 디스패치됩니다.
 */
public interface PersonaRegistry {

	/** 요청에 페르소나가 없을 때 사용하는 기본 로스터입니다. */
	List<String> defaultRoster();

	Optional<PersonaDefinition> find(String name);

	/**
	 * 페르소나 이름에 해당하는 시스템 프롬프트를 반환합니다.
	 *
	 * @param name
	 *            호출자가 전달한 페르소나 이름 (미등록 이름 허용)
	 * @return 등록된 템플릿 또는 일반 시스템 프롬프트
	 */
	String systemPromptFor(String name);
}
