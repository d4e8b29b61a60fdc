package com.study.webflux.orchestrator.domain.persona;

public record PersonaDefinition(
	String name,
	String promptTemplate
) {
	public PersonaDefinition {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("persona name cannot be null or blank");
		}
		if (promptTemplate == null || promptTemplate.isBlank()) {
			throw new IllegalArgumentException("promptTemplate cannot be null or blank");
		}
	}
}
