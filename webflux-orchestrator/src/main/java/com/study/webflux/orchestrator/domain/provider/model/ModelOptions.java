package com.study.webflux.orchestrator.domain.provider.model;

/**
 * 호출 단위 모델 파라미터입니다. null 값은 역할별 기본 설정을 따릅니다.
 */
public record ModelOptions(
	Double temperature,
	Integer maxTokens
) {
	private static final ModelOptions DEFAULTS = new ModelOptions(null, null);

	public ModelOptions {
		if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
			throw new IllegalArgumentException("temperature out of range: " + temperature);
		}
		if (maxTokens != null && maxTokens < 1) {
			throw new IllegalArgumentException("maxTokens must be positive");
		}
	}

	public static ModelOptions defaults() {
		return DEFAULTS;
	}

	public static ModelOptions withTemperature(double temperature) {
		return new ModelOptions(temperature, null);
	}
}
