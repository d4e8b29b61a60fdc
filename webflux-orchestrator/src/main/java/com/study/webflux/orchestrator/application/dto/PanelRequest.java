package com.study.webflux.orchestrator.application.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "보드룸 패널 오케스트레이션 Request")
public record PanelRequest(
	@Schema(description = "사용자 프롬프트", example = "What should we fix first?")
	@NotBlank(message = "prompt는 필수입니다")
	@Size(min = 3, message = "prompt는 3자 이상이어야 합니다") String prompt,

	@Schema(description = "참여할 페르소나 목록. 비어 있으면 기본 로스터를 사용합니다", example = "[\"cmo\", \"cfo\"]")
	@Size(max = 12, message = "personas는 최대 12명입니다") List<@NotBlank(message = "persona 이름은 비어 있을 수 없습니다") String> personas,

	@Schema(description = "검색할 컨텍스트 스니펫 수", example = "6", defaultValue = "6")
	@Min(value = 0, message = "topK는 0 이상이어야 합니다")
	@Max(value = 20, message = "topK는 20 이하여야 합니다") Integer topK,

	@Schema(description = "페르소나 응답 temperature", example = "0.2", defaultValue = "0.2")
	@DecimalMin(value = "0.0", message = "temperature는 0 이상이어야 합니다")
	@DecimalMax(value = "1.0", message = "temperature는 1 이하여야 합니다") Double temperature
) {
	public static final int DEFAULT_TOP_K = 6;
	public static final double DEFAULT_TEMPERATURE = 0.2;

	public PanelRequest {
		prompt = prompt == null ? null : prompt.trim();
		personas = personas == null
			? List.of()
			: Collections.unmodifiableList(new ArrayList<>(personas));
		if (topK == null) {
			topK = DEFAULT_TOP_K;
		}
		if (temperature == null) {
			temperature = DEFAULT_TEMPERATURE;
		}
	}
}
