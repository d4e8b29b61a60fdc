package com.study.webflux.orchestrator.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "체인 오케스트레이션 Request")
public record ChainRequest(
	@Schema(description = "사용자 프롬프트", example = "What should we fix first on our pricing page?")
	@NotBlank(message = "prompt는 필수입니다")
	@Size(min = 3, message = "prompt는 3자 이상이어야 합니다") String prompt,

	@Schema(description = "검색할 컨텍스트 스니펫 수", example = "6", defaultValue = "6")
	@Min(value = 0, message = "topK는 0 이상이어야 합니다")
	@Max(value = 20, message = "topK는 20 이하여야 합니다") Integer topK,

	@Schema(description = "체인 실행 전략", example = "default", defaultValue = "default")
	ChainStrategy strategy
) {
	public static final int DEFAULT_TOP_K = 6;

	public ChainRequest {
		prompt = prompt == null ? null : prompt.trim();
		if (topK == null) {
			topK = DEFAULT_TOP_K;
		}
		if (strategy == null) {
			strategy = ChainStrategy.DEFAULT;
		}
	}
}
