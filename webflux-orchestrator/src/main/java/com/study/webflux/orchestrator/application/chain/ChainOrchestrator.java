package com.study.webflux.orchestrator.application.chain;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.orchestrator.application.dto.ChainRequest;
import com.study.webflux.orchestrator.application.dto.ChainStrategy;
import com.study.webflux.orchestrator.application.provider.ProviderDispatcher;
import com.study.webflux.orchestrator.application.retrieval.ContextRetrievalService;
import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import com.study.webflux.orchestrator.domain.retrieval.model.RetrievedContext;
import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;
import com.study.webflux.orchestrator.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 순차 멀티홉 체인(retrieval → planner → primary → refiner)을 실행하고 이벤트 스트림으로 변환합니다.
 *
 * <p>
 * 홉 실패는 스트림을 중단시키지 않습니다. 실패한 홉의 출력은 placeholder로 대체되어 다음 홉에 전달되고, 체인은 항상 done으로 끝납니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainOrchestrator {

	private final ContextRetrievalService contextRetrievalService;
	private final ProviderDispatcher providerDispatcher;
	private final FileBasedPromptTemplate promptTemplate;

	public Flux<StreamEvent> orchestrate(ChainRequest request) {
		Mono<RetrievedContext> retrieval = contextRetrievalService
			.retrieveAndPack(request.prompt(), request.topK())
			.cache();

		return Flux.concat(
			Mono.fromSupplier(() -> StreamEvent.start(startMetadata(request))),
			Mono.fromSupplier(() -> StreamEvent.phaseBegin(ChainPhase.RETRIEVAL.label())),
			retrieval.flatMapMany(context -> Flux.concat(
				Mono.fromSupplier(
					() -> StreamEvent.phaseEnd(ChainPhase.RETRIEVAL.label(), context.hits())),
				runHops(request, context.packed().render()))),
			Mono.fromSupplier(StreamEvent::done))
			.doOnComplete(() -> log.info("체인 완료 - strategy: {}", request.strategy().getValue()));
	}

	private Flux<StreamEvent> runHops(ChainRequest request, String contextBlock) {
		String prompt = request.prompt();
		Mono<HopResult> planner = completeHop(ChainPhase.PLANNER,
			"User:\n" + prompt + "\n\n" + contextBlock + "\n\nOutput: a short, numbered plan.")
			.cache();

		return Flux.concat(
			hopEvents(ChainPhase.PLANNER, planner),
			planner.flatMapMany(plan -> request.strategy() == ChainStrategy.SINGLE_PASS
				? singlePass(plan.text(), prompt, contextBlock)
				: primaryThenRefine(plan.text(), prompt, contextBlock)));
	}

	private Flux<StreamEvent> primaryThenRefine(String plan, String prompt, String contextBlock) {
		Mono<HopResult> primary = completeHop(ChainPhase.PRIMARY,
			followPlanPrompt(plan, prompt, contextBlock))
			.cache();

		return Flux.concat(
			hopEvents(ChainPhase.PRIMARY, primary),
			primary.flatMapMany(answer -> hopEvents(ChainPhase.REFINER,
				completeHop(ChainPhase.REFINER,
					"Improve the following answer. Keep it faithful.\n\nAnswer:\n"
						+ answer.text()))));
	}

	/**
	 * refiner가 토큰 단위로 스트리밍합니다. 도중에 실패하면 이미 보낸 토큰은 유지하고 placeholder delta 하나를 덧붙입니다.
	 */
	private Flux<StreamEvent> singlePass(String plan, String prompt, String contextBlock) {
		ChainPhase phase = ChainPhase.REFINER;
		ProviderTask task = ProviderTask.of(phase.role(),
			systemPrompt(phase),
			followPlanPrompt(plan, prompt, contextBlock));

		Flux<StreamEvent> tokens = providerDispatcher.stream(task)
			.map(token -> StreamEvent.delta(phase.deltaLabel(), token))
			.onErrorResume(error -> {
				log.warn("{} 스트리밍 실패: {}", phase.label(), error.getMessage());
				return Mono.just(StreamEvent.delta(phase.deltaLabel(),
					HopResult.placeholder(phase, error)));
			});

		return Flux.concat(
			Mono.fromSupplier(() -> StreamEvent.phaseBegin(phase.label())),
			tokens,
			Mono.fromSupplier(() -> StreamEvent.phaseEnd(phase.label())));
	}

	private Flux<StreamEvent> hopEvents(ChainPhase phase, Mono<HopResult> result) {
		return Flux.concat(
			Mono.fromSupplier(() -> StreamEvent.phaseBegin(phase.label())),
			result.map(hop -> StreamEvent.delta(phase.deltaLabel(), hop.text())),
			Mono.fromSupplier(() -> StreamEvent.phaseEnd(phase.label())));
	}

	private Mono<HopResult> completeHop(ChainPhase phase, String userPrompt) {
		ProviderTask task = ProviderTask.of(phase.role(), systemPrompt(phase), userPrompt);
		return providerDispatcher.complete(task)
			.map(text -> HopResult.success(phase, text))
			.defaultIfEmpty(HopResult.success(phase, ""))
			.onErrorResume(error -> {
				log.warn("{} 홉 실패: {}", phase.label(), error.getMessage());
				return Mono.just(HopResult.failure(phase, error));
			});
	}

	private String followPlanPrompt(String plan, String prompt, String contextBlock) {
		return "Follow this plan:\n" + plan + "\n\nUser:\n" + prompt + "\n\n" + contextBlock;
	}

	private String systemPrompt(ChainPhase phase) {
		return promptTemplate.load(phase.systemTemplate());
	}

	private Map<String, Object> startMetadata(ChainRequest request) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("strategy", request.strategy().getValue());
		metadata.put("topK", request.topK());
		return metadata;
	}
}
