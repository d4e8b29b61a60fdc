package com.study.webflux.orchestrator.application.panel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.orchestrator.application.dto.PanelRequest;
import com.study.webflux.orchestrator.application.provider.ProviderDispatcher;
import com.study.webflux.orchestrator.application.retrieval.ContextRetrievalService;
import com.study.webflux.orchestrator.domain.persona.PersonaRegistry;
import com.study.webflux.orchestrator.domain.provider.model.ModelOptions;
import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import com.study.webflux.orchestrator.domain.retrieval.model.RetrievedContext;
import com.study.webflux.orchestrator.domain.stream.model.StreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 보드룸 패널을 실행합니다. 페르소나마다 PRECISION 풀에서 스트리밍 호출을 병렬로 수행하고 토큰을 섞어서 내보냅니다.
 *
 * <p>
 * 스트리밍이 실패한 페르소나는 동일한 프롬프트로 비스트리밍 호출을 한 번만 재시도합니다. 모든 페르소나가 끝나면 done을 정확히 한 번 보냅니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PanelOrchestrator {

	static final int MAX_PERSONAS = 12;
	static final String RETRIEVAL_LABEL = "retrieval";

	private final ContextRetrievalService contextRetrievalService;
	private final ProviderDispatcher providerDispatcher;
	private final PersonaRegistry personaRegistry;

	public Flux<StreamEvent> orchestrate(PanelRequest request) {
		List<String> roster = resolveRoster(request.personas());
		Mono<RetrievedContext> retrieval = contextRetrievalService
			.retrieveAndPack(request.prompt(), request.topK())
			.cache();

		return Flux.concat(
			Mono.fromSupplier(() -> StreamEvent.start(startMetadata(roster))),
			Mono.fromSupplier(() -> StreamEvent.phaseBegin(RETRIEVAL_LABEL)),
			retrieval.flatMapMany(context -> Flux.concat(
				Mono.fromSupplier(() -> StreamEvent.phaseEnd(RETRIEVAL_LABEL, context.hits())),
				fanOut(request, roster, context.packed().render()))));
	}

	/**
	 * 요청 로스터를 순서를 유지한 채 중복을 제거하고 최대 인원으로 자릅니다. 요청 목록이 비어 있을 때만 기본 로스터를 사용합니다.
	 */
	List<String> resolveRoster(List<String> requested) {
		if (requested == null || requested.isEmpty()) {
			return personaRegistry.defaultRoster();
		}
		Set<String> unique = new LinkedHashSet<>();
		for (String name : requested) {
			unique.add(name);
			if (unique.size() == MAX_PERSONAS) {
				break;
			}
		}
		return List.copyOf(unique);
	}

	private Flux<StreamEvent> fanOut(PanelRequest request, List<String> roster, String contextBlock) {
		PanelCompletionTracker tracker = new PanelCompletionTracker(roster.size());
		String userPrompt = "Challenge: " + request.prompt() + "\n\n" + contextBlock
			+ "\n\nGive your position. Be decisive and specific.";
		ModelOptions options = ModelOptions.withTemperature(request.temperature());

		List<Flux<StreamEvent>> personaStreams = new ArrayList<>(roster.size());
		for (String persona : roster) {
			ProviderTask task = new ProviderTask(ProviderRole.PRECISION,
				personaRegistry.systemPromptFor(persona),
				userPrompt,
				options);
			personaStreams.add(personaStream(persona, task, tracker));
		}
		return Flux.merge(personaStreams)
			.doOnComplete(() -> log.info("패널 완료 - personas: {}", tracker.total()));
	}

	private Flux<StreamEvent> personaStream(String persona,
		ProviderTask task,
		PanelCompletionTracker tracker) {
		Flux<StreamEvent> tokens = providerDispatcher.stream(task)
			.map(token -> StreamEvent.delta(persona, token))
			.onErrorResume(error -> fallback(persona, task, error));

		return Flux.concat(
			Mono.fromSupplier(() -> StreamEvent.phaseBegin(persona)),
			tokens,
			Mono.fromSupplier(() -> StreamEvent.phaseEnd(persona)),
			Mono.fromSupplier(tracker::markComplete)
				.filter(Boolean::booleanValue)
				.map(last -> StreamEvent.done()));
	}

	private Flux<StreamEvent> fallback(String persona, ProviderTask task, Throwable error) {
		log.warn("페르소나 스트리밍 실패, 비스트리밍으로 재시도 - persona: {}, error: {}",
			persona,
			error.getMessage());
		Mono<StreamEvent> retry = providerDispatcher.complete(task)
			.map(text -> StreamEvent.delta(persona, text))
			.onErrorResume(retryError -> {
				log.warn("페르소나 재시도 실패 - persona: {}, error: {}", persona, retryError.getMessage());
				return Mono.just(StreamEvent.error(persona, messageOf(retryError)));
			});
		return Flux.concat(Mono.just(StreamEvent.error(persona, messageOf(error))), retry);
	}

	private String messageOf(Throwable error) {
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}

	private Map<String, Object> startMetadata(List<String> roster) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("personas", roster.size());
		metadata.put("roster", roster);
		return metadata;
	}
}
