package com.study.webflux.orchestrator.infrastructure.provider.adapter;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

import com.study.webflux.orchestrator.domain.provider.exception.ProviderException;
import com.study.webflux.orchestrator.domain.provider.model.ModelOptions;
import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import com.study.webflux.orchestrator.domain.provider.model.ProviderTask;
import com.study.webflux.orchestrator.domain.provider.port.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI {@link ChatModel} 하나를 프로바이더 역할 하나에 연결하는 어댑터입니다.
 */
@Slf4j
public class SpringAiLlmAdapter implements LlmPort {

	private final ProviderRole role;
	private final ChatModel chatModel;
	private final String model;

	public SpringAiLlmAdapter(ProviderRole role, ChatModel chatModel, String model) {
		this.role = role;
		this.chatModel = chatModel;
		this.model = model;
	}

	@Override
	public Flux<String> streamCompletion(ProviderTask task) {
		Prompt prompt = toPrompt(task);
		return Flux.defer(() -> chatModel.stream(prompt))
			.mapNotNull(this::extractText)
			.filter(token -> !token.isEmpty())
			.onErrorMap(error -> !(error instanceof ProviderException), this::wrap);
	}

	@Override
	public Mono<String> complete(ProviderTask task) {
		Prompt prompt = toPrompt(task);
		return Mono.fromCallable(() -> {
			ChatResponse response = chatModel.call(prompt);
			String text = extractText(response);
			if (text == null) {
				throw new ProviderException(role, "Invalid response from " + role.getValue());
			}
			return text;
		})
			.subscribeOn(Schedulers.boundedElastic())
			.onErrorMap(error -> !(error instanceof ProviderException), this::wrap);
	}

	private Prompt toPrompt(ProviderTask task) {
		List<Message> messages = new ArrayList<>(2);
		if (!task.systemPrompt().isBlank()) {
			messages.add(new SystemMessage(task.systemPrompt()));
		}
		messages.add(new UserMessage(task.userPrompt()));
		return new Prompt(messages, toChatOptions(task.options()));
	}

	private ChatOptions toChatOptions(ModelOptions options) {
		return ChatOptions.builder()
			.model(model)
			.temperature(options.temperature())
			.maxTokens(options.maxTokens())
			.build();
	}

	private String extractText(ChatResponse response) {
		if (response == null) {
			return null;
		}
		Generation generation = response.getResult();
		if (generation == null || generation.getOutput() == null) {
			return null;
		}
		return generation.getOutput().getText();
	}

	private ProviderException wrap(Throwable error) {
		log.warn("{} 프로바이더 호출 실패: {}", role.getValue(), error.getMessage());
		String message = error.getMessage() != null
			? error.getMessage()
			: error.getClass().getSimpleName();
		return new ProviderException(role, message, error);
	}
}
