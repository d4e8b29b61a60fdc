package com.study.webflux.orchestrator.infrastructure.common.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * classpath의 templates 디렉터리에서 프롬프트 템플릿을 읽고 {{변수}}를 치환합니다.
 */
@Component
public class FileBasedPromptTemplate {

	private static final List<String> TEMPLATE_EXTENSIONS = List.of(".md", ".txt");

	private final Map<String, String> rawTemplates = new ConcurrentHashMap<>();

	public String load(String templateName) {
		return load(templateName, Map.of());
	}

	public String load(String templateName, Map<String, String> variables) {
		String result = rawTemplates.computeIfAbsent(templateName, this::read);
		for (Map.Entry<String, String> entry : variables.entrySet()) {
			result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
		}
		return result.trim();
	}

	private String read(String templateName) {
		try {
			ClassPathResource resource = resolveResource(templateName);
			return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to load template: " + templateName, e);
		}
	}

	private ClassPathResource resolveResource(String templateName) throws IOException {
		for (String ext : TEMPLATE_EXTENSIONS) {
			ClassPathResource resource = new ClassPathResource("templates/" + templateName + ext);
			if (resource.exists()) {
				return resource;
			}
		}
		throw new IOException("Template not found for name: " + templateName);
	}
}
