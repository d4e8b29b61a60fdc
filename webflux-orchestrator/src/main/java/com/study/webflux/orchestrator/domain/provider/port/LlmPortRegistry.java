package com.study.webflux.orchestrator.domain.provider.port;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;

/**
 * 프로바이더 역할마다 정확히 하나의 {@link LlmPort}를 보관합니다.
 */
public final class LlmPortRegistry {

	private final Map<ProviderRole, LlmPort> ports;

	public LlmPortRegistry(Map<ProviderRole, LlmPort> ports) {
		EnumMap<ProviderRole, LlmPort> copy = new EnumMap<>(ProviderRole.class);
		for (ProviderRole role : ProviderRole.values()) {
			LlmPort port = ports.get(role);
			if (port == null) {
				throw new IllegalArgumentException("missing LlmPort for role: " + role);
			}
			copy.put(role, port);
		}
		this.ports = Collections.unmodifiableMap(copy);
	}

	public LlmPort get(ProviderRole role) {
		return ports.get(role);
	}
}
