package com.study.webflux.orchestrator.infrastructure.provider.pool;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 역할별 프로바이더 풀을 보관합니다. 모든 아웃바운드 프로바이더 호출은 이 매니저를 통과합니다.
 *
 * <p>
 * 프로세스 시작 시 한 번 생성되어 모든 HTTP 요청이 같은 풀을 공유합니다.
 */
public class ProviderPoolManager {

	private final Map<ProviderRole, ProviderPool> pools;

	public ProviderPoolManager(Map<ProviderRole, Integer> limits) {
		EnumMap<ProviderRole, ProviderPool> created = new EnumMap<>(ProviderRole.class);
		for (ProviderRole role : ProviderRole.values()) {
			Integer limit = limits.get(role);
			if (limit == null) {
				throw new IllegalArgumentException("missing pool limit for role: " + role);
			}
			created.put(role, new ProviderPool(role, limit));
		}
		this.pools = Collections.unmodifiableMap(created);
	}

	public <T> Mono<T> schedule(ProviderRole role, Supplier<? extends Mono<T>> task) {
		return pool(role).schedule(task);
	}

	public <T> Flux<T> scheduleMany(ProviderRole role, Supplier<? extends Flux<T>> task) {
		return pool(role).scheduleMany(task);
	}

	public ProviderPool pool(ProviderRole role) {
		return pools.get(role);
	}

	public Collection<ProviderPool> pools() {
		return pools.values();
	}
}
