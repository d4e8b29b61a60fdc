package com.study.webflux.orchestrator.infrastructure.provider.pool;

import java.util.concurrent.atomic.AtomicBoolean;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import reactor.core.publisher.Mono;

/**
 * 실행 중인 태스크가 단독으로 소유하는 동시성 티켓입니다. 여러 번 반납해도 한 번만 반영됩니다.
 */
public final class PoolSlot {

	private final ProviderPool pool;
	private final AtomicBoolean released = new AtomicBoolean(false);

	PoolSlot(ProviderPool pool) {
		this.pool = pool;
	}

	public ProviderRole role() {
		return pool.role();
	}

	public boolean isReleased() {
		return released.get();
	}

	public void release() {
		if (released.compareAndSet(false, true)) {
			pool.handOff();
		}
	}

	Mono<Void> releaseAsync() {
		return Mono.fromRunnable(this::release);
	}
}
