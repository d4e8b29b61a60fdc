package com.study.webflux.orchestrator.infrastructure.provider.pool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.orchestrator.domain.provider.model.ProviderRole;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * 프로바이더 역할 하나에 대한 논블로킹 bounded-concurrency 게이트입니다.
 *
 * <p>
 * 슬롯이 없으면 구독자는 스레드를 점유하지 않고 FIFO 대기열에서 기다리며, 태스크가 성공/실패/취소로 끝나면 슬롯은 결과가 전달되기 전에 반납됩니다.
 */
@Slf4j
public class ProviderPool {

	private final ProviderRole role;
	private final int capacity;
	private final Deque<MonoSink<PoolSlot>> waiters = new ArrayDeque<>();
	private int inUse;

	public ProviderPool(ProviderRole role, int capacity) {
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
		}
		this.role = role;
		this.capacity = capacity;
	}

	public ProviderRole role() {
		return role;
	}

	public int capacity() {
		return capacity;
	}

	public synchronized int activeCount() {
		return inUse;
	}

	public synchronized int waitingCount() {
		return waiters.size();
	}

	/**
	 * 슬롯을 얻은 뒤 태스크를 실행하고 결과를 돌려줍니다.
	 */
	public <T> Mono<T> schedule(Supplier<? extends Mono<T>> task) {
		return Mono.usingWhen(acquire(), slot -> Mono.defer(task), PoolSlot::releaseAsync);
	}

	/**
	 * 스트리밍 태스크용 스케줄링입니다. 슬롯은 스트림이 끝날 때까지 유지됩니다.
	 */
	public <T> Flux<T> scheduleMany(Supplier<? extends Flux<T>> task) {
		return Flux.usingWhen(acquire(), slot -> Flux.defer(task), PoolSlot::releaseAsync);
	}

	Mono<PoolSlot> acquire() {
		return Mono.<PoolSlot>create(sink -> {
			PoolSlot granted = null;
			synchronized (this) {
				if (inUse < capacity) {
					inUse++;
					granted = new PoolSlot(this);
				} else {
					waiters.addLast(sink);
					sink.onCancel(() -> removeWaiter(sink));
					log.debug("{} 풀 슬롯 대기 - waiting: {}", role.getValue(), waiters.size());
				}
			}
			if (granted != null) {
				sink.success(granted);
			}
		}).doOnDiscard(PoolSlot.class, PoolSlot::release);
	}

	/**
	 * 반납된 슬롯을 다음 대기자에게 넘기거나, 대기자가 없으면 사용 중 카운트를 줄입니다.
	 */
	void handOff() {
		MonoSink<PoolSlot> next;
		synchronized (this) {
			next = waiters.pollFirst();
			if (next == null) {
				inUse--;
				return;
			}
		}
		next.success(new PoolSlot(this));
	}

	private synchronized void removeWaiter(MonoSink<PoolSlot> sink) {
		waiters.remove(sink);
	}
}
