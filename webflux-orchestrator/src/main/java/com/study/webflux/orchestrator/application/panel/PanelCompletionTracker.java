package com.study.webflux.orchestrator.application.panel;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 패널 요청 하나의 페르소나 완료 수를 셉니다. 마지막 페르소나를 완료시킨 호출만 true를 받습니다.
 */
public class PanelCompletionTracker {

	private final int total;
	private final AtomicInteger completed = new AtomicInteger();

	public PanelCompletionTracker(int total) {
		if (total < 1) {
			throw new IllegalArgumentException("total must be at least 1: " + total);
		}
		this.total = total;
	}

	public boolean markComplete() {
		return completed.incrementAndGet() == total;
	}

	public int completed() {
		return Math.min(completed.get(), total);
	}

	public int total() {
		return total;
	}
}
