package com.carcoverscraper.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScrapeStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // 네트워크 시도(재시도 포함)
    private final AtomicLong retriesTotal  = new AtomicLong(0);   // 재투입 횟수
    private final AtomicLong sumLatencyMs  = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempt(long latencyMs) {
        attemptsTotal.incrementAndGet();
        sumLatencyMs.addAndGet(Math.max(0, latencyMs));
    }
    public void addRetry() {
        retriesTotal.incrementAndGet();
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long attempts = attemptsTotal.get();
        long avg = sumLatencyMs.get() / Math.max(1, attempts);
        return new Snapshot(attempts, retriesTotal.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 */
    public static final class Snapshot {
        public final long attemptsTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;
        public Snapshot(long a, long r, int c, long l) {
            this.attemptsTotal = a;
            this.retriesTotal = r;
            this.maxObservedConcurrency = c;
            this.avgLatencyMs = l;
        }
    }
}
