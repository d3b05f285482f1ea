package com.carcoverscraper.core.http;

import com.carcoverscraper.core.model.ErrorKind;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * transient 오류(timeout, reset, 429, 5xx ...)에서만 재시도.
 * 지연: base → base*2 → base*4 ... (±10% Jitter)
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 500); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public RetryDecision shouldRetry(int attempt, ErrorKind kind) {
        if (kind == null || !kind.isTransient()) return RetryDecision.giveUp();
        if (attempt >= maxAttempts) return RetryDecision.giveUp();
        return RetryDecision.retry(nextDelay(attempt));
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(20, Math.max(0, attempt - 1)); // 1,2,4... (오버플로 방지)
        long raw = baseMillis * (1L << shift);
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
