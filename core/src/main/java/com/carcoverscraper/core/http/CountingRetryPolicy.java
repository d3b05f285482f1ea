package com.carcoverscraper.core.http;

import com.carcoverscraper.core.model.ErrorKind;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/** RetryPolicy를 감싸 Retry/GiveUp 판정 수를 집계하는 얇은 데코레이터. 워커 간 공유 가능. */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong giveUps = new AtomicLong();

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public RetryDecision shouldRetry(int attempt, ErrorKind kind) {
        RetryDecision d = delegate.shouldRetry(attempt, kind);
        if (d.retry()) retries.incrementAndGet(); else giveUps.incrementAndGet();
        return d;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public long getRetryCount() { return retries.get(); }

    public long getGiveUpCount() { return giveUps.get(); }
}
