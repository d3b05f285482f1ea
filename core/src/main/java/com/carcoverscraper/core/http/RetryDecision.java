package com.carcoverscraper.core.http;

import java.time.Duration;
import java.util.Objects;

/** RetryPolicy 판정: Retry(delay) 또는 GiveUp */
public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) delay = Duration.ZERO;
    }

    public static RetryDecision retry(Duration delay) { return new RetryDecision(true, delay); }
    public static RetryDecision giveUp() { return GIVE_UP; }

    /** Retry-After 등 서버가 요구한 최소 대기를 반영(GiveUp은 그대로) */
    public RetryDecision atLeast(Duration floor) {
        if (!retry || floor == null || floor.compareTo(delay) <= 0) return this;
        return new RetryDecision(true, floor);
    }
}
