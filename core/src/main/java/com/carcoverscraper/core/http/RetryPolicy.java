package com.carcoverscraper.core.http;

import com.carcoverscraper.core.model.ErrorKind;

import java.time.Duration;

/** 재시도 여부/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 지금까지 수행한 시도 수(1부터). Retry면 delay 후 재투입. */
    RetryDecision shouldRetry(int attempt, ErrorKind kind);
    /** attempt번째 실패 뒤 다음 시도까지의 지연. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). 예: 3이면 최대 3번 시도. */
    int maxAttempts();
}
