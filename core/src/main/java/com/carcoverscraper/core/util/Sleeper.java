package com.carcoverscraper.core.util;

import java.time.Duration;

/** 대기 추상화(테스트에서 가짜 시계와 함께 교체). */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
