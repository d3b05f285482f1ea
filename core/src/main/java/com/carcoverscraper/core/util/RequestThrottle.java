package com.carcoverscraper.core.util;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;
import java.util.function.LongUnaryOperator;

/**
 * 스코프(전역 또는 호스트)별 최소 요청 간격 보장.
 *
 * 스코프마다 "다음 허용 시각" 워터마크 하나를 두고, 슬롯 예약만 synchronized 로 직렬화한다.
 * 대기는 락 밖에서 하므로 한 워커의 대기가 다른 스코프를 막지 않는다.
 * 간격 = minInterval + [0, jitter) 랜덤. 워커들이 같은 박자로 몰리는 것을 흩뜨림.
 */
public final class RequestThrottle {

    public static final String GLOBAL_SCOPE = "*";

    private final long minIntervalNanos;
    private final long jitterNanos;
    private final boolean perHost;
    private final LongSupplier clock;          // nanoTime
    private final Sleeper sleeper;
    private final LongUnaryOperator jitter;    // bound → [0, bound)

    private final Map<String, Long> nextAllowed = new HashMap<>();

    public RequestThrottle(Duration minInterval, Duration jitter, boolean perHost) {
        this(minInterval, jitter, perHost, System::nanoTime, new DefaultSleeper(),
                bound -> bound <= 0 ? 0L : ThreadLocalRandom.current().nextLong(bound));
    }

    /** 테스트용: 시계/대기/지터 주입 */
    public RequestThrottle(Duration minInterval, Duration jitter, boolean perHost,
                           LongSupplier clock, Sleeper sleeper, LongUnaryOperator jitterSource) {
        this.minIntervalNanos = Math.max(0, Objects.requireNonNull(minInterval, "minInterval").toNanos());
        this.jitterNanos = Math.max(0, Objects.requireNonNull(jitter, "jitter").toNanos());
        this.perHost = perHost;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.jitter = Objects.requireNonNull(jitterSource, "jitterSource");
    }

    /**
     * 허용될 때까지 블록. 반환값은 배정된 슬롯 시각(clock 기준 nanos).
     * 오류 조건 없음, 지연만 한다.
     */
    public long acquire(String host) throws InterruptedException {
        String scope = scopeOf(host);
        long slot = reserve(scope);
        long waitNanos = slot - clock.getAsLong();
        if (waitNanos > 0) {
            sleeper.sleep(Duration.ofNanos(waitNanos));
        }
        return slot;
    }

    /** 워터마크 전진(직렬화 지점). 슬롯 = max(now, watermark). */
    private synchronized long reserve(String scope) {
        long now = clock.getAsLong();
        Long next = nextAllowed.get(scope);
        long slot = (next == null || next < now) ? now : next;
        nextAllowed.put(scope, slot + minIntervalNanos + jitter.applyAsLong(jitterNanos));
        return slot;
    }

    String scopeOf(String host) {
        if (!perHost || host == null || host.isBlank()) return GLOBAL_SCOPE;
        return host.toLowerCase(Locale.ROOT);
    }

    public Duration getMinInterval() { return Duration.ofNanos(minIntervalNanos); }
}
