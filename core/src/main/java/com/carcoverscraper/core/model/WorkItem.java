package com.carcoverscraper.core.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 작업 큐 단위: URL + 시도 메타데이터.
 * - attempt: 이미 수행한 시도 수(0부터)
 * - notBeforeNanos: 재시도 지연용 "이 시각 이전엔 꺼내지 말 것"(System.nanoTime 기준)
 * - hint: 검색 결과에서 넘어온 요약(상세 페이지일 때만, 없으면 null)
 *
 * DelayQueue에 그대로 들어가도록 Delayed 구현. 준비된 항목끼리는 enqueue 순서(FIFO).
 */
public final class WorkItem implements Delayed {

    private static final AtomicLong SEQ = new AtomicLong();

    private final URI url;
    private final PageKind kind;
    private final int attempt;
    private final Instant enqueuedAt;
    private final long notBeforeNanos;
    private final ListingSummary hint;
    private final int pageNo;
    private final long seq;

    private WorkItem(URI url, PageKind kind, int attempt, Instant enqueuedAt,
                     long notBeforeNanos, ListingSummary hint, int pageNo) {
        this.url = Objects.requireNonNull(url, "url");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0");
        this.attempt = attempt;
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        this.notBeforeNanos = notBeforeNanos;
        this.hint = hint;
        this.pageNo = pageNo;
        this.seq = SEQ.incrementAndGet();
    }

    /** 검색 결과 페이지(시드/페이지네이션) */
    public static WorkItem search(URI url, int pageNo) {
        return new WorkItem(url, PageKind.SEARCH, 0, Instant.now(), System.nanoTime(), null, Math.max(1, pageNo));
    }

    /** 상세 페이지. hint는 검색 결과에서 읽은 요약(없으면 null) */
    public static WorkItem detail(URI url, ListingSummary hint) {
        return new WorkItem(url, PageKind.DETAIL, 0, Instant.now(), System.nanoTime(), hint, 0);
    }

    /** 재시도용 사본: attempt+1, delay 이후에만 꺼낼 수 있음 */
    public WorkItem retryAfter(Duration delay) {
        long d = (delay == null || delay.isNegative()) ? 0L : delay.toNanos();
        return new WorkItem(url, kind, attempt + 1, enqueuedAt, System.nanoTime() + d, hint, pageNo);
    }

    public URI getUrl() { return url; }
    public PageKind getKind() { return kind; }
    public int getAttempt() { return attempt; }
    public Instant getEnqueuedAt() { return enqueuedAt; }
    public ListingSummary getHint() { return hint; }
    public int getPageNo() { return pageNo; }
    public boolean isRetry() { return attempt > 0; }

    public String host() {
        String h = url.getHost();
        return h == null ? "" : h.toLowerCase(java.util.Locale.ROOT);
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(notBeforeNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        if (o == this) return 0;
        if (o instanceof WorkItem w) {
            int c = Long.compare(notBeforeNanos, w.notBeforeNanos);
            return c != 0 ? c : Long.compare(seq, w.seq);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), o.getDelay(TimeUnit.NANOSECONDS));
    }

    @Override
    public String toString() {
        return "WorkItem{" + kind + " " + url + ", attempt=" + attempt + "}";
    }
}
