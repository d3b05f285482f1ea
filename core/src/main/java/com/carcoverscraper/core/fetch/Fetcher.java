package com.carcoverscraper.core.fetch;

import com.carcoverscraper.core.api.IPageFetcher;
import com.carcoverscraper.core.http.RetryDecision;
import com.carcoverscraper.core.http.RetryPolicy;
import com.carcoverscraper.core.model.ErrorKind;
import com.carcoverscraper.core.model.FetchResult;
import com.carcoverscraper.core.model.PageResponse;
import com.carcoverscraper.core.model.ScrapeStats;
import com.carcoverscraper.core.model.WorkItem;
import com.carcoverscraper.core.service.ScrapeAbortedException;
import com.carcoverscraper.core.util.RequestThrottle;
import com.carcoverscraper.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 워커 풀. 각 워커 루프:
 *   dequeue → throttle.acquire(host) → fetch → 성공이면 Success 방출
 *   실패면 RetryPolicy 판정 → Retry: notBefore 찍어 재투입 / GiveUp: 최종 Failure 방출
 * 큐가 드레인(대기·지연·진행 중 0)되면 워커가 종료한다.
 */
public final class Fetcher {

    private static final Logger LOG = LoggerFactory.getLogger(Fetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(Fetcher.class);

    static final Duration POLL = Duration.ofMillis(50);

    private final IPageFetcher pageFetcher;
    private final RequestThrottle throttle;
    private final RetryPolicy retryPolicy;
    private final ScrapeStats stats;
    private final Duration timeout;
    private final Duration retryAfterCap;

    private final AtomicInteger inFlight = new AtomicInteger();

    public Fetcher(IPageFetcher pageFetcher, RequestThrottle throttle, RetryPolicy retryPolicy,
                   ScrapeStats stats, Duration timeout, Duration retryAfterCap) {
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.retryAfterCap = (retryAfterCap == null) ? Duration.ZERO : retryAfterCap;
    }

    /**
     * concurrency개의 워커를 띄워 큐가 드레인될 때까지 실행(블로킹).
     * 결과는 listener로 워커 스레드에서 전달된다.
     *
     * @throws ScrapeAbortedException 워커를 띄우지 못한 경우(자원 고갈)
     * @throws InterruptedException   호출 스레드가 인터럽트된 경우(큐는 cancel 상태가 된다)
     */
    public void run(WorkQueue queue, int concurrency, FetchResultListener listener) throws InterruptedException {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(listener, "listener");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");

        ExecutorService pool = new ThreadPoolExecutor(
                concurrency, concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("fetch-worker"));

        List<Future<?>> workers = new ArrayList<>(concurrency);
        try {
            for (int i = 0; i < concurrency; i++) {
                workers.add(pool.submit(() -> workLoop(queue, listener)));
            }
        } catch (RejectedExecutionException | OutOfMemoryError e) {
            queue.cancel();
            pool.shutdownNow();
            throw new ScrapeAbortedException("cannot start " + concurrency + " fetch workers", e);
        }
        LOG.debug("Fetcher started: workers={}", concurrency);

        try {
            for (Future<?> f : workers) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    // 워커 루프는 항목 단위로 예외를 잡으므로 여기까지 오면 버그
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    LOG.error("fetch worker died: {}", cause.toString(), cause);
                }
            }
        } catch (InterruptedException ie) {
            queue.cancel();
            pool.shutdownNow();
            throw ie;
        } finally {
            pool.shutdown();
            pool.awaitTermination(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
        }
    }

    /** 현재 진행 중(요청 중) 워커 수 */
    public int inFlight() { return inFlight.get(); }

    private void workLoop(WorkQueue queue, FetchResultListener listener) {
        while (true) {
            WorkItem item;
            try {
                item = queue.poll(POLL);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item == null) {
                if (queue.isDrained() || Thread.currentThread().isInterrupted()) return;
                continue;
            }
            try {
                handle(item, queue, listener);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                emit(listener, new FetchResult.Failure(item.getUrl(), ErrorKind.CANCELLED,
                        item.getAttempt(), "interrupted before request", item));
            } catch (RuntimeException e) {
                // 항목마다 종결 결과 하나는 반드시 내보낸다
                LOG.warn("Unexpected error while handling {}: {}", item, e.toString(), e);
                emit(listener, new FetchResult.Failure(item.getUrl(), ErrorKind.IO_ERROR,
                        item.getAttempt() + 1, e.toString(), item));
            } finally {
                queue.done();
            }
        }
    }

    private void handle(WorkItem item, WorkQueue queue, FetchResultListener listener) throws InterruptedException {
        throttle.acquire(item.host());

        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        PageResponse resp;
        try {
            resp = pageFetcher.fetch(item.getUrl(), timeout);
        } finally {
            inFlight.decrementAndGet();
        }
        stats.addAttempt(resp.getResponseTimeMs());

        int attempts = item.getAttempt() + 1;
        if (resp.isSuccess()) {
            emit(listener, new FetchResult.Success(item.getUrl(), resp.getBody(), resp.getStatusCode(),
                    Instant.now(), item));
            return;
        }

        ErrorKind kind = resp.errorKind();
        String msg = resp.getErrorMessage() != null ? resp.getErrorMessage() : "HTTP " + resp.getStatusCode();
        RetryDecision decision = retryPolicy.shouldRetry(attempts, kind);
        if (decision.retry()) {
            decision = decision.atLeast(cappedRetryAfter(resp));
            if (queue.resubmit(item.retryAfter(decision.delay()))) {
                stats.addRetry();
                SLOG.debug("fetch-retry",
                        "url", String.valueOf(item.getUrl()),
                        "kind", kind.name(),
                        "attempt", attempts,
                        "delayMs", decision.delay().toMillis());
                return;
            }
        }
        emit(listener, new FetchResult.Failure(item.getUrl(), kind, attempts, msg, item));
    }

    private Duration cappedRetryAfter(PageResponse resp) {
        return resp.retryAfter()
                .map(d -> d.compareTo(retryAfterCap) > 0 ? retryAfterCap : d)
                .orElse(Duration.ZERO);
    }

    private static void emit(FetchResultListener listener, FetchResult r) {
        try {
            listener.onResult(r);
        } catch (RuntimeException e) {
            LOG.warn("Result listener failed for {}: {}", r.url(), e.toString(), e);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
