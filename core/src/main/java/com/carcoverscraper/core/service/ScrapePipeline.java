package com.carcoverscraper.core.service;

import com.carcoverscraper.core.api.IPageFetcher;
import com.carcoverscraper.core.dedupe.Deduplicator;
import com.carcoverscraper.core.dedupe.OfferResult;
import com.carcoverscraper.core.extract.Extractor;
import com.carcoverscraper.core.extract.JsoupListingExtractor;
import com.carcoverscraper.core.extract.JsoupSearchPageParser;
import com.carcoverscraper.core.extract.SearchPage;
import com.carcoverscraper.core.extract.SearchPageParser;
import com.carcoverscraper.core.fetch.Fetcher;
import com.carcoverscraper.core.fetch.WorkQueue;
import com.carcoverscraper.core.http.CountingRetryPolicy;
import com.carcoverscraper.core.http.DefaultRetryPolicy;
import com.carcoverscraper.core.http.HttpPageFetcher;
import com.carcoverscraper.core.http.RetryPolicy;
import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.ErrorKind;
import com.carcoverscraper.core.model.FailureEntry;
import com.carcoverscraper.core.model.FetchResult;
import com.carcoverscraper.core.model.ListingSummary;
import com.carcoverscraper.core.model.PageKind;
import com.carcoverscraper.core.model.PipelineState;
import com.carcoverscraper.core.model.RunSummary;
import com.carcoverscraper.core.model.ScrapeConfig;
import com.carcoverscraper.core.model.ScrapeStats;
import com.carcoverscraper.core.model.WorkItem;
import com.carcoverscraper.core.util.ProgressListener;
import com.carcoverscraper.core.util.RequestThrottle;
import com.carcoverscraper.core.util.StructuredLog;
import com.carcoverscraper.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 스크랩 오케스트레이터:
 *  - Seeding → Running → Draining → Finalized
 *  - Fetcher(N 워커) → 검색 페이지는 상세/다음 페이지 WorkItem으로, 상세 페이지는 Extractor → Deduplicator
 *  - 최종 실패는 실패 로그에만 쌓고 런은 계속(치명적인 것은 워커 생성 실패뿐)
 *  - 기본 구현체 생성자 + DI 생성자(테스트용)
 *
 * 한 인스턴스는 한 번만 run 할 수 있다.
 */
public final class ScrapePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapePipeline.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapePipeline.class);

    private final ScrapeConfig config;
    private final IPageFetcher pageFetcher;
    private final Extractor extractor;
    private final SearchPageParser searchParser;
    private final CountingRetryPolicy retryPolicy;
    private final RequestThrottle throttle;

    private final ScrapeStats stats = new ScrapeStats();
    private final WorkQueue queue = new WorkQueue();
    private final Deduplicator dedup = new Deduplicator();
    private final Queue<FailureEntry> failures = new ConcurrentLinkedQueue<>();
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.IDLE);
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile ProgressListener progress = ProgressListener.NONE;

    /** 기본 구현(HttpClient + jsoup) */
    public ScrapePipeline(ScrapeConfig config) {
        this(validated(config), new HttpPageFetcher(config), new JsoupListingExtractor(),
                new JsoupSearchPageParser(), defaultThrottle(config), defaultRetryPolicy(config));
    }

    /** DI/테스트용 */
    public ScrapePipeline(ScrapeConfig config, IPageFetcher pageFetcher, Extractor extractor,
                          SearchPageParser searchParser, RequestThrottle throttle, RetryPolicy retryPolicy) {
        this.config = validated(config);
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.searchParser = Objects.requireNonNull(searchParser, "searchParser");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.retryPolicy = new CountingRetryPolicy(Objects.requireNonNull(retryPolicy, "retryPolicy"));
    }

    public static RequestThrottle defaultThrottle(ScrapeConfig c) {
        ScrapeConfig.ThrottleCfg t = c.getThrottle();
        return new RequestThrottle(Duration.ofMillis(t.getMinIntervalMs()), Duration.ofMillis(t.getJitterMs()), t.isPerHost());
    }

    public static RetryPolicy defaultRetryPolicy(ScrapeConfig c) {
        return new DefaultRetryPolicy(c.getRetry().getMaxAttempts(), c.getRetry().getBackoffBaseMs());
    }

    /* =========================
       실행 API
       ========================= */

    public ScrapeResult run() {
        return run(ProgressListener.NONE);
    }

    /**
     * 큐가 드레인될 때까지 블록한 뒤 레코드 집합을 동결해 반환.
     * 호출 스레드가 인터럽트되면 강제 취소로 보고 그때까지의 결과로 마감한다(인터럽트 플래그는 복원).
     *
     * @throws ScrapeAbortedException 워커를 띄우지 못한 경우
     * @throws IllegalStateException  이미 실행한 인스턴스
     */
    public ScrapeResult run(ProgressListener listener) {
        if (!state.compareAndSet(PipelineState.IDLE, PipelineState.SEEDING)) {
            throw new IllegalStateException("pipeline already started: " + state.get());
        }
        this.progress = (listener != null) ? listener : ProgressListener.NONE;
        final int cc = config.getConcurrency();

        LOG.info("Scrape start: base={}, term={}, pages={}, cc={}",
                config.getBaseUrl(), config.getSearchTerm(), config.getPages(), cc);
        SLOG.info("run-start",
                "baseUrl", String.valueOf(config.getBaseUrl()),
                "searchTerm", String.valueOf(config.getSearchTerm()),
                "pages", config.getPages(),
                "seeds", config.getSeedUrls().size(),
                "cc", cc);

        // ---- 0) 시드 ----
        int seeded = seed();
        notifyProgress("seed", 0, seeded);

        // ---- 1) 페치 ----
        boolean interrupted = false;
        state.compareAndSet(PipelineState.SEEDING, PipelineState.RUNNING);
        Fetcher fetcher = new Fetcher(pageFetcher, throttle, retryPolicy, stats,
                config.getTimeout(), Duration.ofMillis(config.getRetry().getRetryAfterCapMs()));
        try {
            fetcher.run(queue, cc, this::onResult);
        } catch (InterruptedException ie) {
            interrupted = true;
            LOG.warn("Scrape interrupted; finalizing partial results");
            cancel();
        } catch (ScrapeAbortedException e) {
            state.set(PipelineState.FINALIZED);
            LOG.error("Scrape aborted: {}", e.getMessage(), e);
            SLOG.error("run-aborted", e, "cause", e.toString());
            throw e;
        }

        // ---- 2) 드레인 완료 → 동결 ----
        state.set(PipelineState.DRAINING);
        queue.close();
        notifyProgress("finalize", succeeded.get() + failed.get(), queue.outstanding());

        List<CandidateRecord> records = dedup.freeze();
        RunSummary summary = new RunSummary(
                succeeded.get() + failed.get(),
                succeeded.get(),
                failed.get(),
                dedup.duplicateCount(),
                records.size(),
                cancelled.get(),
                new ArrayList<>(failures),
                stats.snapshot());
        state.set(PipelineState.FINALIZED);

        ScrapeStats.Snapshot rt = summary.runtime();
        LOG.info("Scrape done. {}", summary.oneLine());
        SLOG.info("run-done",
                "fetched", summary.fetched(),
                "succeeded", summary.succeeded(),
                "failed", summary.failed(),
                "deduplicated", summary.deduplicated(),
                "finalRecordCount", summary.finalRecordCount(),
                "cancelled", summary.cancelled(),
                "attempts", rt.attemptsTotal,
                "retries", rt.retriesTotal,
                "giveUps", retryPolicy.getGiveUpCount(),
                "maxObservedCC", rt.maxObservedConcurrency,
                "avgLatencyMs", rt.avgLatencyMs);

        if (interrupted) Thread.currentThread().interrupt();
        return new ScrapeResult(records, summary);
    }

    /** 정상 종료 요청: 새 최상위 작업은 받지 않고 진행 중/재시도 대기 작업은 끝까지 처리 */
    public void shutdown() {
        queue.close();
        state.compareAndSet(PipelineState.RUNNING, PipelineState.DRAINING);
        LOG.info("Shutdown requested; draining {} outstanding item(s)", queue.outstanding());
    }

    /** 강제 취소: 대기/지연 중 작업 폐기(취소 실패로 기록), 진행 중 요청만 마무리 */
    public void cancel() {
        cancelled.set(true);
        List<WorkItem> dropped = queue.cancel();
        for (WorkItem w : dropped) {
            recordFailure(new FetchResult.Failure(w.getUrl(), ErrorKind.CANCELLED, w.getAttempt(), "cancelled before fetch", w));
        }
        state.compareAndSet(PipelineState.RUNNING, PipelineState.DRAINING);
        LOG.warn("Cancel requested; dropped {} queued item(s)", dropped.size());
    }

    public PipelineState state() { return state.get(); }

    public ScrapeStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    /* =========================
       내부
       ========================= */

    private int seed() {
        int admitted = 0;
        int pageNo = 0;
        for (String s : config.resolveSeeds()) {
            Optional<URI> parsed = parseSeed(s);
            if (parsed.isEmpty()) {
                failed.incrementAndGet();
                failures.add(new FailureEntry(s, ErrorKind.MALFORMED_URL, 0, "invalid seed url"));
                LOG.warn("Skipping malformed seed: {}", s);
                SLOG.warn("fetch-failed", "url", s, "kind", ErrorKind.MALFORMED_URL.name(), "attempts", 0);
                continue;
            }
            URI u = parsed.get();
            WorkItem item = UrlUtils.looksLikeListing(u)
                    ? WorkItem.detail(u, null)
                    : WorkItem.search(u, pageNo < config.getPages() ? ++pageNo : 1);
            if (queue.offer(item)) admitted++;
        }
        LOG.debug("Seeded {} work item(s)", admitted);
        return admitted;
    }

    static Optional<URI> parseSeed(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        try {
            URI u = new URI(s.trim());
            String scheme = u.getScheme();
            if (scheme == null || u.getHost() == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(u);
        } catch (java.net.URISyntaxException e) {
            return Optional.empty();
        }
    }

    /** 워커 스레드에서 호출됨(해당 항목 done() 이전) */
    private void onResult(FetchResult r) {
        if (r instanceof FetchResult.Failure f) {
            recordFailure(f);
        } else if (r instanceof FetchResult.Success s) {
            succeeded.incrementAndGet();
            if (s.item().getKind() == PageKind.SEARCH) {
                onSearchPage(s);
            } else {
                onDetailPage(s);
            }
        }
        notifyProgress("fetch", succeeded.get() + failed.get(), queue.outstanding());
    }

    private void recordFailure(FetchResult.Failure f) {
        failed.incrementAndGet();
        failures.add(FailureEntry.of(f));
        LOG.warn("Fetch failed: {} kind={} attempts={}", f.url(), f.errorKind(), f.attempt());
        SLOG.warn("fetch-failed",
                "url", String.valueOf(f.url()),
                "kind", f.errorKind().name(),
                "attempts", f.attempt(),
                "message", f.message());
    }

    private void onSearchPage(FetchResult.Success s) {
        WorkItem item = s.item();
        SearchPage page = searchParser.parse(s.body(), s.url(), item.getPageNo());
        int added = 0;
        for (ListingSummary l : page.listings()) {
            if (queue.offer(WorkItem.detail(l.detailUrl(), l))) added++;
        }
        if (page.listings().isEmpty()) {
            LOG.warn("No listings found on {}", s.url());
        }
        int nextNo = item.getPageNo() + 1;
        if (config.isFollowPagination() && nextNo <= config.getMaxPages()) {
            page.next().ifPresent(next -> {
                if (queue.offer(WorkItem.search(next, nextNo))) {
                    LOG.debug("Pagination: page #{} -> {}", nextNo, next);
                }
            });
        }
        LOG.info("Search page #{} {} -> listings={}, queued={}", item.getPageNo(), s.url(), page.listings().size(), added);
    }

    private void onDetailPage(FetchResult.Success s) {
        Optional<CandidateRecord> rec;
        try {
            rec = extractor.extract(s);
        } catch (RuntimeException e) {
            // 추출기 결함도 런을 멈추지 않는다
            LOG.warn("Extractor failed on {}: {}", s.url(), e.toString(), e);
            return;
        }
        if (rec.isEmpty()) {
            LOG.debug("Not a listing page: {}", s.url());
            return;
        }
        CandidateRecord r = rec.get();
        OfferResult outcome;
        try {
            outcome = dedup.offer(r);
        } catch (IllegalStateException frozen) {
            LOG.debug("Record set already finalized; dropping {}", s.url());
            return;
        }
        LOG.debug("Record {} -> {}", r.getSourceUrl(), outcome);
        SLOG.debug("record-offered",
                "url", r.getSourceUrl(),
                "outcome", outcome.name(),
                "material", r.getMaterial().name(),
                "vehicleType", r.getVehicleType().name());
    }

    private void notifyProgress(String phase, long done, long queued) {
        try {
            progress.onProgress(phase, done, queued);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    private static ScrapeConfig validated(ScrapeConfig c) {
        Objects.requireNonNull(c, "config").validate();
        return c;
    }
}
