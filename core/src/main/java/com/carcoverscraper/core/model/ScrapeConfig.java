package com.carcoverscraper.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 수집 설정 (scrape.yml 매핑 대상). 순수 설정 보관용.
 * 기본값은 OLX 인도 "car-cover" 검색 기준.
 */
public final class ScrapeConfig {

    /** 출력 포맷: 행 기반 CSV + 컬럼형 Parquet */
    public enum OutputFormat { CSV, PARQUET }

    /** 요청 간격 하위 설정: YAML의 `throttle:` 섹션 */
    public static final class ThrottleCfg {
        private long minIntervalMs = 1000;
        private long jitterMs = 2000;     // 1~3초 랜덤 간격
        private boolean perHost = true;   // false면 전역 단일 스코프

        public long getMinIntervalMs() { return minIntervalMs; }
        public ThrottleCfg setMinIntervalMs(long v) { this.minIntervalMs = v; return this; }
        public long getJitterMs() { return jitterMs; }
        public ThrottleCfg setJitterMs(long v) { this.jitterMs = v; return this; }
        public boolean isPerHost() { return perHost; }
        public ThrottleCfg setPerHost(boolean v) { this.perHost = v; return this; }
    }

    /** 재시도 하위 설정: YAML의 `retry:` 섹션 */
    public static final class RetryCfg {
        private int maxAttempts = 3;
        private long backoffBaseMs = 500;
        private long retryAfterCapMs = 30_000;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = v; return this; }
        public long getBackoffBaseMs() { return backoffBaseMs; }
        public RetryCfg setBackoffBaseMs(long v) { this.backoffBaseMs = v; return this; }
        public long getRetryAfterCapMs() { return retryAfterCapMs; }
        public RetryCfg setRetryAfterCapMs(long v) { this.retryAfterCapMs = v; return this; }
    }

    // ---------- 대상 ----------
    private String baseUrl = "https://www.olx.in";
    private String searchTerm = "car-cover";
    private int pages = 2;
    private List<String> seedUrls = List.of();
    private boolean followPagination = true;
    private int maxPages = 5;

    // ---------- 네트워크 ----------
    private int concurrency = 4;
    private Duration timeout = Duration.ofSeconds(10);
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    private String acceptLanguage = "en-US,en;q=0.9";
    private ThrottleCfg throttle = new ThrottleCfg();
    private RetryCfg retry = new RetryCfg();

    // ---------- 출력 ----------
    private Path outputDir = Path.of("out");
    private Set<OutputFormat> outputFormats = EnumSet.allOf(OutputFormat.class);

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public String getSearchTerm() { return searchTerm; }
    public int getPages() { return pages; }
    public List<String> getSeedUrls() { return seedUrls; }
    public boolean isFollowPagination() { return followPagination; }
    public int getMaxPages() { return maxPages; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public String getAcceptLanguage() { return acceptLanguage; }
    public ThrottleCfg getThrottle() { return throttle; }
    public RetryCfg getRetry() { return retry; }
    public Path getOutputDir() { return outputDir; }
    public Set<OutputFormat> getOutputFormats() { return outputFormats; }

    // ---------- fluent setters ----------
    public ScrapeConfig setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
    public ScrapeConfig setSearchTerm(String searchTerm) { this.searchTerm = searchTerm; return this; }
    public ScrapeConfig setPages(int pages) { this.pages = pages; return this; }
    public ScrapeConfig setSeedUrls(List<String> seeds) {
        this.seedUrls = (seeds == null) ? List.of() : List.copyOf(seeds);
        return this;
    }
    public ScrapeConfig setFollowPagination(boolean v) { this.followPagination = v; return this; }
    public ScrapeConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    /** 하한 보정 없음: 0 이하는 validate()에서 거부 */
    public ScrapeConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public ScrapeConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScrapeConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public ScrapeConfig setAcceptLanguage(String acceptLanguage) { this.acceptLanguage = acceptLanguage; return this; }
    public ScrapeConfig setThrottle(ThrottleCfg throttle) { this.throttle = (throttle != null ? throttle : new ThrottleCfg()); return this; }
    public ScrapeConfig setRetry(RetryCfg retry) { this.retry = (retry != null ? retry : new RetryCfg()); return this; }
    public ScrapeConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public ScrapeConfig setOutputFormats(Set<OutputFormat> formats) {
        this.outputFormats = (formats == null || formats.isEmpty())
                ? EnumSet.noneOf(OutputFormat.class) : EnumSet.copyOf(formats);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (pages < 0) throw new IllegalArgumentException("pages must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        Objects.requireNonNull(seedUrls, "seedUrls");
        if (seedUrls.isEmpty() && pages == 0)
            throw new IllegalArgumentException("no seed: set pages >= 1 or seedUrls");
        if (pages > 0) {
            Objects.requireNonNull(baseUrl, "baseUrl");
            Objects.requireNonNull(searchTerm, "searchTerm");
        }

        Objects.requireNonNull(throttle, "throttle");
        if (throttle.getMinIntervalMs() < 0) throw new IllegalArgumentException("throttle.minIntervalMs must be >= 0");
        if (throttle.getJitterMs() < 0) throw new IllegalArgumentException("throttle.jitterMs must be >= 0");

        Objects.requireNonNull(retry, "retry");
        if (retry.getMaxAttempts() < 1) throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        if (retry.getBackoffBaseMs() < 1) throw new IllegalArgumentException("retry.backoffBaseMs must be >= 1");
        if (retry.getRetryAfterCapMs() < 0) throw new IllegalArgumentException("retry.retryAfterCapMs must be >= 0");

        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(outputFormats, "outputFormats");
    }

    // ---------- helpers ----------
    public static ScrapeConfig defaults() { return new ScrapeConfig(); }

    /** 검색 결과 n페이지 URL: {base}/items/q-{term}?page=n */
    public URI searchPageUri(int page) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String term = searchTerm.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        return URI.create(base + "/items/q-" + term + "?page=" + page);
    }

    /** 시드 순서: 검색 페이지 1..pages, 그 다음 명시 seedUrls */
    public List<String> resolveSeeds() {
        List<String> out = new ArrayList<>();
        for (int p = 1; p <= pages; p++) out.add(searchPageUri(p).toString());
        out.addAll(seedUrls);
        return out;
    }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public ScrapeConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
