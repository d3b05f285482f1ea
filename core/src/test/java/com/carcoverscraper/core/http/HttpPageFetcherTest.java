package com.carcoverscraper.core.http;

import com.carcoverscraper.core.model.ErrorKind;
import com.carcoverscraper.core.model.PageResponse;
import com.carcoverscraper.core.model.ScrapeConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPageFetcherTest {

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://www.olx.in"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static final URI URL = URI.create("https://www.olx.in/item/car-cover-iid-1");

    @Test
    @DisplayName("200: 본문/상태 매핑 + 설정의 User-Agent/Accept-Language 전송")
    void success_mapsBody_andSendsConfiguredHeaders() {
        ScrapeConfig cfg = new ScrapeConfig().setUserAgent("TestAgent/1.0").setAcceptLanguage("en-IN");
        AtomicReference<HttpRequest> seen = new AtomicReference<>();
        HttpPageFetcher f = new HttpPageFetcher(cfg, req -> {
            seen.set(req);
            return new Resp(200, Map.of("Content-Type", List.of("text/html")), "<html>ok</html>");
        });

        PageResponse r = f.fetch(URL, Duration.ofSeconds(3));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.getBody()).isEqualTo("<html>ok</html>");
        assertThat(r.header("content-type")).isEqualTo("text/html");
        assertThat(r.errorKind()).isNull();

        HttpRequest req = seen.get();
        assertThat(req.headers().firstValue("User-Agent")).contains("TestAgent/1.0");
        assertThat(req.headers().firstValue("Accept-Language")).contains("en-IN");
        assertThat(req.timeout()).contains(Duration.ofSeconds(3));
        assertThat(req.method()).isEqualTo("GET");
    }

    @Test
    @DisplayName("429 + Retry-After: RATE_LIMITED, 대기 힌트 노출")
    void rateLimited_exposesRetryAfter() {
        HttpPageFetcher f = new HttpPageFetcher(new ScrapeConfig(),
                req -> new Resp(429, Map.of("Retry-After", List.of("7")), "slow down"));

        PageResponse r = f.fetch(URL, Duration.ofSeconds(1));

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.errorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(r.retryAfter()).contains(Duration.ofSeconds(7));
    }

    @Test
    @DisplayName("404/410/503 상태코드 분류")
    void statusCodes_areClassified() {
        assertThat(fetchStatus(404).errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(fetchStatus(410).errorKind()).isEqualTo(ErrorKind.GONE);
        assertThat(fetchStatus(503).errorKind()).isEqualTo(ErrorKind.SERVER_ERROR);
        assertThat(fetchStatus(403).errorKind()).isEqualTo(ErrorKind.CLIENT_ERROR);
        assertThat(fetchStatus(304).errorKind()).isEqualTo(ErrorKind.UNEXPECTED_STATUS);
    }

    @Test
    @DisplayName("전송 예외는 던지지 않고 ErrorKind 값으로 변환")
    void transportExceptions_becomeErrorKinds() {
        assertThat(fetchThrowing(new HttpTimeoutException("request timed out")).errorKind())
                .isEqualTo(ErrorKind.TIMEOUT);
        assertThat(fetchThrowing(new ConnectException("Connection refused")).errorKind())
                .isEqualTo(ErrorKind.CONNECTION_REFUSED);
        assertThat(fetchThrowing(new java.io.IOException("wrapped", new UnknownHostException("nowhere"))).errorKind())
                .isEqualTo(ErrorKind.DNS_FAILURE);
        assertThat(fetchThrowing(new java.io.IOException("Connection reset by peer")).errorKind())
                .isEqualTo(ErrorKind.CONNECTION_RESET);

        PageResponse r = fetchThrowing(new java.io.IOException("boom"));
        assertThat(r.getStatusCode()).isEqualTo(-1);
        assertThat(r.errorKind()).isEqualTo(ErrorKind.IO_ERROR);
        assertThat(r.getErrorMessage()).contains("boom");
    }

    @Test
    @DisplayName("요청 중 인터럽트는 CANCELLED(재시도 대상 아님) + 인터럽트 플래그 유지")
    void interruptDuringRequest_isCancelled() {
        try {
            PageResponse r = fetchThrowing(new InterruptedException("stop"));

            assertThat(r.errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(r.errorKind().isTransient()).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    private static PageResponse fetchStatus(int code) {
        return new HttpPageFetcher(new ScrapeConfig(), req -> new Resp(code, Map.of(), ""))
                .fetch(URL, Duration.ofSeconds(1));
    }

    private static PageResponse fetchThrowing(Exception e) {
        return new HttpPageFetcher(new ScrapeConfig(), req -> { throw e; })
                .fetch(URL, Duration.ofSeconds(1));
    }
}
