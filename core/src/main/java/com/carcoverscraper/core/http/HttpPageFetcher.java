package com.carcoverscraper.core.http;

import com.carcoverscraper.core.api.IPageFetcher;
import com.carcoverscraper.core.model.ErrorKind;
import com.carcoverscraper.core.model.PageResponse;
import com.carcoverscraper.core.model.ScrapeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * java.net.http 기반 페처: GET 후 PageResponse로 매핑.
 * HTTP/1.1 고정: 동시 요청마다 별도 커넥션을 쓰게 해서 HTTP/2 단일 커넥션 HOL 블로킹을 피한다.
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final ScrapeConfig config;
    private final HttpSender sender;

    public HttpPageFetcher(ScrapeConfig config) {
        this(config, defaultSender(config));
    }

    /** 송신 훅 주입 */
    public HttpPageFetcher(ScrapeConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(ScrapeConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public PageResponse fetch(URI url, Duration timeout) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(timeout != null ? timeout : config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept-Language", config.getAcceptLanguage())
                    .header("Accept", "text/html,application/xhtml+xml")
                    .GET()
                    .build();

            HttpResponse<String> resp = sender.send(req);
            HttpHeaders hh = resp.headers();

            return PageResponse.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(hh.map())
                    .body(resp.body() == null ? "" : resp.body())
                    .responseTimeMs(elapsedMs(start))
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return failed(url, ErrorKind.CANCELLED, "interrupted during request", start);
        } catch (Exception e) {
            ErrorKind kind = ErrorKind.ofException(e);
            LOG.debug("fetch {} failed: {} ({})", url, kind, e.toString());
            return failed(url, kind, e.toString(), start);
        }
    }

    private static PageResponse failed(URI url, ErrorKind kind, String msg, long start) {
        return PageResponse.builder()
                .url(url)
                .headers(Map.of())
                .transportError(kind, msg)
                .responseTimeMs(elapsedMs(start))
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
