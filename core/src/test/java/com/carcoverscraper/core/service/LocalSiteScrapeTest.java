package com.carcoverscraper.core.service;

import com.carcoverscraper.core.extract.Fixtures;
import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.Material;
import com.carcoverscraper.core.model.ScrapeConfig;
import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;
import com.carcoverscraper.core.model.Size;
import com.carcoverscraper.core.model.VehicleType;
import com.carcoverscraper.core.service.export.ExportCoordinator;
import com.carcoverscraper.core.service.export.ExportReport;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** 로컬 HttpServer에 픽스처 페이지를 올려 실제 HttpClient 경로로 전체 흐름 확인 */
@Timeout(60)
class LocalSiteScrapeTest {

    @TempDir
    Path tmp;

    private HttpServer server;
    private String base;
    private final AtomicInteger universalHits = new AtomicInteger();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/items/", ex -> send(ex, 200, Fixtures.page("search_page1.html")));
        server.createContext("/item/", ex -> {
            String path = ex.getRequestURI().getPath();
            if (path.endsWith("iid-1001")) {
                send(ex, 200, Fixtures.page("detail_suv.html"));
            } else if (path.endsWith("iid-1002")) {
                // 첫 요청은 503 → 재시도로 회복
                if (universalHits.incrementAndGet() == 1) send(ex, 503, "busy");
                else send(ex, 200, Fixtures.page("detail_universal.html"));
            } else {
                send(ex, 404, "not found");
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private static void send(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    @DisplayName("검색 → 상세(503 한 번 재시도) → 중복 제거 → CSV/Parquet")
    void endToEnd() {
        ScrapeConfig cfg = new ScrapeConfig()
                .setBaseUrl(base)
                .setPages(1)
                .setFollowPagination(false)
                .setConcurrency(2)
                .setOutputDir(tmp);
        cfg.getThrottle().setMinIntervalMs(10).setJitterMs(0);
        cfg.getRetry().setBackoffBaseMs(20);

        ScrapeResult result = new ScrapePipeline(cfg).run();

        assertThat(result.records()).hasSize(2);
        CandidateRecord universal = result.records().get(0);
        CandidateRecord suv = result.records().get(1);

        assertEquals(VehicleType.UNIVERSAL, universal.getVehicleType());
        assertEquals(Material.UNKNOWN, universal.getMaterial());
        // 상세 페이지에 없는 가격/위치는 검색 카드에서
        assertThat(universal.getLocation()).contains("Koramangala, Bengaluru");

        assertEquals(Material.POLYESTER, suv.getMaterial());
        assertEquals(VehicleType.SUV, suv.getVehicleType());
        assertThat(suv.getSize()).contains(new Size(450, 190));
        assertEquals(3, suv.getImageCount());

        assertEquals(2, universalHits.get());
        assertEquals(3, result.summary().succeeded());
        assertEquals(0, result.summary().failed());
        assertEquals(1, result.summary().runtime().retriesTotal);

        ExportReport report = new ExportCoordinator()
                .exportAll(cfg.getOutputDir(), result.records(), Instant.now(), cfg.getOutputFormats());
        assertTrue(report.isSuccess(), () -> "errors: " + report.errors());
        assertTrue(Files.exists(report.written().get(OutputFormat.CSV)));
        assertTrue(Files.exists(report.written().get(OutputFormat.PARQUET)));
    }
}
