package com.carcoverscraper.app;

import com.carcoverscraper.app.logging.LogSetup;
import com.carcoverscraper.core.model.FailureEntry;
import com.carcoverscraper.core.model.RunSummary;
import com.carcoverscraper.core.model.ScrapeConfig;
import com.carcoverscraper.core.service.ScrapeAbortedException;
import com.carcoverscraper.core.service.ScrapePipeline;
import com.carcoverscraper.core.service.ScrapeResult;
import com.carcoverscraper.core.service.export.ExportCoordinator;
import com.carcoverscraper.core.service.export.ExportReport;
import com.carcoverscraper.core.util.YamlConfigLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 사용법: Main [scrape.yml]
 * 인자가 없으면 ./scrape.yml, 그것도 없으면 기본값.
 * 종료 코드: 0 성공(부분 성공 포함), 1 내보내기 실패, 2 설정 오류/치명적 중단
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_EXPORT_FAILED = 1;
    static final int EXIT_FATAL = 2;

    /** Ctrl-C 후 정상 드레인을 기다리는 시간, 넘으면 강제 취소 */
    private static final long GRACE_SECONDS = 30;

    private Main() {}

    public static void main(String[] args) {
        int code = run(args);
        System.exit(code);
    }

    static int run(String[] args) {
        ScrapeConfig cfg;
        try {
            cfg = loadConfig(args);
            applyOverrides(cfg);
            cfg.validate();
        } catch (IOException | RuntimeException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_FATAL;
        }

        LogSetup.configure(cfg.getOutputDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        Instant started = Instant.now();
        ScrapePipeline pipeline = new ScrapePipeline(cfg);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            LOG.warning("Interrupt signal received; draining in-flight work.");
            pipeline.shutdown();
            try {
                if (!finished.await(GRACE_SECONDS, TimeUnit.SECONDS)) {
                    pipeline.cancel();
                    finished.await(GRACE_SECONDS, TimeUnit.SECONDS);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            ScrapeResult result;
            try {
                result = pipeline.run((phase, done, queued) ->
                        LOG.fine(() -> "[" + phase + "] done=" + done + ", queued=" + queued));
            } catch (ScrapeAbortedException e) {
                LOG.log(Level.SEVERE, "Scrape aborted: " + e.getMessage(), e);
                System.err.println("Scrape aborted: " + e.getMessage());
                return EXIT_FATAL;
            }

            ExportReport report = new ExportCoordinator()
                    .exportAll(cfg.getOutputDir(), result.records(), started, cfg.getOutputFormats());

            printSummary(result.summary(), report);
            return report.isSuccess() ? EXIT_OK : EXIT_EXPORT_FAILED;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException shuttingDown) {
                LOG.fine("JVM already shutting down; hook stays registered");
            }
        }
    }

    static ScrapeConfig loadConfig(String[] args) throws IOException {
        if (args != null && args.length > 0 && !args[0].isBlank()) {
            return YamlConfigLoader.load(Path.of(args[0]));
        }
        Path def = Path.of("scrape.yml");
        return Files.exists(def) ? YamlConfigLoader.load(def) : ScrapeConfig.defaults();
    }

    /** -Dcc.pages / -Dcc.concurrency / -Dcc.out.dir */
    static void applyOverrides(ScrapeConfig cfg) {
        String pages = System.getProperty("cc.pages");
        if (pages != null && !pages.isBlank()) cfg.setPages(Integer.parseInt(pages.trim()));
        String cc = System.getProperty("cc.concurrency");
        if (cc != null && !cc.isBlank()) cfg.setConcurrency(Integer.parseInt(cc.trim()));
        String out = System.getProperty("cc.out.dir");
        if (out != null && !out.isBlank()) cfg.setOutputDir(Path.of(out.trim()));
    }

    private static void printSummary(RunSummary s, ExportReport report) {
        System.out.println("Run summary: " + s.oneLine());
        System.out.println("Runtime: attempts=" + s.runtime().attemptsTotal
                + ", retries=" + s.runtime().retriesTotal
                + ", maxConcurrency=" + s.runtime().maxObservedConcurrency
                + ", avgLatencyMs=" + s.runtime().avgLatencyMs);
        for (FailureEntry f : s.failures()) {
            System.out.println("  failed: " + f.url() + " [" + f.errorKind() + ", attempts=" + f.attempts() + "]");
        }
        report.written().forEach((fmt, p) -> System.out.println("Saved " + fmt + ": " + p.toAbsolutePath()));
        report.errors().forEach((fmt, err) -> System.err.println("Export " + fmt + " failed: " + err));
    }
}
