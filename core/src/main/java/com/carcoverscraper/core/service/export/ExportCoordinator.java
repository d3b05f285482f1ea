package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;
import com.carcoverscraper.core.util.StructuredLog;

import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 요청된 포맷마다 RecordWriter 실행. 포맷 하나의 실패는 기록만 하고 나머지는 계속.
 */
public final class ExportCoordinator {

    private static final Logger LOG = Logger.getLogger(ExportCoordinator.class.getName());
    private static final StructuredLog SLOG = StructuredLog.get(ExportCoordinator.class);

    private final Map<OutputFormat, RecordWriter> writers = new EnumMap<>(OutputFormat.class);

    public ExportCoordinator() {
        this(List.of(new CsvRecordWriter(), new ParquetRecordWriter()));
    }

    /** 테스트/대체 구현 주입용 */
    public ExportCoordinator(List<? extends RecordWriter> writers) {
        for (RecordWriter w : Objects.requireNonNull(writers, "writers")) {
            this.writers.put(w.format(), w);
        }
    }

    public ExportReport exportAll(Path outputDir, List<CandidateRecord> records, Instant startedAt,
                                  Set<OutputFormat> formats) {
        Objects.requireNonNull(records, "records");
        Instant started = (startedAt == null) ? Instant.now() : startedAt;

        LOG.info(() -> "[Export plan] formats=" + formats + ", records=" + records.size()
                + ", dir=" + OutputNaming.outputDir(outputDir).toAbsolutePath());

        Map<OutputFormat, Path> written = new EnumMap<>(OutputFormat.class);
        Map<OutputFormat, String> errors = new EnumMap<>(OutputFormat.class);

        for (OutputFormat f : formats) {
            RecordWriter w = writers.get(f);
            if (w == null) {
                errors.put(f, "no writer registered");
                LOG.warning(() -> "No writer for format " + f);
                continue;
            }
            try {
                Path p = w.write(outputDir, records, started);
                written.put(f, p);
                LOG.info(() -> f + " exported: " + p.toAbsolutePath());
                SLOG.info("export-done", "format", f.name(), "path", p.toString(), "records", records.size());
            } catch (Exception | LinkageError e) {
                // hadoop 클래스 로딩 실패(LinkageError)도 포맷 단위 실패로 본다
                errors.put(f, e.toString());
                LOG.log(Level.WARNING, f + " export failed", e);
                SLOG.error("export-failed", e, "format", f.name());
            }
        }
        return new ExportReport(written, errors);
    }
}
