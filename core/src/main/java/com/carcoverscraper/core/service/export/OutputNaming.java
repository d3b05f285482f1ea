package com.carcoverscraper.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** 출력 파일명: {outputDir}/car_covers_yyyyMMdd_HHmmss.{csv|parquet} */
public final class OutputNaming {
    private OutputNaming() {}

    public static final String PREFIX = "car_covers_";

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    public static String filePrefix(Instant startedAt) {
        return PREFIX + TS_FMT.format(startedAt == null ? Instant.now() : startedAt);
    }

    public static Path outputDir(Path dir) { return dir == null ? Paths.get("out") : dir; }

    public static Path csvPath(Path dir, Instant startedAt) {
        return outputDir(dir).resolve(filePrefix(startedAt) + ".csv");
    }

    public static Path parquetPath(Path dir, Instant startedAt) {
        return outputDir(dir).resolve(filePrefix(startedAt) + ".parquet");
    }
}
