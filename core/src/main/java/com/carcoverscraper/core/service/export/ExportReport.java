package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 포맷별 산출 파일과 실패 사유. 한 포맷이 실패해도 다른 포맷 결과는 남는다. */
public record ExportReport(Map<OutputFormat, Path> written, Map<OutputFormat, String> errors) {
    public ExportReport {
        written = Collections.unmodifiableMap(written.isEmpty() ? new EnumMap<>(OutputFormat.class) : new EnumMap<>(written));
        errors = Collections.unmodifiableMap(errors.isEmpty() ? new EnumMap<>(OutputFormat.class) : new EnumMap<>(errors));
    }

    public boolean isSuccess() { return errors.isEmpty(); }
}
