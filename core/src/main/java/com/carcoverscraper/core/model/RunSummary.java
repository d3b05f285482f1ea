package com.carcoverscraper.core.model;

import java.util.List;

/**
 * 런 종료 시 집계.
 * - fetched: 최종 결과(성공+최종실패)가 나온 WorkItem 수
 * - deduplicated: 중복으로 판정되어 병합/무시된 후보 수
 */
public record RunSummary(
        long fetched,
        long succeeded,
        long failed,
        long deduplicated,
        int finalRecordCount,
        boolean cancelled,
        List<FailureEntry> failures,
        ScrapeStats.Snapshot runtime
) {
    public RunSummary {
        failures = (failures == null) ? List.of() : List.copyOf(failures);
    }

    public String oneLine() {
        return "fetched=" + fetched + ", succeeded=" + succeeded + ", failed=" + failed
                + ", deduplicated=" + deduplicated + ", finalRecordCount=" + finalRecordCount
                + (cancelled ? ", cancelled=true" : "");
    }
}
