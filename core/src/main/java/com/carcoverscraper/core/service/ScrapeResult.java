package com.carcoverscraper.core.service;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.RunSummary;

import java.util.List;
import java.util.Objects;

/** 확정된(동결된) 레코드 집합 + 런 요약. Writer로 넘기는 단위. */
public record ScrapeResult(List<CandidateRecord> records, RunSummary summary) {
    public ScrapeResult {
        records = (records == null) ? List.of() : List.copyOf(records);
        Objects.requireNonNull(summary, "summary");
    }
}
