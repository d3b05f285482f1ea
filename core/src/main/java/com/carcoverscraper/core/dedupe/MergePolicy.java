package com.carcoverscraper.core.dedupe;

import com.carcoverscraper.core.model.CandidateRecord;

/**
 * 같은 지문끼리 무엇을 남길지: "more complete wins".
 * 새 레코드가 채워진 필드 수가 엄격히 많을 때만 교체, 동률이면 먼저 들어온 것 유지.
 */
public final class MergePolicy {
    private MergePolicy() {}

    public static boolean prefer(CandidateRecord candidate, CandidateRecord current) {
        return candidate.completeness() > current.completeness();
    }
}
