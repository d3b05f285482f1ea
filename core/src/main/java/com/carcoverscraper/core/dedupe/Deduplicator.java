package com.carcoverscraper.core.dedupe;

import com.carcoverscraper.core.model.CandidateRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 지문 기준 레코드 집합. 여러 워커가 동시에 offer 해도 되고,
 * 지문당 정확히 1건만 남는다. freeze() 이후 offer는 IllegalStateException.
 */
public final class Deduplicator {

    /** 최종 출력 순서(실행마다 동일) */
    static final Comparator<CandidateRecord> OUTPUT_ORDER = Comparator
            .comparing(CandidateRecord::getSourceUrl)
            .thenComparing(CandidateRecord::getTitle);

    private final Map<Fingerprint, CandidateRecord> byKey = new HashMap<>();
    private long duplicates;
    private long merges;
    private boolean frozen;

    public synchronized OfferResult offer(CandidateRecord candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (frozen) throw new IllegalStateException("record set already finalized");
        Fingerprint fp = Fingerprint.of(candidate);
        CandidateRecord current = byKey.get(fp);
        if (current == null) {
            byKey.put(fp, candidate);
            return OfferResult.INSERTED;
        }
        duplicates++;
        if (MergePolicy.prefer(candidate, current)) {
            byKey.put(fp, candidate);
            merges++;
            return OfferResult.MERGED;
        }
        return OfferResult.IGNORED;
    }

    /** 더 이상 변경 불가로 전환하고 정렬된 스냅샷 반환. 여러 번 불러도 같은 결과. */
    public synchronized List<CandidateRecord> freeze() {
        frozen = true;
        return snapshot();
    }

    public synchronized List<CandidateRecord> snapshot() {
        List<CandidateRecord> out = new ArrayList<>(byKey.values());
        out.sort(OUTPUT_ORDER);
        return List.copyOf(out);
    }

    public synchronized boolean isFrozen() { return frozen; }
    public synchronized int size() { return byKey.size(); }
    /** 기존 지문과 충돌한 offer 수(MERGED + IGNORED) */
    public synchronized long duplicateCount() { return duplicates; }
    public synchronized long mergeCount() { return merges; }
}
