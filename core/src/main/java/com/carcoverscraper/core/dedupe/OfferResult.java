package com.carcoverscraper.core.dedupe;

/** Deduplicator.offer 결과 */
public enum OfferResult {
    /** 새 지문 */
    INSERTED,
    /** 기존 레코드를 더 완전한 새 레코드로 교체 */
    MERGED,
    /** 기존 레코드 유지 */
    IGNORED;

    public boolean isDuplicate() { return this != INSERTED; }
}
