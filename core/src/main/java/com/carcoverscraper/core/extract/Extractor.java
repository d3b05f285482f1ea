package com.carcoverscraper.core.extract;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.FetchResult;

import java.util.Optional;

/**
 * 상세 페이지 → CandidateRecord.
 * 입력 내용만으로 결과가 정해져야 한다(네트워크/공유 상태 접근 금지).
 * 매물 페이지가 아니면 empty. 예외를 던지지 않는다.
 */
public interface Extractor {
    Optional<CandidateRecord> extract(FetchResult.Success page);
}
