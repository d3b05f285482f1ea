package com.carcoverscraper.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 검색 결과 카드에서 읽은 요약. 상세 페이지 추출 시 누락 필드 보충용 힌트.
 * 빈 문자열은 null로 정규화.
 */
public record ListingSummary(URI detailUrl, String title, String priceText, String location) {
    public ListingSummary {
        Objects.requireNonNull(detailUrl, "detailUrl");
        title = blankToNull(title);
        priceText = blankToNull(priceText);
        location = blankToNull(location);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.strip();
        return t.isEmpty() ? null : t;
    }
}
