package com.carcoverscraper.core.extract;

import com.carcoverscraper.core.model.ListingSummary;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/** 검색 결과 페이지 파싱 결과: 매물 카드 목록 + 다음 페이지(없으면 null) */
public record SearchPage(List<ListingSummary> listings, URI nextPage) {
    public SearchPage {
        listings = (listings == null) ? List.of() : List.copyOf(listings);
    }

    public Optional<URI> next() { return Optional.ofNullable(nextPage); }

    public static SearchPage empty() { return new SearchPage(List.of(), null); }
}
