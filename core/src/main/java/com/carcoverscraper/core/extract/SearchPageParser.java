package com.carcoverscraper.core.extract;

import java.net.URI;

/** 검색 결과 HTML → 매물 카드 요약 + 다음 페이지. 파싱 불가 마크업은 빈 결과. */
public interface SearchPageParser {
    SearchPage parse(String html, URI pageUrl, int pageNo);
}
