package com.carcoverscraper.core.model;

/** 검색 결과 페이지 / 매물 상세 페이지 */
public enum PageKind {
    SEARCH, DETAIL
}
