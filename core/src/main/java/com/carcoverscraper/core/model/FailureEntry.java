package com.carcoverscraper.core.model;

/** 런 요약에 남는 최종 실패 1건 */
public record FailureEntry(String url, ErrorKind errorKind, int attempts, String message) {
    public static FailureEntry of(FetchResult.Failure f) {
        return new FailureEntry(f.url().toString(), f.errorKind(), f.attempt(), f.message());
    }
}
