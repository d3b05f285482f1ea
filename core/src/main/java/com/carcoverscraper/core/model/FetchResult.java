package com.carcoverscraper.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/**
 * 워커가 만들어 내는 페치 결과: Success 또는 (최종) Failure.
 * 생성 후 불변. Extractor로 넘기기 전까지는 만든 워커만 참조한다.
 */
public interface FetchResult {

    URI url();

    WorkItem item();

    default boolean isSuccess() { return this instanceof Success; }

    record Success(URI url, String body, int status, Instant fetchedAt, WorkItem item) implements FetchResult {
        public Success {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(fetchedAt, "fetchedAt");
            Objects.requireNonNull(item, "item");
            body = (body == null) ? "" : body;
        }
    }

    /** attempt = 실제로 수행한 시도 수(최종 시도 포함) */
    record Failure(URI url, ErrorKind errorKind, int attempt, String message, WorkItem item) implements FetchResult {
        public Failure {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(errorKind, "errorKind");
            Objects.requireNonNull(item, "item");
        }
    }
}
