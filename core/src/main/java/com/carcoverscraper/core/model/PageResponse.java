package com.carcoverscraper.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 페치 한 번의 원시 결과(본문은 텍스트 기준).
 * 전송 계층 오류면 statusCode=-1 이고 transportError가 채워진다.
 */
public final class PageResponse {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final ErrorKind transportError;
    private final String errorMessage;
    private final long responseTimeMs;

    private PageResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.transportError = b.transportError;
        this.errorMessage = b.errorMessage;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public String getErrorMessage() { return errorMessage; }

    public boolean isSuccess() {
        return transportError == null && statusCode >= 200 && statusCode < 300;
    }

    /** 실패 분류(성공이면 null). 전송 오류가 상태코드보다 우선. */
    public ErrorKind errorKind() {
        if (transportError != null) return transportError;
        return ErrorKind.ofStatus(statusCode);
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** Retry-After(초 단위 형식만). HTTP-date 형식은 무시. */
    public Optional<Duration> retryAfter() {
        String v = header("Retry-After");
        if (v == null || v.isBlank()) return Optional.empty();
        try {
            long sec = Long.parseLong(v.trim());
            return sec < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(sec));
        } catch (NumberFormatException ignore) {
            return Optional.empty();
        }
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private ErrorKind transportError;
        private String errorMessage;
        private long responseTimeMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder transportError(ErrorKind kind, String message) {
            this.transportError = kind;
            this.errorMessage = message;
            this.statusCode = -1;
            return this;
        }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public PageResponse build() {
            Objects.requireNonNull(url, "url");
            return new PageResponse(this);
        }
    }
}
