package com.carcoverscraper.core.model;

import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;

/**
 * 페치 실패 분류.
 * transient=true 인 종류만 RetryPolicy가 재시도 대상으로 본다.
 */
public enum ErrorKind {
    // ----- transient -----
    TIMEOUT(true),
    CONNECTION_RESET(true),
    CONNECTION_REFUSED(true),
    RATE_LIMITED(true),      // 429
    SERVER_ERROR(true),      // 5xx
    IO_ERROR(true),          // 기타 전송 오류

    // ----- permanent -----
    NOT_FOUND(false),        // 404
    GONE(false),             // 410
    CLIENT_ERROR(false),     // 기타 4xx
    MALFORMED_URL(false),
    DNS_FAILURE(false),
    UNEXPECTED_STATUS(false), // 리다이렉트 이후에도 남은 1xx/3xx
    CANCELLED(false);         // 강제 취소로 시도하지 못함

    private final boolean transientKind;

    ErrorKind(boolean transientKind) { this.transientKind = transientKind; }

    public boolean isTransient() { return transientKind; }

    /** HTTP 상태코드 분류. 2xx는 실패가 아니므로 null. */
    public static ErrorKind ofStatus(int status) {
        if (status >= 200 && status < 300) return null;
        if (status == 429) return RATE_LIMITED;
        if (status >= 500 && status <= 599) return SERVER_ERROR;
        if (status == 404) return NOT_FOUND;
        if (status == 410) return GONE;
        if (status == 408) return TIMEOUT;
        if (status >= 400 && status < 500) return CLIENT_ERROR;
        return UNEXPECTED_STATUS;
    }

    /** 전송 계층 예외 분류. cause 체인을 따라가며 가장 구체적인 것을 고른다. */
    public static ErrorKind ofException(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof HttpConnectTimeoutException) return TIMEOUT;
            if (cur instanceof HttpTimeoutException) return TIMEOUT;
            if (cur instanceof SocketTimeoutException) return TIMEOUT;
            if (cur instanceof UnknownHostException) return DNS_FAILURE;
            if (cur instanceof MalformedURLException) return MALFORMED_URL;
            if (cur instanceof IllegalArgumentException) return MALFORMED_URL; // URI/HttpRequest 검증 실패
            if (cur instanceof ConnectException) return CONNECTION_REFUSED;
            if (cur instanceof NoRouteToHostException) return CONNECTION_REFUSED;
            if (cur instanceof SocketException) {
                String m = String.valueOf(cur.getMessage()).toLowerCase(Locale.ROOT);
                if (m.contains("reset") || m.contains("broken pipe")) return CONNECTION_RESET;
            }
            String m = String.valueOf(cur.getMessage()).toLowerCase(Locale.ROOT);
            if (m.contains("connection reset")) return CONNECTION_RESET;
        }
        return IO_ERROR;
    }
}
