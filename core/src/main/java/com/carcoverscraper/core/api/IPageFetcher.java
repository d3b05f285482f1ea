// IPageFetcher.java
package com.carcoverscraper.core.api;

import com.carcoverscraper.core.model.PageResponse;

import java.net.URI;
import java.time.Duration;

/**
 * 페이지 페치 최소 계약: fetch(url, timeout) → {status, body} 또는 오류 분류.
 * 예외를 던지지 않는다. 전송 오류는 PageResponse.transportError로 돌려준다.
 */
@FunctionalInterface
public interface IPageFetcher extends AutoCloseable {
    PageResponse fetch(URI url, Duration timeout);
    @Override default void close() throws Exception {}
}
