package com.carcoverscraper.core.fetch;

import com.carcoverscraper.core.model.FetchResult;

/** 워커 스레드에서 호출된다. 구현은 스레드 세이프해야 함. */
@FunctionalInterface
public interface FetchResultListener {
    void onResult(FetchResult result);
}
