package com.carcoverscraper.core.service;

/** 런 전체를 중단시키는 치명 오류(워커 스레드 생성 실패 등 자원 고갈). */
public class ScrapeAbortedException extends RuntimeException {
    public ScrapeAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
