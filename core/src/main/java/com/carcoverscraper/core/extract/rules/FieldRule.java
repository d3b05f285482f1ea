package com.carcoverscraper.core.extract.rules;

import java.util.Optional;

/** 텍스트 → 필드 값 규칙 하나. 매칭 실패면 empty. 순수 함수여야 한다. */
@FunctionalInterface
public interface FieldRule<T> {
    Optional<T> apply(String text);
}
