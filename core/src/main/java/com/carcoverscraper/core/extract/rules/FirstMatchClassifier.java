package com.carcoverscraper.core.extract.rules;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 순서 있는 규칙 목록. 앞의 규칙이 우선(텍스트 내 등장 위치와 무관).
 * 아무 규칙도 맞지 않으면 fallback.
 */
public final class FirstMatchClassifier<T> {
    private final List<FieldRule<T>> rules;
    private final T fallback;

    public FirstMatchClassifier(List<? extends FieldRule<T>> rules, T fallback) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public T classify(String text) {
        if (text == null || text.isBlank()) return fallback;
        for (FieldRule<T> r : rules) {
            Optional<T> v = r.apply(text);
            if (v.isPresent()) return v.get();
        }
        return fallback;
    }

    public List<FieldRule<T>> rules() { return rules; }
}
