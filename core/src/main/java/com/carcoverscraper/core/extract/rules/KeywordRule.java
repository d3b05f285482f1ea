package com.carcoverscraper.core.extract.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/** 키워드(정규식) 중 하나라도 나오면 value. 대소문자 무시. */
public final class KeywordRule<T> implements FieldRule<T> {
    private final T value;
    private final Pattern pattern;

    private KeywordRule(T value, Pattern pattern) {
        this.value = Objects.requireNonNull(value, "value");
        this.pattern = pattern;
    }

    /** keywords는 정규식 조각. 서로 OR로 묶인다. */
    public static <T> KeywordRule<T> of(T value, String... keywords) {
        if (keywords == null || keywords.length == 0) throw new IllegalArgumentException("keywords required");
        String joined = String.join("|", keywords);
        return new KeywordRule<>(value,
                Pattern.compile("(?:" + joined + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }

    @Override
    public Optional<T> apply(String text) {
        return matches(text) ? Optional.of(value) : Optional.empty();
    }

    public T value() { return value; }
}
