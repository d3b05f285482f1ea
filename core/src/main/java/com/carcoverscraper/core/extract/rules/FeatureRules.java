package com.carcoverscraper.core.extract.rules;

/** 방수/UV 플래그: 키워드 존재 여부만 본다. */
public final class FeatureRules {
    private FeatureRules() {}

    public static final KeywordRule<Boolean> WATERPROOF = KeywordRule.of(Boolean.TRUE,
            "\\bwater\\s*-?\\s*proof", "\\bwater\\s*-?\\s*resistant", "\\brain\\s*-?\\s*proof");

    public static final KeywordRule<Boolean> UV_PROTECTED = KeywordRule.of(Boolean.TRUE,
            "\\buv\\b", "\\bultra\\s*-?\\s*violet\\b", "\\bsun\\s*-?\\s*protect");

    public static boolean isWaterproof(String text) { return WATERPROOF.matches(text); }

    public static boolean isUvProtected(String text) { return UV_PROTECTED.matches(text); }
}
