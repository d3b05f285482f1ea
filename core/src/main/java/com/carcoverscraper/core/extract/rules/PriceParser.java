package com.carcoverscraper.core.extract.rules;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "₹ 1,499", "Rs. 2,500", "1499.50" → BigDecimal.
 * 통화 기호와 천단위 구분자는 무시. 숫자가 없거나 정수부가 16자리를 넘으면 empty.
 */
public final class PriceParser implements FieldRule<BigDecimal> {

    static final int MAX_INTEGER_DIGITS = 16;

    private static final Pattern AMOUNT = Pattern.compile("\\d{1,3}(?:,\\d{2,3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?");

    @Override
    public Optional<BigDecimal> apply(String text) {
        return parse(text);
    }

    public static Optional<BigDecimal> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = AMOUNT.matcher(text);
        if (!m.find()) return Optional.empty();
        String digits = m.group().replace(",", "");
        try {
            BigDecimal v = new BigDecimal(digits);
            if (v.signum() < 0 || v.precision() - v.scale() > MAX_INTEGER_DIGITS) return Optional.empty();
            return Optional.of(v);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
