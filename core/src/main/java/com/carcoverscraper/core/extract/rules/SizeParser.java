package com.carcoverscraper.core.extract.rules;

import com.carcoverscraper.core.model.Size;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "450x190cm", "4.5 m × 1.9 m", "450 x 190 x 150 cm" 형태의 치수 추출.
 * 단위(cm/m/mm)는 cm로 정규화, 단위가 없으면 cm로 본다.
 * 한 변이라도 [MIN_CM, MAX_CM] 밖이면 그 매치는 버리고 다음 매치를 본다.
 */
public final class SizeParser implements FieldRule<Size> {

    public static final int MIN_CM = 10;
    public static final int MAX_CM = 2000;

    private static final String NUM = "(\\d{1,4}(?:\\.\\d+)?)";
    private static final String UNIT = "(cm|mm|m)?";
    private static final String TIMES = "\\s*[x×*]\\s*";

    // w [u1] x h [u2] [x d [u3]]
    private static final Pattern DIMS = Pattern.compile(
            "(?<![\\d.])" + NUM + "\\s*" + UNIT + TIMES + NUM + "\\s*" + UNIT
                    + "(?:" + TIMES + "\\d{1,4}(?:\\.\\d+)?\\s*" + UNIT + ")?"
                    + "(?![\\p{L}\\d]|\\.\\d)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public Optional<Size> apply(String text) {
        return parse(text);
    }

    public static Optional<Size> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = DIMS.matcher(text);
        while (m.find()) {
            String u1 = m.group(2), u2 = m.group(4), u3 = m.group(5);
            String wUnit = firstNonNull(u1, u2, u3);
            String hUnit = firstNonNull(u2, u3, u1);
            Integer w = toCm(m.group(1), wUnit);
            Integer h = toCm(m.group(3), hUnit);
            if (w != null && h != null && plausible(w) && plausible(h)) {
                return Optional.of(new Size(w, h));
            }
        }
        return Optional.empty();
    }

    static boolean plausible(int cm) {
        return cm >= MIN_CM && cm <= MAX_CM;
    }

    private static Integer toCm(String number, String unit) {
        BigDecimal v;
        try {
            v = new BigDecimal(number);
        } catch (NumberFormatException e) {
            return null;
        }
        String u = unit == null ? "cm" : unit.toLowerCase(Locale.ROOT);
        switch (u) {
            case "m":  v = v.multiply(BigDecimal.valueOf(100)); break;
            case "mm": v = v.divide(BigDecimal.TEN); break;
            default:   break;
        }
        return v.setScale(0, RoundingMode.HALF_UP).intValue();
    }

    private static String firstNonNull(String a, String b, String c) {
        if (a != null) return a;
        if (b != null) return b;
        return c;
    }
}
