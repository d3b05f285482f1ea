package com.carcoverscraper.core.dedupe;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.util.UrlUtils;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 중복 판정 키: 매물 URL(host+path) + 정규화 제목.
 * 쿼리스트링/fragment/대소문자/구두점 차이는 같은 매물로 본다.
 * 치수는 키에 넣지 않는다(같은 매물의 치수 누락본과 병합돼야 하므로).
 */
public record Fingerprint(String listingKey, String titleKey) {

    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    public Fingerprint {
        Objects.requireNonNull(listingKey, "listingKey");
        Objects.requireNonNull(titleKey, "titleKey");
    }

    public static Fingerprint of(CandidateRecord r) {
        Objects.requireNonNull(r, "record");
        return new Fingerprint(UrlUtils.hostPathKey(r.getSourceUrl()), normalizeTitle(r.getTitle()));
    }

    static String normalizeTitle(String title) {
        if (title == null) return "";
        return NON_ALNUM.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }

    @Override
    public String toString() {
        return listingKey + "|" + titleKey;
    }
}
