package com.carcoverscraper.core.extract;

import com.carcoverscraper.core.extract.rules.CoverSpecClassifier;
import com.carcoverscraper.core.extract.rules.CoverSpecs;
import com.carcoverscraper.core.extract.rules.PriceParser;
import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.FetchResult;
import com.carcoverscraper.core.model.ListingSummary;
import com.carcoverscraper.core.model.Material;
import com.carcoverscraper.core.model.VehicleType;
import com.carcoverscraper.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * OLX 상세 페이지 추출기(jsoup).
 * 제목/가격/위치는 페이지 → 검색 카드 힌트 순으로 채우고,
 * 분류는 rawText(제목 + 설명)에만 적용한다.
 * 리스팅 신호(OLX 마크업, 검색 카드 힌트, 분류/가격 적중)가 하나도 없는 페이지는
 * 차단/캡차/삭제 안내 같은 중간 페이지로 보고 레코드를 만들지 않는다.
 */
public class JsoupListingExtractor implements Extractor {

    private static final int MAX_TITLE = 300;
    private static final String LISTING_MARKUP =
            "[data-aut-id=itemTitle], [data-aut-id=itemDescription], [data-aut-id=itemPrice]";

    private final CoverSpecClassifier classifier;

    public JsoupListingExtractor() {
        this(new CoverSpecClassifier());
    }

    public JsoupListingExtractor(CoverSpecClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public Optional<CandidateRecord> extract(FetchResult.Success page) {
        if (page == null) return Optional.empty();
        ListingSummary hint = page.item().getHint();
        Document doc = Jsoup.parse(page.body(), page.url().toString());

        String title = firstNonBlank(
                text(doc.selectFirst("[data-aut-id=itemTitle]")),
                text(doc.selectFirst("h1")),
                attr(doc.selectFirst("meta[property=og:title]"), "content"),
                doc.title(),
                hint == null ? null : hint.title());
        String description = firstNonBlank(
                text(doc.selectFirst("[data-aut-id=itemDescription]")),
                attr(doc.selectFirst("meta[name=description]"), "content"),
                attr(doc.selectFirst("meta[property=og:description]"), "content"));

        // 구조화된 마크업이 전혀 없으면 본문 텍스트로 대체
        if (title == null && description == null) {
            String bodyText = doc.body() == null ? "" : doc.body().wholeText().strip();
            if (bodyText.isEmpty()) return Optional.empty();
            title = firstLine(bodyText);
            description = bodyText.equals(title) ? null : bodyText;
        }
        if (title == null) title = "";
        if (title.length() > MAX_TITLE) title = title.substring(0, MAX_TITLE);

        String rawText = (description == null) ? title : (title + "\n" + description).strip();

        String priceText = firstNonBlank(
                text(doc.selectFirst("[data-aut-id=itemPrice]")),
                attr(doc.selectFirst("meta[property=product:price:amount]"), "content"),
                hint == null ? null : hint.priceText());
        String location = firstNonBlank(
                text(doc.selectFirst("[data-aut-id=item-location]")),
                text(doc.selectFirst("[data-aut-id=itemLocation]")),
                hint == null ? null : hint.location());

        CoverSpecs specs = classifier.classify(rawText);
        Optional<BigDecimal> price = PriceParser.parse(priceText);
        if (hint == null && !hasListingMarkup(doc) && !hasSpecHit(specs) && price.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CandidateRecord.builder()
                .sourceUrl(UrlUtils.normalize(page.url()).toString())
                .title(title)
                .price(price.orElse(null))
                .location(location)
                .imageCount(countImages(doc))
                .material(specs.material())
                .vehicleType(specs.vehicleType())
                .waterproof(specs.waterproof())
                .uvProtected(specs.uvProtected())
                .size(specs.size())
                .rawText(rawText)
                .scrapedAt(page.fetchedAt())
                .build());
    }

    static boolean hasListingMarkup(Document doc) {
        if (doc.selectFirst(LISTING_MARKUP) != null) return true;
        String ogType = attr(doc.selectFirst("meta[property=og:type]"), "content");
        if (ogType == null) return false;
        String t = ogType.toLowerCase(Locale.ROOT);
        return t.contains("product") || t.contains("listing");
    }

    static boolean hasSpecHit(CoverSpecs specs) {
        return specs.material() != Material.UNKNOWN
                || specs.vehicleType() != VehicleType.UNKNOWN
                || specs.size() != null
                || specs.waterproof()
                || specs.uvProtected();
    }

    /** 갤러리 이미지(중복 src 제외). 갤러리가 없으면 og:image */
    static int countImages(Document doc) {
        Set<String> srcs = new LinkedHashSet<>();
        for (Element img : doc.select("[data-aut-id=imageGallery] img, [data-aut-id=defaultImg], figure img")) {
            String src = img.attr("abs:src");
            if (src.isBlank()) src = img.attr("abs:data-src");
            if (!src.isBlank()) srcs.add(src);
        }
        if (srcs.isEmpty()) {
            for (Element m : doc.select("meta[property=og:image]")) {
                String c = m.attr("content");
                if (!c.isBlank()) srcs.add(c);
            }
        }
        return srcs.size();
    }

    private static String firstLine(String s) {
        for (String line : s.split("\\R")) {
            String t = line.strip();
            if (!t.isEmpty()) return t;
        }
        return s.strip();
    }

    private static String text(Element e) {
        return e == null ? null : e.text();
    }

    private static String attr(Element e, String name) {
        return e == null ? null : e.attr(name);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.strip();
        }
        return null;
    }
}
