package com.carcoverscraper.core.extract;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.FetchResult;
import com.carcoverscraper.core.model.ListingSummary;
import com.carcoverscraper.core.model.Material;
import com.carcoverscraper.core.model.Size;
import com.carcoverscraper.core.model.VehicleType;
import com.carcoverscraper.core.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsoupListingExtractorTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-05-01T10:15:30Z");

    private final JsoupListingExtractor extractor = new JsoupListingExtractor();

    private static FetchResult.Success page(String url, String body, ListingSummary hint) {
        URI u = URI.create(url);
        return new FetchResult.Success(u, body, 200, FETCHED_AT, WorkItem.detail(u, hint));
    }

    @Test
    @DisplayName("상세 마크업 → 원단/차종/방수/치수/가격/위치/이미지")
    void suvCover_structuredDetail() {
        CandidateRecord r = extractor.extract(page(
                "https://www.olx.in/item/waterproof-polyester-suv-cover-iid-1001#gallery",
                Fixtures.page("detail_suv.html"), null)).orElseThrow();

        assertEquals("https://www.olx.in/item/waterproof-polyester-suv-cover-iid-1001", r.getSourceUrl());
        assertEquals("Waterproof Polyester Car Cover for SUV 450x190cm", r.getTitle());
        assertEquals(Material.POLYESTER, r.getMaterial());
        assertEquals(VehicleType.SUV, r.getVehicleType());
        assertTrue(r.isWaterproof());
        assertFalse(r.isUvProtected());
        assertThat(r.getSize()).contains(new Size(450, 190));
        assertThat(r.getPrice()).contains(new BigDecimal("1499"));
        assertThat(r.getLocation()).contains("Andheri East, Mumbai, Maharashtra");
        assertEquals(3, r.getImageCount());
        assertThat(r.getRawText()).startsWith(r.getTitle()).contains("mirror pockets");
        assertEquals(FETCHED_AT, r.getScrapedAt());
    }

    @Test
    @DisplayName("마크업 없는 평문도 같은 분류")
    void suvCover_plainText() {
        CandidateRecord r = extractor.extract(page("https://www.olx.in/item/x-iid-1",
                "Waterproof Polyester Car Cover for SUV 450x190cm", null)).orElseThrow();

        assertEquals("Waterproof Polyester Car Cover for SUV 450x190cm", r.getTitle());
        assertEquals(Material.POLYESTER, r.getMaterial());
        assertEquals(VehicleType.SUV, r.getVehicleType());
        assertTrue(r.isWaterproof());
        assertThat(r.getSize()).contains(new Size(450, 190));
        assertThat(r.getPrice()).isEmpty();
        assertEquals(0, r.getImageCount());
    }

    @Test
    @DisplayName("Universal Cover → UNKNOWN/UNIVERSAL/치수 없음")
    void universalCover_universal() {
        CandidateRecord r = extractor.extract(page("https://www.olx.in/item/universal-cover-iid-1002",
                Fixtures.page("detail_universal.html"), null)).orElseThrow();

        assertEquals("Universal Cover", r.getTitle());
        assertEquals(Material.UNKNOWN, r.getMaterial());
        assertEquals(VehicleType.UNIVERSAL, r.getVehicleType());
        assertFalse(r.isWaterproof());
        assertThat(r.getSize()).isEmpty();
    }

    @Test
    @DisplayName("페이지에 없는 가격/위치는 검색 카드 힌트로 보충")
    void hintFillsMissingFields() {
        URI u = URI.create("https://www.olx.in/item/universal-cover-iid-1002");
        ListingSummary hint = new ListingSummary(u, "Universal Cover", "₹ 650", "Koramangala, Bengaluru");

        CandidateRecord r = extractor.extract(page(u.toString(), Fixtures.page("detail_universal.html"), hint))
                .orElseThrow();

        assertThat(r.getPrice()).contains(new BigDecimal("650"));
        assertThat(r.getLocation()).contains("Koramangala, Bengaluru");
    }

    @Test
    @DisplayName("같은 입력이면 같은 레코드")
    void deterministic() {
        FetchResult.Success p = page("https://www.olx.in/item/waterproof-polyester-suv-cover-iid-1001",
                Fixtures.page("detail_suv.html"), null);

        assertEquals(extractor.extract(p), extractor.extract(p));
    }

    @Test
    void emptyBody_yieldsNothing() {
        Optional<CandidateRecord> r = extractor.extract(page("https://www.olx.in/item/x-iid-9", "", null));
        assertThat(r).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    @DisplayName("차단/캡차 안내 페이지는 리스팅 신호가 없어 레코드 없음")
    void interstitialPage_yieldsNothing() {
        String denied = "<html><head><title>Access Denied</title></head>"
                + "<body><p>Please verify you are a human.</p></body></html>";
        String removed = "<html><head><title>OLX</title></head>"
                + "<body><h1>This ad is no longer available</h1></body></html>";

        assertThat(extractor.extract(page("https://www.olx.in/item/cover-iid-9", denied, null))).isEmpty();
        assertThat(extractor.extract(page("https://www.olx.in/item/cover-iid-9", removed, null))).isEmpty();
    }

    @Test
    @DisplayName("분류 적중이 없어도 상세 마크업이나 og:type product면 리스팅")
    void listingMarkupWithoutSpecHits_isKept() {
        String markup = "<html><body><h1 data-aut-id=\"itemTitle\">Old cover, good condition</h1></body></html>";
        String ogProduct = "<html><head><meta property=\"og:type\" content=\"product\">"
                + "<title>Old cover, good condition</title></head><body></body></html>";

        assertThat(extractor.extract(page("https://www.olx.in/item/a-iid-3", markup, null)))
                .map(CandidateRecord::getTitle).contains("Old cover, good condition");
        assertThat(extractor.extract(page("https://www.olx.in/item/a-iid-3", ogProduct, null)))
                .map(CandidateRecord::getTitle).contains("Old cover, good condition");
    }

    @Test
    @DisplayName("검색 카드에서 온 상세 페이지는 힌트가 리스팅 신호")
    void searchCardHint_countsAsListing() {
        URI u = URI.create("https://www.olx.in/item/old-cover-iid-4");
        ListingSummary hint = new ListingSummary(u, "Old cover", null, "Pune");

        CandidateRecord r = extractor.extract(page(u.toString(), "<html><body><p>Old cover</p></body></html>", hint))
                .orElseThrow();
        assertThat(r.getLocation()).contains("Pune");
    }
}
