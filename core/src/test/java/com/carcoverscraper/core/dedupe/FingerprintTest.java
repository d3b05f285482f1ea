package com.carcoverscraper.core.dedupe;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.Size;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class FingerprintTest {

    private static CandidateRecord rec(String url, String title) {
        return CandidateRecord.builder().sourceUrl(url).title(title).build();
    }

    @Test
    void queryFragmentAndCase_doNotChangeKey() {
        Fingerprint a = Fingerprint.of(rec("https://www.olx.in/item/cover-iid-1", "Car Cover - SUV!"));
        Fingerprint b = Fingerprint.of(rec("HTTPS://WWW.OLX.IN/item/cover-iid-1/?ref=home#top", "car cover suv"));

        assertEquals(a, b);
        assertEquals("www.olx.in/item/cover-iid-1", a.listingKey());
        assertEquals("car cover suv", a.titleKey());
    }

    @Test
    void differentListingOrTitle_differentKey() {
        Fingerprint base = Fingerprint.of(rec("https://www.olx.in/item/cover-iid-1", "Car Cover"));

        assertNotEquals(base, Fingerprint.of(rec("https://www.olx.in/item/cover-iid-2", "Car Cover")));
        assertNotEquals(base, Fingerprint.of(rec("https://www.olx.in/item/cover-iid-1", "Bike Cover")));
    }

    @Test
    void sizeIsNotPartOfKey() {
        CandidateRecord withSize = CandidateRecord.builder()
                .sourceUrl("https://www.olx.in/item/cover-iid-1").title("Cover").size(new Size(450, 190)).build();

        assertEquals(Fingerprint.of(rec("https://www.olx.in/item/cover-iid-1", "Cover")), Fingerprint.of(withSize));
    }

    @Test
    void normalizeTitle_keepsNonLatinLetters() {
        assertThat(Fingerprint.normalizeTitle("  Чехол  для  АВТО -- 2024 ")).isEqualTo("чехол для авто 2024");
        assertThat(Fingerprint.normalizeTitle(null)).isEmpty();
    }
}
