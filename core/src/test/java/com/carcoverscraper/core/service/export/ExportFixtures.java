package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.Material;
import com.carcoverscraper.core.model.Size;
import com.carcoverscraper.core.model.VehicleType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

final class ExportFixtures {
    private ExportFixtures() {}

    static final Instant SCRAPED_AT = Instant.parse("2024-05-01T10:15:30Z");

    static CandidateRecord suvCover() {
        return CandidateRecord.builder()
                .sourceUrl("https://www.olx.in/item/waterproof-polyester-suv-cover-iid-1001")
                .title("Waterproof Polyester Car Cover for SUV 450x190cm")
                .price(new BigDecimal("1499"))
                .location("Andheri East, Mumbai")
                .imageCount(3)
                .material(Material.POLYESTER)
                .vehicleType(VehicleType.SUV)
                .waterproof(true)
                .size(new Size(450, 190))
                .rawText("Waterproof Polyester Car Cover for SUV 450x190cm\nHeavy duty, \"elastic\" hem")
                .scrapedAt(SCRAPED_AT)
                .build();
    }

    static CandidateRecord universalCover() {
        return CandidateRecord.builder()
                .sourceUrl("https://www.olx.in/item/universal-cover-iid-1002")
                .title("Universal Cover")
                .vehicleType(VehicleType.UNIVERSAL)
                .rawText("Universal Cover")
                .scrapedAt(SCRAPED_AT)
                .build();
    }

    static List<CandidateRecord> records() {
        return List.of(suvCover(), universalCover());
    }
}
