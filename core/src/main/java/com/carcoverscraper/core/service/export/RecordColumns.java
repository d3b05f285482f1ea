package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.Size;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 두 포맷이 공유하는 고정 컬럼 순서와 행 변환. 없는 값은 null. */
final class RecordColumns {
    private RecordColumns() {}

    static final String SOURCE_URL = "source_url";
    static final String TITLE = "title";
    static final String PRICE = "price";
    static final String LOCATION = "location";
    static final String IMAGE_COUNT = "image_count";
    static final String MATERIAL = "material";
    static final String VEHICLE_TYPE = "vehicle_type";
    static final String WATERPROOF = "waterproof";
    static final String UV_PROTECTED = "uv_protected";
    static final String WIDTH_CM = "width_cm";
    static final String HEIGHT_CM = "height_cm";
    static final String SCRAPED_AT = "scraped_at";
    static final String RAW_TEXT = "raw_text";

    static final List<String> ORDER = List.of(
            SOURCE_URL, TITLE, PRICE, LOCATION, IMAGE_COUNT, MATERIAL, VEHICLE_TYPE,
            WATERPROOF, UV_PROTECTED, WIDTH_CM, HEIGHT_CM, SCRAPED_AT, RAW_TEXT);

    static Map<String, Object> toRow(CandidateRecord r) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(SOURCE_URL, r.getSourceUrl());
        row.put(TITLE, r.getTitle());
        row.put(PRICE, r.getPrice().map(BigDecimal::toPlainString).orElse(null));
        row.put(LOCATION, r.getLocation().orElse(null));
        row.put(IMAGE_COUNT, r.getImageCount());
        row.put(MATERIAL, r.getMaterial().label());
        row.put(VEHICLE_TYPE, r.getVehicleType().label());
        row.put(WATERPROOF, r.isWaterproof());
        row.put(UV_PROTECTED, r.isUvProtected());
        row.put(WIDTH_CM, r.getSize().map(Size::widthCm).orElse(null));
        row.put(HEIGHT_CM, r.getSize().map(Size::heightCm).orElse(null));
        row.put(SCRAPED_AT, r.getScrapedAt() == null ? null : r.getScrapedAt().toString());
        row.put(RAW_TEXT, r.getRawText());
        return row;
    }
}
