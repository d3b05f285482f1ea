package com.carcoverscraper.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 추출/분류가 끝난 매물 1건(중복 제거 전).
 * FetchResult 내용만으로 결정되며 네트워크/공유 상태를 참조하지 않는다.
 */
public final class CandidateRecord {
    private final String sourceUrl;
    private final String title;
    private final BigDecimal price;        // nullable
    private final String location;         // nullable
    private final int imageCount;
    private final Material material;
    private final VehicleType vehicleType;
    private final boolean waterproof;
    private final boolean uvProtected;
    private final Size size;               // nullable
    private final String rawText;
    private final Instant scrapedAt;

    private CandidateRecord(Builder b) {
        this.sourceUrl = b.sourceUrl;
        this.title = (b.title == null) ? "" : b.title;
        this.price = b.price;
        this.location = b.location;
        this.imageCount = Math.max(0, b.imageCount);
        this.material = (b.material == null) ? Material.UNKNOWN : b.material;
        this.vehicleType = (b.vehicleType == null) ? VehicleType.UNKNOWN : b.vehicleType;
        this.waterproof = b.waterproof;
        this.uvProtected = b.uvProtected;
        this.size = b.size;
        this.rawText = (b.rawText == null) ? "" : b.rawText;
        this.scrapedAt = b.scrapedAt;
    }

    public String getSourceUrl() { return sourceUrl; }
    public String getTitle() { return title; }
    public Optional<BigDecimal> getPrice() { return Optional.ofNullable(price); }
    public Optional<String> getLocation() { return Optional.ofNullable(location); }
    public int getImageCount() { return imageCount; }
    public Material getMaterial() { return material; }
    public VehicleType getVehicleType() { return vehicleType; }
    public boolean isWaterproof() { return waterproof; }
    public boolean isUvProtected() { return uvProtected; }
    public Optional<Size> getSize() { return Optional.ofNullable(size); }
    public String getRawText() { return rawText; }
    public Instant getScrapedAt() { return scrapedAt; }

    /**
     * 채워진 필드 수(Unknown/none 아닌 것). 병합 정책 "more complete wins"의 기준.
     * boolean 플래그는 "모름" 상태가 없으므로 세지 않는다.
     */
    public int completeness() {
        int n = 0;
        if (!title.isBlank()) n++;
        if (price != null) n++;
        if (location != null) n++;
        if (material != Material.UNKNOWN) n++;
        if (vehicleType != VehicleType.UNKNOWN) n++;
        if (size != null) n++;
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateRecord that)) return false;
        return imageCount == that.imageCount
                && waterproof == that.waterproof
                && uvProtected == that.uvProtected
                && sourceUrl.equals(that.sourceUrl)
                && title.equals(that.title)
                && Objects.equals(price, that.price)
                && Objects.equals(location, that.location)
                && material == that.material
                && vehicleType == that.vehicleType
                && Objects.equals(size, that.size)
                && rawText.equals(that.rawText)
                && Objects.equals(scrapedAt, that.scrapedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceUrl, title, price, location, imageCount, material, vehicleType,
                waterproof, uvProtected, size, rawText, scrapedAt);
    }

    @Override
    public String toString() {
        return "CandidateRecord{" + sourceUrl + ", title='" + title + "', material=" + material
                + ", vehicleType=" + vehicleType + ", waterproof=" + waterproof
                + ", uv=" + uvProtected + ", size=" + size + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sourceUrl;
        private String title;
        private BigDecimal price;
        private String location;
        private int imageCount;
        private Material material;
        private VehicleType vehicleType;
        private boolean waterproof;
        private boolean uvProtected;
        private Size size;
        private String rawText;
        private Instant scrapedAt;

        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder price(BigDecimal price) { this.price = price; return this; }
        public Builder location(String location) { this.location = location; return this; }
        public Builder imageCount(int imageCount) { this.imageCount = imageCount; return this; }
        public Builder material(Material material) { this.material = material; return this; }
        public Builder vehicleType(VehicleType vehicleType) { this.vehicleType = vehicleType; return this; }
        public Builder waterproof(boolean waterproof) { this.waterproof = waterproof; return this; }
        public Builder uvProtected(boolean uvProtected) { this.uvProtected = uvProtected; return this; }
        public Builder size(Size size) { this.size = size; return this; }
        public Builder rawText(String rawText) { this.rawText = rawText; return this; }
        public Builder scrapedAt(Instant scrapedAt) { this.scrapedAt = scrapedAt; return this; }

        public CandidateRecord build() {
            Objects.requireNonNull(sourceUrl, "sourceUrl");
            return new CandidateRecord(this);
        }
    }
}
