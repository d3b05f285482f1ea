package com.carcoverscraper.core.model;

/** 적용 차종 분류. "universal/all cars" 같은 범용 표현은 UNIVERSAL. */
public enum VehicleType {
    SUV("SUV"),
    SEDAN("Sedan"),
    HATCHBACK("Hatchback"),
    UNIVERSAL("Universal"),
    UNKNOWN("Unknown");

    private final String label;

    VehicleType(String label) { this.label = label; }

    public String label() { return label; }
}
