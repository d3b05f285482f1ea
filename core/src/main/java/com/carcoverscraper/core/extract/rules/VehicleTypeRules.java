package com.carcoverscraper.core.extract.rules;

import com.carcoverscraper.core.model.VehicleType;

import java.util.List;

/**
 * 차종 키워드 어휘. 구체 차종이 범용 표현보다 우선
 * ("universal cover for SUV" → SUV).
 */
public final class VehicleTypeRules {
    private VehicleTypeRules() {}

    public static final KeywordRule<VehicleType> SUV       = KeywordRule.of(VehicleType.SUV, "\\bsuvs?\\b", "\\bsport\\s+utility\\b");
    public static final KeywordRule<VehicleType> SEDAN     = KeywordRule.of(VehicleType.SEDAN, "\\bsedans?\\b");
    public static final KeywordRule<VehicleType> HATCHBACK = KeywordRule.of(VehicleType.HATCHBACK, "\\bhatch(?:back)?s?\\b");
    public static final KeywordRule<VehicleType> UNIVERSAL = KeywordRule.of(VehicleType.UNIVERSAL,
            "\\buniversal\\b", "\\ball\\s+cars?\\b", "\\bfits?\\s+all\\b", "\\bfree\\s+size\\b");

    public static FirstMatchClassifier<VehicleType> classifier() {
        return new FirstMatchClassifier<>(List.of(SUV, SEDAN, HATCHBACK, UNIVERSAL), VehicleType.UNKNOWN);
    }
}
