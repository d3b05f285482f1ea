package com.carcoverscraper.core.extract.rules;

import com.carcoverscraper.core.model.Material;
import com.carcoverscraper.core.model.VehicleType;

/**
 * 원단/차종/방수/UV/치수 규칙을 한 번에 적용.
 * 상태 없음 → 스레드 간 공유 가능, 같은 입력이면 항상 같은 결과.
 */
public final class CoverSpecClassifier {
    private final FirstMatchClassifier<Material> materials;
    private final FirstMatchClassifier<VehicleType> vehicleTypes;

    public CoverSpecClassifier() {
        this(MaterialRules.classifier(), VehicleTypeRules.classifier());
    }

    public CoverSpecClassifier(FirstMatchClassifier<Material> materials,
                               FirstMatchClassifier<VehicleType> vehicleTypes) {
        this.materials = materials;
        this.vehicleTypes = vehicleTypes;
    }

    public CoverSpecs classify(String text) {
        String t = text == null ? "" : text;
        return new CoverSpecs(
                materials.classify(t),
                vehicleTypes.classify(t),
                FeatureRules.isWaterproof(t),
                FeatureRules.isUvProtected(t),
                SizeParser.parse(t).orElse(null));
    }
}
