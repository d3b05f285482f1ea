package com.carcoverscraper.core.extract.rules;

import com.carcoverscraper.core.model.Material;
import com.carcoverscraper.core.model.Size;
import com.carcoverscraper.core.model.VehicleType;

import java.util.Objects;
import java.util.Optional;

/** 설명 텍스트에서 뽑은 커버 사양 묶음. size는 null 가능. */
public record CoverSpecs(Material material, VehicleType vehicleType,
                         boolean waterproof, boolean uvProtected, Size size) {
    public CoverSpecs {
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(vehicleType, "vehicleType");
    }

    public Optional<Size> sizeOpt() { return Optional.ofNullable(size); }
}
