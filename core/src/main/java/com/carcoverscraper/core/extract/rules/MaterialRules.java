package com.carcoverscraper.core.extract.rules;

import com.carcoverscraper.core.model.Material;

import java.util.List;

/** 원단 키워드 어휘. 순서 = 우선순위. */
public final class MaterialRules {
    private MaterialRules() {}

    public static final KeywordRule<Material> POLYESTER = KeywordRule.of(Material.POLYESTER, "\\bpolyester\\b", "\\bpoly\\b");
    public static final KeywordRule<Material> NYLON     = KeywordRule.of(Material.NYLON, "\\bnylon\\b");
    public static final KeywordRule<Material> COTTON    = KeywordRule.of(Material.COTTON, "\\bcotton\\b");
    public static final KeywordRule<Material> PVC       = KeywordRule.of(Material.PVC, "\\bpvc\\b", "\\bvinyl\\b");

    public static FirstMatchClassifier<Material> classifier() {
        return new FirstMatchClassifier<>(List.of(POLYESTER, NYLON, COTTON, PVC), Material.UNKNOWN);
    }
}
