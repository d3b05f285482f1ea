package com.carcoverscraper.core.model;

/** 커버 원단 분류. 키워드가 없으면 UNKNOWN. */
public enum Material {
    POLYESTER("Polyester"),
    NYLON("Nylon"),
    COTTON("Cotton"),
    PVC("PVC"),
    UNKNOWN("Unknown");

    private final String label;

    Material(String label) { this.label = label; }

    /** 출력 파일에 쓰는 표기 */
    public String label() { return label; }
}
