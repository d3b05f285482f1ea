package com.carcoverscraper.core.model;

/** 커버 치수(cm 정규화 완료). */
public record Size(int widthCm, int heightCm) {
    public Size {
        if (widthCm <= 0 || heightCm <= 0) {
            throw new IllegalArgumentException("size must be positive: " + widthCm + "x" + heightCm);
        }
    }

    @Override public String toString() { return widthCm + "x" + heightCm + "cm"; }
}
