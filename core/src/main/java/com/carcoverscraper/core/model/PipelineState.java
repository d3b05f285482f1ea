package com.carcoverscraper.core.model;

/** Seeding → Running → Draining → Finalized (역방향 전이 없음) */
public enum PipelineState {
    IDLE, SEEDING, RUNNING, DRAINING, FINALIZED
}
