package com.carcoverscraper.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase  "seed" | "fetch" | "finalize" | "export"
     * @param done   최종 처리된 WorkItem 수(모르면 -1)
     * @param queued 현재 큐+진행 중 수(모르면 -1)
     */
    void onProgress(String phase, long done, long queued);

    ProgressListener NONE = (phase, d, q) -> {};
}
