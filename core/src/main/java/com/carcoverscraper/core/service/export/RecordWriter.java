package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 동결된 레코드 집합을 한 가지 포맷으로 기록 (CSV/Parquet) */
public interface RecordWriter {

    OutputFormat format();

    /**
     * @param outputDir 출력 루트 (null이면 "out"), 없으면 생성
     * @param records   최종 레코드(지문당 1건)
     * @param startedAt 런 시작 시각(파일명 타임스탬프)
     * @return 생성된 파일 경로
     */
    Path write(Path outputDir, List<CandidateRecord> records, Instant startedAt) throws IOException;
}
