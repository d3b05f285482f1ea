package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * CSV(헤더 1행 + 레코드당 1행). 컬럼 순서 고정, 없는 값은 빈 칸.
 * 임시 파일에 쓴 뒤 원자적 이동 → 실패 시 반쯤 쓴 파일을 남기지 않는다.
 */
public class CsvRecordWriter implements RecordWriter {

    static final CsvSchema SCHEMA = buildSchema();

    private final CsvMapper mapper = new CsvMapper();

    private static CsvSchema buildSchema() {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String col : RecordColumns.ORDER) b.addColumn(col);
        return b.build().withHeader();
    }

    @Override
    public OutputFormat format() { return OutputFormat.CSV; }

    @Override
    public Path write(Path outputDir, List<CandidateRecord> records, Instant startedAt) throws IOException {
        Path out = OutputNaming.csvPath(outputDir, startedAt);
        Files.createDirectories(out.getParent());
        Path tmp = Files.createTempFile(out.getParent(), ".car_covers-", ".csv.tmp");
        try {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                if (records.isEmpty()) {
                    // 행이 없으면 생성기가 헤더를 쓰지 않으므로 직접
                    w.write(String.join(String.valueOf(SCHEMA.getColumnSeparator()), RecordColumns.ORDER));
                    w.write(SCHEMA.getLineSeparator());
                } else {
                    try (SequenceWriter seq = mapper.writerFor(Map.class).with(SCHEMA).writeValues(w)) {
                        for (CandidateRecord r : records) {
                            seq.write(RecordColumns.toRow(r));
                        }
                    }
                }
            }
            Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return out;
    }
}
