package com.carcoverscraper.core.service.export;

import com.carcoverscraper.core.model.CandidateRecord;
import com.carcoverscraper.core.model.ScrapeConfig.OutputFormat;
import org.apache.avro.Conversions;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Parquet(Avro 스키마, Snappy). CSV와 같은 컬럼 이름/순서.
 * 선택 컬럼(price, location, width_cm, height_cm, scraped_at)은 nullable.
 * price는 CSV와 같은 값이 남도록 decimal(18,2).
 */
public class ParquetRecordWriter implements RecordWriter {

    /** 가격은 decimal(18,2) bytes. 파서가 정수부 16자리까지만 받으므로 항상 들어간다. */
    static final Schema PRICE_TYPE = LogicalTypes.decimal(18, 2).addToSchema(Schema.create(Schema.Type.BYTES));
    private static final Conversions.DecimalConversion DECIMAL = new Conversions.DecimalConversion();

    static final Schema SCHEMA = SchemaBuilder.record("CarCover")
            .namespace("com.carcoverscraper")
            .fields()
            .requiredString(RecordColumns.SOURCE_URL)
            .requiredString(RecordColumns.TITLE)
            .name(RecordColumns.PRICE).type().unionOf()
                .nullType().and()
                .type(PRICE_TYPE)
                .endUnion().nullDefault()
            .optionalString(RecordColumns.LOCATION)
            .requiredInt(RecordColumns.IMAGE_COUNT)
            .requiredString(RecordColumns.MATERIAL)
            .requiredString(RecordColumns.VEHICLE_TYPE)
            .requiredBoolean(RecordColumns.WATERPROOF)
            .requiredBoolean(RecordColumns.UV_PROTECTED)
            .optionalInt(RecordColumns.WIDTH_CM)
            .optionalInt(RecordColumns.HEIGHT_CM)
            .name(RecordColumns.SCRAPED_AT).type().unionOf()
                .nullType().and()
                .type(LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG)))
                .endUnion().nullDefault()
            .requiredString(RecordColumns.RAW_TEXT)
            .endRecord();

    @Override
    public OutputFormat format() { return OutputFormat.PARQUET; }

    @Override
    public Path write(Path outputDir, List<CandidateRecord> records, Instant startedAt) throws IOException {
        Path out = OutputNaming.parquetPath(outputDir, startedAt);
        Files.createDirectories(out.getParent());

        Configuration conf = new Configuration();
        // 로컬 FS의 .crc 사이드카 파일은 만들지 않는다
        FileSystem.getLocal(conf).setWriteChecksum(false);
        org.apache.hadoop.fs.Path hpath = new org.apache.hadoop.fs.Path(out.toAbsolutePath().toUri());

        boolean ok = false;
        try (ParquetWriter<GenericRecord> w = AvroParquetWriter.<GenericRecord>builder(HadoopOutputFile.fromPath(hpath, conf))
                .withSchema(SCHEMA)
                .withConf(conf)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (CandidateRecord r : records) {
                w.write(toAvro(r));
            }
            ok = true;
        } finally {
            if (!ok) Files.deleteIfExists(out);
        }
        return out;
    }

    static ByteBuffer priceBytes(BigDecimal price) {
        return DECIMAL.toBytes(price.setScale(2, RoundingMode.HALF_UP), PRICE_TYPE, PRICE_TYPE.getLogicalType());
    }

    static GenericRecord toAvro(CandidateRecord r) {
        GenericData.Record rec = new GenericData.Record(SCHEMA);
        rec.put(RecordColumns.SOURCE_URL, r.getSourceUrl());
        rec.put(RecordColumns.TITLE, r.getTitle());
        rec.put(RecordColumns.PRICE, r.getPrice().map(ParquetRecordWriter::priceBytes).orElse(null));
        rec.put(RecordColumns.LOCATION, r.getLocation().orElse(null));
        rec.put(RecordColumns.IMAGE_COUNT, r.getImageCount());
        rec.put(RecordColumns.MATERIAL, r.getMaterial().label());
        rec.put(RecordColumns.VEHICLE_TYPE, r.getVehicleType().label());
        rec.put(RecordColumns.WATERPROOF, r.isWaterproof());
        rec.put(RecordColumns.UV_PROTECTED, r.isUvProtected());
        rec.put(RecordColumns.WIDTH_CM, r.getSize().map(s -> s.widthCm()).orElse(null));
        rec.put(RecordColumns.HEIGHT_CM, r.getSize().map(s -> s.heightCm()).orElse(null));
        rec.put(RecordColumns.SCRAPED_AT, r.getScrapedAt() == null ? null : r.getScrapedAt().toEpochMilli());
        rec.put(RecordColumns.RAW_TEXT, r.getRawText());
        return rec;
    }
}
