package com.strata.storage.cold;

import com.strata.domain.DataPoint;
import com.strata.domain.StorageTier;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes and reads cold-tier batches of store rows as Parquet files.
 *
 * Pages are left uncompressed; the whole file is compressed afterwards by the
 * configured codec.
 */
@Component
public class ParquetBatchWriter {
    private static final Logger logger = LoggerFactory.getLogger(ParquetBatchWriter.class);

    private static final Schema SCHEMA = new Schema.Parser().parse("""
        {
          "type": "record",
          "name": "DataPoint",
          "namespace": "com.strata.storage.cold",
          "fields": [
            {"name": "tier", "type": "string"},
            {"name": "dataset", "type": "string"},
            {"name": "entity_id", "type": "string"},
            {"name": "timestamp", "type": {"type": "long", "logicalType": "timestamp-millis"}},
            {"name": "value", "type": "double"},
            {"name": "sample_count", "type": "long"},
            {"name": "min", "type": "double"},
            {"name": "max", "type": "double"}
          ]
        }
        """);

    private final Configuration hadoopConfiguration = new Configuration();

    /**
     * Write rows to a new Parquet file at {@code target}.
     */
    public void write(List<DataPoint> rows, java.nio.file.Path target) throws IOException {
        Path path = new Path(target.toAbsolutePath().toUri());
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(HadoopOutputFile.fromPath(path, hadoopConfiguration))
                .withSchema(SCHEMA)
                .withConf(hadoopConfiguration)
                .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                .withPageSize(1024 * 1024) // 1MB
                .build()) {
            for (DataPoint row : rows) {
                GenericRecord record = new GenericData.Record(SCHEMA);
                record.put("tier", row.getTier().getValue());
                record.put("dataset", row.getDataset());
                record.put("entity_id", row.getEntityId());
                record.put("timestamp", row.getTimestamp().toEpochMilli());
                record.put("value", row.getValue());
                record.put("sample_count", row.getSampleCount());
                record.put("min", row.getMin());
                record.put("max", row.getMax());
                writer.write(record);
            }
        }
        logger.debug("Wrote {} rows to Parquet file {}", rows.size(), target);
    }

    /**
     * Read back every row of a batch written by {@link #write}.
     */
    public List<DataPoint> read(java.nio.file.Path source) throws IOException {
        Path path = new Path(source.toAbsolutePath().toUri());
        List<DataPoint> rows = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(HadoopInputFile.fromPath(path, hadoopConfiguration))
                .withDataModel(GenericData.get())
                .withConf(hadoopConfiguration)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                rows.add(new DataPoint(
                    StorageTier.fromValue(record.get("tier").toString()),
                    record.get("dataset").toString(),
                    record.get("entity_id").toString(),
                    timestamp(record.get("timestamp")),
                    ((Number) record.get("value")).doubleValue(),
                    ((Number) record.get("sample_count")).longValue(),
                    ((Number) record.get("min")).doubleValue(),
                    ((Number) record.get("max")).doubleValue()));
            }
        }
        return rows;
    }

    private static Instant timestamp(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        return Instant.ofEpochMilli(((Number) value).longValue());
    }
}
