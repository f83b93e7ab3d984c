package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.checkpoint.CheckpointStore;
import com.lhcz.txn2db.checkpoint.CheckpointStoreException;
import com.lhcz.txn2db.model.Batch;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.TableSchema;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parquet 文件写入端
 * <p>
 * 每个批次、每张有数据的表一个对象：
 * {@code <bucket_name>/<table>/<run>/<start>_<end>.parquet}，版本号补零到 20 位。
 * 对象全部上传成功后才写进度；启动时 {@link #recover} 删除进度之后的孤儿对象，
 * 跨过进度的文件 (overwrite_checkpoint 回退到某个文件中间) 裁剪为只含进度以内的行。
 */
public class ParquetSink implements Sink {
    private static final Logger log = LoggerFactory.getLogger(ParquetSink.class);
    private static final String SUFFIX = ".parquet";

    private final ObjectStore objectStore;
    private final String bucketName;
    private final CheckpointStore checkpointStore;
    private final CompressionCodecName codec;
    private final Configuration conf = new Configuration();
    private final Map<String, Schema> schemas = new ConcurrentHashMap<>();
    private final Map<String, TableSchema> tables = new ConcurrentHashMap<>();

    public ParquetSink(ObjectStore objectStore, String bucketName, CheckpointStore checkpointStore) {
        this(objectStore, bucketName, checkpointStore, CompressionCodecName.SNAPPY);
    }

    public ParquetSink(ObjectStore objectStore, String bucketName, CheckpointStore checkpointStore, CompressionCodecName codec) {
        this.objectStore = objectStore;
        this.bucketName = bucketName;
        this.checkpointStore = checkpointStore;
        this.codec = codec;
    }

    @Override
    public void initialize(List<TableSchema> tables) {
        for (TableSchema table : tables) {
            schemas.put(table.name(), ParquetSchemas.schema(table));
            this.tables.put(table.name(), table);
        }
        log.info("Parquet 输出: bucket={} tables={} codec={}", bucketName, schemas.keySet(), codec);
    }

    @Override
    public void recover(CheckpointKey key, long lastCommittedVersion) {
        try {
            for (String objectKey : objectStore.list(bucketName + "/")) {
                if (!objectKey.endsWith(SUFFIX) || !runName(objectKey).equals(key.name())) {
                    continue;
                }
                long start = startVersion(objectKey);
                long end = endVersion(objectKey);
                if (start > lastCommittedVersion) {
                    objectStore.delete(objectKey);
                    log.warn("⚠️ 删除未提交的残留文件: {} (checkpoint={})", objectKey, lastCommittedVersion);
                } else if (end > lastCommittedVersion) {
                    truncate(objectKey, start, lastCommittedVersion);
                }
            }
        } catch (IOException e) {
            throw new SinkException("清理残留文件失败", e);
        }
    }

    /**
     * 只保留版本 <= lastCommittedVersion 的行，改写为 [start, lastCommittedVersion] 后删除原文件
     */
    private void truncate(String objectKey, long start, long lastCommittedVersion) throws IOException {
        String tableName = tableName(objectKey);
        TableSchema table = tables.get(tableName);
        if (table == null) {
            throw new SinkException("无法裁剪未注册表的文件: " + objectKey, new IllegalStateException(tableName));
        }
        List<GenericRecord> kept = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(
                new InMemoryInputFile(objectStore.get(objectKey))).withConf(conf).build()) {
            GenericRecord row;
            while ((row = reader.read()) != null) {
                if (((Number) row.get(table.versionColumn())).longValue() <= lastCommittedVersion) {
                    kept.add(row);
                }
            }
        }
        if (!kept.isEmpty()) {
            String run = runName(objectKey);
            objectStore.put(objectKey(tableName, run, start, lastCommittedVersion),
                    writeRows(schemas.get(tableName), kept));
        }
        objectStore.delete(objectKey);
        log.warn("⚠️ 文件跨过进度，已裁剪: {} -> [{}, {}] 保留 {} 行", objectKey, start, lastCommittedVersion, kept.size());
    }

    @Override
    public void commit(Batch batch, Checkpoint checkpoint) {
        String run = checkpoint.key().name();
        try {
            Map<String, byte[]> files = new LinkedHashMap<>();
            for (Map.Entry<String, List<ExtractedRecord>> entry : batch.recordsByTable().entrySet()) {
                files.put(objectKey(entry.getKey(), run, batch), write(entry.getValue()));
            }
            for (Map.Entry<String, byte[]> file : files.entrySet()) {
                objectStore.put(file.getKey(), file.getValue());
            }
            checkpointStore.save(checkpoint);
            log.debug("已上传 {} 个文件 {}", files.size(), batch);
        } catch (IOException | CheckpointStoreException e) {
            throw new SinkException("Parquet 写入失败 " + batch, e);
        }
    }

    String objectKey(String table, String run, Batch batch) {
        return objectKey(table, run, batch.startVersion(), batch.endVersion());
    }

    private String objectKey(String table, String run, long start, long end) {
        return String.format("%s/%s/%s/%020d_%020d%s", bucketName, table, run, start, end, SUFFIX);
    }

    private byte[] write(List<ExtractedRecord> records) throws IOException {
        TableSchema table = records.get(0).table();
        Schema schema = schemas.computeIfAbsent(table.name(), n -> ParquetSchemas.schema(table));
        List<GenericRecord> rows = new ArrayList<>(records.size());
        for (ExtractedRecord record : records) {
            rows.add(ParquetSchemas.toRecord(schema, record));
        }
        return writeRows(schema, rows);
    }

    private byte[] writeRows(Schema schema, List<GenericRecord> rows) throws IOException {
        InMemoryOutputFile out = new InMemoryOutputFile();
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(out)
                .withSchema(schema)
                .withConf(conf)
                .withCompressionCodec(codec)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (GenericRecord row : rows) {
                writer.write(row);
            }
        }
        return out.toByteArray();
    }

    private static String runName(String objectKey) {
        String[] parts = objectKey.split("/");
        return parts.length >= 2 ? parts[parts.length - 2] : "";
    }

    private static String tableName(String objectKey) {
        String[] parts = objectKey.split("/");
        return parts.length >= 3 ? parts[parts.length - 3] : "";
    }

    private static long startVersion(String objectKey) {
        String file = objectKey.substring(objectKey.lastIndexOf('/') + 1);
        return Long.parseLong(file.substring(0, file.indexOf('_')));
    }

    private static long endVersion(String objectKey) {
        String file = objectKey.substring(objectKey.lastIndexOf('/') + 1);
        return Long.parseLong(file.substring(file.indexOf('_') + 1, file.length() - SUFFIX.length()));
    }
}
