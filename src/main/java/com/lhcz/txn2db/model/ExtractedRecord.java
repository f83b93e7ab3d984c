package com.lhcz.txn2db.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extractor 产出的一条待写入记录
 *
 * @param table   目标表
 * @param kind    写入语义
 * @param version 来源交易版本
 * @param fields  列名 -> 值 (值可为 null)
 */
public record ExtractedRecord(TableSchema table, MutationKind kind, long version, Map<String, Object> fields) {

    private static final int RECORD_OVERHEAD = 16;

    public ExtractedRecord {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(kind, "kind");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        for (String key : table.keyColumns()) {
            if (fields.get(key) == null) {
                throw new IllegalArgumentException("主键列为空: " + table.name() + "." + key + " @ version " + version);
            }
        }
        if (kind != MutationKind.INSERT_IMMUTABLE && !table.current()) {
            throw new IllegalArgumentException("只追加表不支持 " + kind + ": " + table.name());
        }
    }

    public static ExtractedRecord insert(TableSchema table, long version, Map<String, Object> fields) {
        return new ExtractedRecord(table, MutationKind.INSERT_IMMUTABLE, version, fields);
    }

    public static ExtractedRecord upsert(TableSchema table, long version, Map<String, Object> fields) {
        return new ExtractedRecord(table, MutationKind.UPSERT_CURRENT, version, fields);
    }

    public static ExtractedRecord delete(TableSchema table, long version, Map<String, Object> fields) {
        return new ExtractedRecord(table, MutationKind.DELETE_MARKER, version, fields);
    }

    public String tableName() {
        return table.name();
    }

    public List<Object> primaryKey() {
        List<Object> key = new ArrayList<>(table.keyColumns().size());
        for (String column : table.keyColumns()) {
            key.add(fields.get(column));
        }
        return key;
    }

    public Object get(String column) {
        return fields.get(column);
    }

    /**
     * 估算序列化后的大小 (字节)，用于缓冲阈值判断，不要求精确
     */
    public long estimatedSize() {
        long size = RECORD_OVERHEAD;
        for (Object value : fields.values()) {
            if (value == null) {
                size += 1;
            } else if (value instanceof CharSequence s) {
                size += s.length() + 4L;
            } else if (value instanceof BigDecimal d) {
                size += d.unscaledValue().bitLength() / 8 + 5L;
            } else if (value instanceof Boolean) {
                size += 1;
            } else {
                size += 8;
            }
        }
        return size;
    }
}
