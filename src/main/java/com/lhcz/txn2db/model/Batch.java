package com.lhcz.txn2db.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次原子提交的单位：连续版本区间 [startVersion, endVersion] 内所有交易产出的全部记录
 *
 * @param recordsByTable 仅包含有记录的表，记录保持版本顺序
 */
public record Batch(long startVersion, long endVersion, Instant lastTransactionTimestamp,
                    Map<String, List<ExtractedRecord>> recordsByTable) {

    public Batch {
        if (endVersion < startVersion) {
            throw new IllegalArgumentException("非法区间 [" + startVersion + ", " + endVersion + "]");
        }
        Map<String, List<ExtractedRecord>> copy = new LinkedHashMap<>();
        recordsByTable.forEach((table, records) -> {
            if (!records.isEmpty()) {
                copy.put(table, List.copyOf(records));
            }
        });
        recordsByTable = Collections.unmodifiableMap(copy);
    }

    public int recordCount() {
        return recordsByTable.values().stream().mapToInt(List::size).sum();
    }

    public long transactionCount() {
        return endVersion - startVersion + 1;
    }

    @Override
    public String toString() {
        return "Batch[" + startVersion + ", " + endVersion + "] tables=" + recordsByTable.keySet() + " records=" + recordCount();
    }
}
