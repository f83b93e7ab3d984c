package com.lhcz.txn2db.model;

import java.time.Instant;
import java.util.List;

/**
 * 一笔交易经全部 Extractor 处理后的完整输出 (原子单位)
 */
public record ExtractedTransaction(long version, Instant timestamp, List<ExtractedRecord> records) {

    public ExtractedTransaction {
        records = List.copyOf(records);
    }
}
