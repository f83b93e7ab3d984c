package com.lhcz.txn2db.extractor;

import com.lhcz.txn2db.core.DeadLetterQueueManager;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.ExtractedTransaction;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 对一笔交易依次执行全部 Extractor
 * <p>
 * 失败按 Extractor 隔离：某个 Extractor 抛异常只丢弃它自己的输出。
 * failOnError=true 时抛出 {@link ExtractionException} 终止流水线，否则记录日志并写入补录目录后继续。
 * 解码失败的交易 ({@link Transaction#isMalformed()}) 走同一策略，跳过时只占位不产出记录。
 */
public class ExtractionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final String processorName;
    private final List<Extractor> extractors;
    private final Set<String> tablesToWrite;
    private final boolean failOnError;
    private final DeadLetterQueueManager deadLetterQueueManager;
    private final AtomicLong skipped = new AtomicLong();

    /**
     * @param tablesToWrite 只写这些表，空集合表示全部
     */
    public ExtractionEngine(String processorName, List<Extractor> extractors, Set<String> tablesToWrite,
                            boolean failOnError, DeadLetterQueueManager deadLetterQueueManager) {
        this.processorName = processorName;
        this.extractors = List.copyOf(extractors);
        this.tablesToWrite = Set.copyOf(tablesToWrite);
        this.failOnError = failOnError;
        this.deadLetterQueueManager = deadLetterQueueManager;

        Set<String> known = new HashSet<>();
        this.extractors.forEach(e -> e.tables().forEach(t -> known.add(t.name())));
        for (String table : this.tablesToWrite) {
            if (!known.contains(table)) {
                throw new IllegalArgumentException("tables_to_write 包含未知表: " + table + "，可选: " + known);
            }
        }
    }

    /** 解码失败在补录文件和异常中使用的抽取器名 */
    public static final String DECODER = "TransactionDecoder";

    public ExtractedTransaction extract(Transaction transaction) {
        if (transaction.isMalformed()) {
            handleFailure(transaction, DECODER, transaction.decodeError());
            return new ExtractedTransaction(transaction.version(), null, List.of());
        }
        List<ExtractedRecord> records = new ArrayList<>();
        for (Extractor extractor : extractors) {
            List<ExtractedRecord> output;
            try {
                output = extractor.extract(transaction);
            } catch (RuntimeException e) {
                handleFailure(transaction, extractor.name(), e);
                continue;
            }
            for (ExtractedRecord record : output) {
                if (writes(record.tableName())) {
                    records.add(record);
                }
            }
        }
        return new ExtractedTransaction(transaction.version(), transaction.timestamp(), records);
    }

    private void handleFailure(Transaction transaction, String extractorName, RuntimeException e) {
        ExtractionException error = e instanceof ExtractionException ee
                ? ee : new ExtractionException(transaction.version(), extractorName, e);
        if (failOnError) {
            throw error;
        }
        skipped.incrementAndGet();
        log.warn("⚠️ 跳过交易 {} 的 [{}] 抽取: {}", transaction.version(), extractorName, e.getMessage());
        deadLetterQueueManager.save(processorName, transaction, extractorName, error);
    }

    private boolean writes(String table) {
        return tablesToWrite.isEmpty() || tablesToWrite.contains(table);
    }

    /**
     * 实际会写入的表 (已按 tables_to_write 过滤)
     */
    public List<TableSchema> tables() {
        Map<String, TableSchema> tables = new LinkedHashMap<>();
        for (Extractor extractor : extractors) {
            for (TableSchema table : extractor.tables()) {
                if (writes(table.name())) {
                    tables.putIfAbsent(table.name(), table);
                }
            }
        }
        return List.copyOf(tables.values());
    }

    public long skippedCount() {
        return skipped.get();
    }
}
