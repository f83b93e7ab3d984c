package com.lhcz.txn2db.core;

import com.lhcz.txn2db.model.Batch;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.ExtractedTransaction;
import com.lhcz.txn2db.source.OrderingViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按表缓冲抽取结果，满足阈值后整体切出一个 {@link Batch}
 * <p>
 * 触发条件 (任一)：缓冲字节数 &gt;= maxBufferBytes；第一笔待提交交易到达后已过 uploadInterval。
 * 切出的批次总是覆盖全部缓冲交易，区间连续，没有记录的交易同样推进区间。
 * 只在 sink 线程内使用，非线程安全。
 */
public class BatchAccumulator {

    private final long maxBufferBytes;
    private final Duration uploadInterval;
    private final Clock clock;

    private final Map<String, List<ExtractedRecord>> buffers = new LinkedHashMap<>();
    private long expectedNext = -1;
    private long startVersion = -1;
    private long endVersion = -1;
    private Instant lastTimestamp;
    private Instant firstArrival;
    private long bufferedBytes;

    public BatchAccumulator(long maxBufferBytes, Duration uploadInterval, Clock clock) {
        if (maxBufferBytes <= 0) {
            throw new IllegalArgumentException("max_buffer_size 必须为正数");
        }
        this.maxBufferBytes = maxBufferBytes;
        this.uploadInterval = uploadInterval;
        this.clock = clock;
    }

    /**
     * 指定下一笔期望的版本，不调用则以第一笔交易为准
     */
    public void expect(long version) {
        this.expectedNext = version;
    }

    public void add(ExtractedTransaction txn) {
        if (expectedNext >= 0 && txn.version() != expectedNext) {
            throw new OrderingViolationException(expectedNext, txn.version());
        }
        if (isEmpty()) {
            startVersion = txn.version();
            firstArrival = clock.instant();
        }
        endVersion = txn.version();
        expectedNext = txn.version() + 1;
        if (txn.timestamp() != null) {
            lastTimestamp = txn.timestamp();
        }
        for (ExtractedRecord record : txn.records()) {
            buffers.computeIfAbsent(record.tableName(), t -> new ArrayList<>()).add(record);
            bufferedBytes += record.estimatedSize();
        }
    }

    public boolean shouldFlush() {
        if (isEmpty()) {
            return false;
        }
        if (bufferedBytes >= maxBufferBytes) {
            return true;
        }
        return Duration.between(firstArrival, clock.instant()).compareTo(uploadInterval) >= 0;
    }

    public boolean isEmpty() {
        return startVersion < 0;
    }

    /**
     * 切出当前全部缓冲，空时返回 null
     */
    public Batch drain() {
        if (isEmpty()) {
            return null;
        }
        Batch batch = new Batch(startVersion, endVersion, lastTimestamp, buffers);
        buffers.clear();
        startVersion = -1;
        endVersion = -1;
        firstArrival = null;
        bufferedBytes = 0;
        return batch;
    }

    public long bufferedBytes() {
        return bufferedBytes;
    }

    public long pendingTransactions() {
        return isEmpty() ? 0 : endVersion - startVersion + 1;
    }
}
