package com.lhcz.txn2db.model;

import java.time.Instant;

/**
 * 持久化进度
 *
 * @param lastSuccessVersion 最近一次成功提交批次的 endVersion
 * @param backfillStatus     仅回填模式有值
 */
public record Checkpoint(CheckpointKey key,
                         long lastSuccessVersion,
                         Instant lastTransactionTimestamp,
                         Instant updatedAt,
                         BackfillStatus backfillStatus,
                         Long backfillStartVersion,
                         Long backfillEndVersion) {

    public static Checkpoint tailing(String processorName, long lastSuccessVersion, Instant lastTransactionTimestamp, Instant updatedAt) {
        return new Checkpoint(CheckpointKey.tailing(processorName), lastSuccessVersion, lastTransactionTimestamp, updatedAt,
                null, null, null);
    }

    public static Checkpoint backfill(String alias, long lastSuccessVersion, Instant lastTransactionTimestamp, Instant updatedAt,
                                      BackfillStatus status, long startVersion, long endVersion) {
        return new Checkpoint(CheckpointKey.backfill(alias), lastSuccessVersion, lastTransactionTimestamp, updatedAt,
                status, startVersion, endVersion);
    }

    public boolean isComplete() {
        return backfillStatus == BackfillStatus.COMPLETE;
    }
}
