package com.lhcz.txn2db.model;

import java.util.Objects;

/**
 * 进度命名空间：主流程按 processor 名称，回填按 backfill_alias，互不干扰
 */
public record CheckpointKey(RunMode mode, String name) {

    public CheckpointKey {
        Objects.requireNonNull(mode, "mode");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("checkpoint 名称不能为空");
        }
    }

    public static CheckpointKey tailing(String processorName) {
        return new CheckpointKey(RunMode.TAILING, processorName);
    }

    public static CheckpointKey backfill(String alias) {
        return new CheckpointKey(RunMode.BACKFILL, alias);
    }

    public boolean isBackfill() {
        return mode == RunMode.BACKFILL;
    }
}
