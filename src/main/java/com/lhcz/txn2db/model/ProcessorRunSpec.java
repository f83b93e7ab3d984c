package com.lhcz.txn2db.model;

import java.util.Objects;

/**
 * 一次运行的参数
 *
 * @param processorName       processor_config.type，也是主流程 checkpoint 名称
 * @param startingVersion     initial_starting_version
 * @param endingVersion       可空；tailing 模式下为空表示一直追链头
 * @param overwriteCheckpoint 丢弃已有进度，从 startingVersion 重新开始
 * @param backfillAlias       回填模式必填
 */
public record ProcessorRunSpec(String processorName,
                               RunMode mode,
                               long startingVersion,
                               Long endingVersion,
                               boolean overwriteCheckpoint,
                               String backfillAlias) {

    public ProcessorRunSpec {
        Objects.requireNonNull(processorName, "processorName");
        Objects.requireNonNull(mode, "mode");
        if (startingVersion < 0) {
            throw new IllegalArgumentException("starting_version 不能为负: " + startingVersion);
        }
        if (endingVersion != null && endingVersion < startingVersion) {
            throw new IllegalArgumentException("ending_version(" + endingVersion + ") 小于 starting_version(" + startingVersion + ")");
        }
        if (mode == RunMode.BACKFILL && (backfillAlias == null || backfillAlias.isBlank())) {
            throw new IllegalArgumentException("backfill 模式必须配置 backfill_alias");
        }
    }

    public static ProcessorRunSpec tailing(String processorName, long startingVersion) {
        return new ProcessorRunSpec(processorName, RunMode.TAILING, startingVersion, null, false, null);
    }

    public static ProcessorRunSpec backfill(String processorName, String alias, long startingVersion, Long endingVersion, boolean overwrite) {
        return new ProcessorRunSpec(processorName, RunMode.BACKFILL, startingVersion, endingVersion, overwrite, alias);
    }

    public boolean isBackfill() {
        return mode == RunMode.BACKFILL;
    }

    public CheckpointKey checkpointKey() {
        return isBackfill() ? CheckpointKey.backfill(backfillAlias) : CheckpointKey.tailing(processorName);
    }

    /** 用于日志和 Parquet 对象路径 */
    public String runName() {
        return isBackfill() ? backfillAlias : processorName;
    }
}
