package com.lhcz.txn2db.model;

/**
 * 运行模式：tailing = 持续追链头 (配置中写作 default)，backfill = 有界回填
 */
public enum RunMode {
    TAILING,
    BACKFILL;

    public static RunMode fromConfig(String type) {
        if (type == null || type.isBlank() || "default".equalsIgnoreCase(type)) {
            return TAILING;
        }
        if ("backfill".equalsIgnoreCase(type)) {
            return BACKFILL;
        }
        throw new IllegalArgumentException("未知的 processor_mode.type: " + type);
    }
}
