package com.lhcz.txn2db.sink;

import java.util.Arrays;

/**
 * 写入端类型，对应 db_config.type
 */
public enum SinkKind {
    POSTGRES("postgres_config"),
    PARQUET("parquet_config");

    private final String configName;

    SinkKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static SinkKind fromConfig(String type) {
        return Arrays.stream(values())
                .filter(k -> k.configName.equals(type))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 db_config.type: " + type));
    }
}
