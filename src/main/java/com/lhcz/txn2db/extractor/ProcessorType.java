package com.lhcz.txn2db.extractor;

import com.lhcz.txn2db.sink.SinkKind;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * processor_config.type -> 固定的 Extractor 组合 + 写入端类型，启动时确定
 */
public enum ProcessorType {
    DEFAULT_PROCESSOR("default_processor", SinkKind.POSTGRES, TransactionExtractor::new),
    USER_TRANSACTION_PROCESSOR("user_transaction_processor", SinkKind.POSTGRES, UserTransactionExtractor::new),
    EVENTS_PROCESSOR("events_processor", SinkKind.POSTGRES, EventExtractor::new),
    FUNGIBLE_ASSET_PROCESSOR("fungible_asset_processor", SinkKind.POSTGRES, CoinBalanceExtractor::new),
    ANS_PROCESSOR("ans_processor", SinkKind.POSTGRES, AnsLookupExtractor::new),

    PARQUET_DEFAULT_PROCESSOR("parquet_default_processor", SinkKind.PARQUET, TransactionExtractor::new),
    PARQUET_USER_TRANSACTION_PROCESSOR("parquet_user_transaction_processor", SinkKind.PARQUET, UserTransactionExtractor::new),
    PARQUET_EVENTS_PROCESSOR("parquet_events_processor", SinkKind.PARQUET, EventExtractor::new),
    PARQUET_FUNGIBLE_ASSET_PROCESSOR("parquet_fungible_asset_processor", SinkKind.PARQUET, CoinBalanceExtractor::new),
    PARQUET_ANS_PROCESSOR("parquet_ans_processor", SinkKind.PARQUET, AnsLookupExtractor::new);

    private final String configName;
    private final SinkKind sinkKind;
    private final List<Supplier<Extractor>> extractors;

    @SafeVarargs
    ProcessorType(String configName, SinkKind sinkKind, Supplier<Extractor>... extractors) {
        this.configName = configName;
        this.sinkKind = sinkKind;
        this.extractors = List.of(extractors);
    }

    public String configName() {
        return configName;
    }

    public SinkKind sinkKind() {
        return sinkKind;
    }

    public List<Extractor> createExtractors() {
        return extractors.stream().map(Supplier::get).toList();
    }

    public static ProcessorType fromConfig(String type) {
        return Arrays.stream(values())
                .filter(t -> t.configName.equals(type))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 processor_config.type: " + type));
    }
}
