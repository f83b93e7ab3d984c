package com.lhcz.txn2db.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * 链上交易 (来自交易流，只读)
 *
 * @param version   全局递增版本号，无间隙
 * @param timestamp 交易所在区块时间
 * @param success   VM 执行是否成功
 * @param type      交易类型，如 user_transaction / block_metadata_transaction
 * @param payload   原始 JSON，由各 Extractor 自行解析
 * @param decodeError 版本号可读但其余字段解码失败时的原因，正常交易为 null
 */
public record Transaction(long version, Instant timestamp, boolean success, String type, JsonNode payload,
                          RuntimeException decodeError) {

    public static final String USER_TRANSACTION = "user_transaction";

    public Transaction(long version, Instant timestamp, boolean success, String type, JsonNode payload) {
        this(version, timestamp, success, type, payload, null);
    }

    /**
     * 解码失败的交易：只保留版本号和原始 JSON，占住自己的版本位置，交给抽取阶段按策略跳过或终止
     */
    public static Transaction malformed(long version, JsonNode payload, RuntimeException error) {
        return new Transaction(version, null, false, null, payload, error);
    }

    public boolean isMalformed() {
        return decodeError != null;
    }

    public boolean isUserTransaction() {
        return USER_TRANSACTION.equals(type);
    }
}
