package com.lhcz.txn2db.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.JsonUtil;

import java.io.IOException;
import java.time.Instant;

/**
 * 节点 REST 格式的交易 JSON -> {@link Transaction}
 */
final class TransactionParser {

    private TransactionParser() {
    }

    /**
     * 读不出版本号时抛 IOException (数据无法定位，按传输错误重试)；
     * 版本号可读而其他字段解码失败时返回 {@link Transaction#malformed}，不影响后续交易。
     */
    static Transaction parse(JsonNode node) throws IOException {
        long version;
        try {
            version = JsonUtil.requiredLong(node, "version");
        } catch (IllegalArgumentException e) {
            throw new IOException("交易 JSON 缺少有效的 version: " + e.getMessage(), e);
        }
        try {
            // genesis 等交易没有 timestamp
            Instant timestamp = node.hasNonNull("timestamp") ? JsonUtil.micros(node, "timestamp") : Instant.EPOCH;
            boolean success = node.path("success").asBoolean(true);
            String type = JsonUtil.text(node, "type");
            return new Transaction(version, timestamp, success, type, node);
        } catch (IllegalArgumentException e) {
            return Transaction.malformed(version, node, e);
        }
    }
}
