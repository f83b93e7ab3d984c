package com.lhcz.txn2db.support;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.JsonUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 构造节点 REST 格式的测试交易
 */
public final class TestTransactions {

    public static final long BASE_MICROS = 1_700_000_000_000_000L;

    private TestTransactions() {
    }

    public static ObjectNode json(long version) {
        ObjectNode node = JsonUtil.mapper().createObjectNode();
        node.put("version", String.valueOf(version));
        node.put("hash", String.format("0x%064x", version));
        node.put("type", "user_transaction");
        node.put("success", true);
        node.put("vm_status", "Executed successfully");
        node.put("gas_used", "12");
        node.put("timestamp", String.valueOf(BASE_MICROS + version * 1_000_000L));
        node.put("sender", "0xa");
        node.put("sequence_number", String.valueOf(version));
        node.put("max_gas_amount", "2000");
        node.put("gas_unit_price", "100");
        node.put("expiration_timestamp_secs", "1700000600");
        ObjectNode payload = node.putObject("payload");
        payload.put("type", "entry_function_payload");
        payload.put("function", "0x1::coin::transfer");
        ObjectNode signature = node.putObject("signature");
        signature.put("type", "ed25519_signature");
        signature.put("public_key", "0xpk");
        signature.put("signature", "0xsig");
        node.putArray("events");
        node.putArray("changes");
        return node;
    }

    public static Instant timestamp(long version) {
        long micros = BASE_MICROS + version * 1_000_000L;
        return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
    }

    public static Transaction txn(long version) {
        return of(json(version));
    }

    public static Transaction of(ObjectNode node) {
        long version = Long.parseLong(node.get("version").asText());
        return new Transaction(version, timestamp(version), node.path("success").asBoolean(true),
                node.path("type").asText(), node);
    }

    public static List<Transaction> range(long from, long toInclusive) {
        List<Transaction> txns = new ArrayList<>();
        for (long v = from; v <= toInclusive; v++) {
            txns.add(txn(v));
        }
        return txns;
    }

    /**
     * 带一条 CoinStore 写入的交易
     */
    public static Transaction coinStoreWrite(long version, String owner, String coinType, String amount) {
        ObjectNode node = json(version);
        ArrayNode changes = ((ArrayNode) node.get("changes"));
        ObjectNode change = changes.addObject();
        change.put("type", "write_resource");
        change.put("address", owner);
        ObjectNode data = change.putObject("data");
        data.put("type", "0x1::coin::CoinStore<" + coinType + ">");
        data.putObject("data").putObject("coin").put("value", amount);
        return of(node);
    }

    /**
     * ANS 域名写入 / 删除
     */
    public static Transaction ansChange(long version, boolean delete, String domain, String subdomain, String target) {
        ObjectNode node = json(version);
        ObjectNode change = ((ArrayNode) node.get("changes")).addObject();
        change.put("type", delete ? "delete_table_item" : "write_table_item");
        change.put("handle", "0xhandle");
        ObjectNode data = change.putObject("data");
        data.put("key_type", "0x867ed1f6bf916171b1de3ee92849b8978b7d1b9e0a8cc982a3d19d535dfd9c0c::domains::NameRecordKeyV1");
        ObjectNode key = data.putObject("key");
        key.put("domain_name", domain);
        ArrayNode sub = key.putObject("subdomain_name").putArray("vec");
        if (subdomain != null) {
            sub.add(subdomain);
        }
        if (!delete) {
            ObjectNode value = data.putObject("value");
            value.put("expiration_time_sec", "1800000000");
            ArrayNode targetVec = value.putObject("target_address").putArray("vec");
            if (target != null) {
                targetVec.add(target);
            }
        }
        return of(node);
    }
}
