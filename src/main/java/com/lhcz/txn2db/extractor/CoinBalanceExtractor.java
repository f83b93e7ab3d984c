package com.lhcz.txn2db.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.ChainUtil;
import com.lhcz.txn2db.util.JsonUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * fungible_asset_processor：从 CoinStore 资源写入中提取余额
 * <ul>
 *   <li>coin_balances - 每个版本的余额快照 (只追加)</li>
 *   <li>current_coin_balances - 最新余额 (按 owner + coin 覆盖)</li>
 * </ul>
 */
public class CoinBalanceExtractor implements Extractor {

    static final String COIN_STORE_PREFIX = "0x1::coin::CoinStore<";
    private static final int COIN_TYPE_MAX = 5000;

    @Override
    public String name() {
        return "CoinBalanceExtractor";
    }

    @Override
    public List<TableSchema> tables() {
        return List.of(Tables.COIN_BALANCES, Tables.CURRENT_COIN_BALANCES);
    }

    @Override
    public List<ExtractedRecord> extract(Transaction txn) {
        List<ExtractedRecord> records = new ArrayList<>();
        for (JsonNode change : txn.payload().path("changes")) {
            if (!"write_resource".equals(JsonUtil.text(change, "type"))) {
                continue;
            }
            JsonNode data = change.path("data");
            String resourceType = JsonUtil.text(data, "type");
            if (resourceType == null || !resourceType.startsWith(COIN_STORE_PREFIX) || !resourceType.endsWith(">")) {
                continue;
            }
            String coinType = resourceType.substring(COIN_STORE_PREFIX.length(), resourceType.length() - 1);
            BigDecimal amount = JsonUtil.decimal(data.path("data").path("coin"), "value");
            if (amount == null) {
                throw new IllegalArgumentException("CoinStore 缺少 coin.value: " + resourceType);
            }
            String owner = ChainUtil.standardizeAddress(JsonUtil.text(change, "address"));
            String coinTypeHash = ChainUtil.sha3Hex(coinType);
            String coinTypeTrunc = ChainUtil.truncate(coinType, COIN_TYPE_MAX);

            Map<String, Object> balance = new LinkedHashMap<>();
            balance.put("transaction_version", txn.version());
            balance.put("owner_address", owner);
            balance.put("coin_type_hash", coinTypeHash);
            balance.put("coin_type", coinTypeTrunc);
            balance.put("amount", amount);
            balance.put("transaction_timestamp", txn.timestamp());
            records.add(ExtractedRecord.insert(Tables.COIN_BALANCES, txn.version(), balance));

            Map<String, Object> current = new LinkedHashMap<>();
            current.put("owner_address", owner);
            current.put("coin_type_hash", coinTypeHash);
            current.put("coin_type", coinTypeTrunc);
            current.put("amount", amount);
            current.put("last_transaction_version", txn.version());
            current.put("last_transaction_timestamp", txn.timestamp());
            records.add(ExtractedRecord.upsert(Tables.CURRENT_COIN_BALANCES, txn.version(), current));
        }
        return records;
    }
}
