package com.lhcz.txn2db.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.ChainUtil;
import com.lhcz.txn2db.util.JsonUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * default_processor：每笔交易一行 transactions，外加写集变更 write_set_changes
 */
public class TransactionExtractor implements Extractor {

    @Override
    public String name() {
        return "TransactionExtractor";
    }

    @Override
    public List<TableSchema> tables() {
        return List.of(Tables.TRANSACTIONS, Tables.WRITE_SET_CHANGES);
    }

    @Override
    public List<ExtractedRecord> extract(Transaction txn) {
        JsonNode node = txn.payload();
        JsonNode changes = node.path("changes");
        JsonNode payload = node.path("payload");

        List<ExtractedRecord> records = new ArrayList<>();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("version", txn.version());
        row.put("hash", JsonUtil.text(node, "hash"));
        row.put("type", txn.type());
        row.put("success", txn.success());
        row.put("vm_status", JsonUtil.text(node, "vm_status"));
        row.put("gas_used", JsonUtil.decimal(node, "gas_used"));
        row.put("state_change_hash", JsonUtil.text(node, "state_change_hash"));
        row.put("event_root_hash", JsonUtil.text(node, "event_root_hash"));
        row.put("accumulator_root_hash", JsonUtil.text(node, "accumulator_root_hash"));
        row.put("num_events", (long) node.path("events").size());
        row.put("num_write_set_changes", (long) changes.size());
        row.put("payload", payload.isMissingNode() || payload.isNull() ? null : JsonUtil.toJson(payload));
        row.put("payload_type", JsonUtil.text(payload, "type"));
        row.put("block_timestamp", txn.timestamp());
        records.add(ExtractedRecord.insert(Tables.TRANSACTIONS, txn.version(), row));

        int index = 0;
        for (JsonNode change : changes) {
            Map<String, Object> wsc = new LinkedHashMap<>();
            wsc.put("transaction_version", txn.version());
            wsc.put("write_set_change_index", (long) index++);
            wsc.put("type", JsonUtil.text(change, "type"));
            String address = JsonUtil.text(change, "address");
            wsc.put("address", address == null ? null : ChainUtil.standardizeAddress(address));
            wsc.put("state_key_hash", JsonUtil.text(change, "state_key_hash"));
            wsc.put("block_timestamp", txn.timestamp());
            records.add(ExtractedRecord.insert(Tables.WRITE_SET_CHANGES, txn.version(), wsc));
        }
        return records;
    }
}
