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

public class EventExtractor implements Extractor {

    private static final int INDEXED_TYPE_MAX = 300;

    @Override
    public String name() {
        return "EventExtractor";
    }

    @Override
    public List<TableSchema> tables() {
        return List.of(Tables.EVENTS);
    }

    @Override
    public List<ExtractedRecord> extract(Transaction txn) {
        JsonNode events = txn.payload().path("events");
        List<ExtractedRecord> records = new ArrayList<>(events.size());
        int index = 0;
        for (JsonNode event : events) {
            JsonNode guid = event.path("guid");
            String type = JsonUtil.text(event, "type");
            if (type == null) {
                throw new IllegalArgumentException("event " + index + " 缺少 type");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("transaction_version", txn.version());
            row.put("event_index", (long) index++);
            row.put("account_address", ChainUtil.standardizeAddress(JsonUtil.text(guid, "account_address")));
            row.put("creation_number", JsonUtil.requiredLong(guid, "creation_number"));
            row.put("sequence_number", JsonUtil.requiredLong(event, "sequence_number"));
            row.put("type", type);
            row.put("indexed_type", ChainUtil.truncate(type, INDEXED_TYPE_MAX));
            row.put("data", event.has("data") ? JsonUtil.toJson(event.get("data")) : null);
            row.put("block_timestamp", txn.timestamp());
            records.add(ExtractedRecord.insert(Tables.EVENTS, txn.version(), row));
        }
        return records;
    }
}
