package com.lhcz.txn2db.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.ChainUtil;
import com.lhcz.txn2db.util.JsonUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ans_processor：域名表 (table item) 的写入 / 删除 -> current_ans_lookup
 * <p>
 * 按类型名后缀匹配 NameRecordKeyV1，表 handle 已隐含在类型所属合约中。
 */
public class AnsLookupExtractor implements Extractor {

    static final String NAME_RECORD_KEY_SUFFIX = "::domains::NameRecordKeyV1";
    static final int DOMAIN_LENGTH = 64;

    @Override
    public String name() {
        return "AnsLookupExtractor";
    }

    @Override
    public List<TableSchema> tables() {
        return List.of(Tables.CURRENT_ANS_LOOKUP);
    }

    @Override
    public List<ExtractedRecord> extract(Transaction txn) {
        List<ExtractedRecord> records = new ArrayList<>();
        for (JsonNode change : txn.payload().path("changes")) {
            String changeType = JsonUtil.text(change, "type");
            JsonNode data = change.path("data");
            String keyType = JsonUtil.text(data, "key_type");
            if (keyType == null || !keyType.endsWith(NAME_RECORD_KEY_SUFFIX)) {
                continue;
            }
            JsonNode key = data.path("key");
            String domain = ChainUtil.truncate(JsonUtil.text(key, "domain_name"), DOMAIN_LENGTH);
            if (domain == null) {
                throw new IllegalArgumentException("NameRecordKeyV1 缺少 domain_name");
            }
            String subdomain = ChainUtil.truncate(firstOption(key.path("subdomain_name")), DOMAIN_LENGTH);
            if (subdomain == null) {
                subdomain = "";
            }

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("domain", domain);
            row.put("subdomain", subdomain);
            row.put("token_name", tokenName(domain, subdomain));
            row.put("last_transaction_version", txn.version());

            if ("write_table_item".equals(changeType)) {
                JsonNode value = data.path("value");
                String target = firstOption(value.path("target_address"));
                Long expiration = JsonUtil.optionalLong(value, "expiration_time_sec");
                row.put("registered_address", target == null ? null : ChainUtil.standardizeAddress(target));
                row.put("expiration_timestamp", expiration == null ? null : Instant.ofEpochSecond(expiration));
                row.put("is_deleted", false);
                records.add(ExtractedRecord.upsert(Tables.CURRENT_ANS_LOOKUP, txn.version(), row));
            } else if ("delete_table_item".equals(changeType)) {
                row.put("registered_address", null);
                row.put("expiration_timestamp", null);
                row.put("is_deleted", true);
                records.add(ExtractedRecord.delete(Tables.CURRENT_ANS_LOOKUP, txn.version(), row));
            }
        }
        return records;
    }

    static String tokenName(String domain, String subdomain) {
        String name = domain + ".apt";
        return subdomain.isEmpty() ? name : subdomain + "." + name;
    }

    /** Move 的 Option 在 JSON 中表示为 {"vec": []} 或 {"vec": [x]} */
    private static String firstOption(JsonNode option) {
        JsonNode vec = option.path("vec");
        if (!vec.isArray() || vec.isEmpty()) {
            return null;
        }
        return vec.get(0).asText();
    }
}
