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
 * user_transaction_processor：用户交易 + 签名，非用户交易不产出
 */
public class UserTransactionExtractor implements Extractor {

    private static final int ENTRY_FUNCTION_ID_MAX = 1000;

    @Override
    public String name() {
        return "UserTransactionExtractor";
    }

    @Override
    public List<TableSchema> tables() {
        return List.of(Tables.USER_TRANSACTIONS, Tables.SIGNATURES);
    }

    @Override
    public List<ExtractedRecord> extract(Transaction txn) {
        if (!txn.isUserTransaction()) {
            return List.of();
        }
        JsonNode node = txn.payload();
        String sender = ChainUtil.standardizeAddress(requiredText(node, "sender"));
        JsonNode signature = node.path("signature");

        List<ExtractedRecord> records = new ArrayList<>();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("version", txn.version());
        row.put("sender", sender);
        row.put("sequence_number", JsonUtil.requiredLong(node, "sequence_number"));
        row.put("parent_signature_type", JsonUtil.text(signature, "type"));
        row.put("max_gas_amount", JsonUtil.decimal(node, "max_gas_amount"));
        row.put("gas_unit_price", JsonUtil.decimal(node, "gas_unit_price"));
        Long expiration = JsonUtil.optionalLong(node, "expiration_timestamp_secs");
        row.put("expiration_timestamp_secs", expiration == null ? null : Instant.ofEpochSecond(expiration));
        row.put("entry_function_id_str", ChainUtil.truncate(JsonUtil.text(node.path("payload"), "function"), ENTRY_FUNCTION_ID_MAX));
        row.put("success", txn.success());
        row.put("block_timestamp", txn.timestamp());
        records.add(ExtractedRecord.insert(Tables.USER_TRANSACTIONS, txn.version(), row));

        if (!signature.isMissingNode() && !signature.isNull()) {
            collectSignatures(txn.version(), sender, signature, records);
        }
        return records;
    }

    private void collectSignatures(long version, String sender, JsonNode signature, List<ExtractedRecord> out) {
        String type = JsonUtil.text(signature, "type");
        if ("multi_agent_signature".equals(type) || "fee_payer_signature".equals(type)) {
            signerRows(version, sender, signature.path("sender"), true, 0, out);
            JsonNode addresses = signature.path("secondary_signer_addresses");
            JsonNode signers = signature.path("secondary_signers");
            for (int i = 0; i < signers.size(); i++) {
                String signer = ChainUtil.standardizeAddress(addresses.path(i).asText());
                signerRows(version, signer, signers.path(i), false, i + 1, out);
            }
        } else {
            signerRows(version, sender, signature, true, 0, out);
        }
    }

    private void signerRows(long version, String signer, JsonNode signature, boolean primary, int agentIndex,
                            List<ExtractedRecord> out) {
        String type = JsonUtil.text(signature, "type");
        if ("multi_ed25519_signature".equals(type)) {
            JsonNode signatures = signature.path("signatures");
            for (int i = 0; i < signatures.size(); i++) {
                // 公钥需按 bitmap 对应，这里只记录签名本身
                out.add(signatureRow(version, signer, type, null, signatures.path(i).asText(), primary, agentIndex, i));
            }
        } else {
            out.add(signatureRow(version, signer, type, JsonUtil.text(signature, "public_key"),
                    JsonUtil.text(signature, "signature"), primary, agentIndex, 0));
        }
    }

    private ExtractedRecord signatureRow(long version, String signer, String type, String publicKey, String sig,
                                         boolean primary, int agentIndex, int sigIndex) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("transaction_version", version);
        row.put("multi_agent_index", (long) agentIndex);
        row.put("multi_sig_index", (long) sigIndex);
        row.put("is_sender_primary", primary);
        row.put("signer", signer);
        row.put("type", type == null ? "unknown" : type);
        row.put("public_key", publicKey);
        row.put("signature", sig);
        return ExtractedRecord.insert(Tables.SIGNATURES, version, row);
    }

    private static String requiredText(JsonNode node, String field) {
        String value = JsonUtil.text(node, field);
        if (value == null) {
            throw new IllegalArgumentException("缺少字段: " + field);
        }
        return value;
    }
}
