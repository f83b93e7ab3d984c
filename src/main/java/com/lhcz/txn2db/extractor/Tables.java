package com.lhcz.txn2db.extractor;

import com.lhcz.txn2db.model.TableSchema;

import static com.lhcz.txn2db.model.ColumnType.BIGINT;
import static com.lhcz.txn2db.model.ColumnType.BOOLEAN;
import static com.lhcz.txn2db.model.ColumnType.JSON;
import static com.lhcz.txn2db.model.ColumnType.NUMERIC;
import static com.lhcz.txn2db.model.ColumnType.TEXT;
import static com.lhcz.txn2db.model.ColumnType.TIMESTAMP;

/**
 * 各 processor 写入的表结构
 */
public final class Tables {

    private Tables() {
    }

    public static final TableSchema TRANSACTIONS = TableSchema.builder("transactions")
            .key("version", BIGINT)
            .column("hash", TEXT)
            .column("type", TEXT)
            .column("success", BOOLEAN)
            .nullable("vm_status", TEXT)
            .nullable("gas_used", NUMERIC)
            .nullable("state_change_hash", TEXT)
            .nullable("event_root_hash", TEXT)
            .nullable("accumulator_root_hash", TEXT)
            .column("num_events", BIGINT)
            .column("num_write_set_changes", BIGINT)
            .nullable("payload", JSON)
            .nullable("payload_type", TEXT)
            .column("block_timestamp", TIMESTAMP)
            .version("version")
            .build();

    public static final TableSchema WRITE_SET_CHANGES = TableSchema.builder("write_set_changes")
            .key("transaction_version", BIGINT)
            .key("write_set_change_index", BIGINT)
            .column("type", TEXT)
            .nullable("address", TEXT)
            .nullable("state_key_hash", TEXT)
            .column("block_timestamp", TIMESTAMP)
            .version("transaction_version")
            .build();

    public static final TableSchema USER_TRANSACTIONS = TableSchema.builder("user_transactions")
            .key("version", BIGINT)
            .column("sender", TEXT)
            .column("sequence_number", BIGINT)
            .nullable("parent_signature_type", TEXT)
            .nullable("max_gas_amount", NUMERIC)
            .nullable("gas_unit_price", NUMERIC)
            .nullable("expiration_timestamp_secs", TIMESTAMP)
            .nullable("entry_function_id_str", TEXT)
            .column("success", BOOLEAN)
            .column("block_timestamp", TIMESTAMP)
            .version("version")
            .build();

    public static final TableSchema SIGNATURES = TableSchema.builder("signatures")
            .key("transaction_version", BIGINT)
            .key("multi_agent_index", BIGINT)
            .key("multi_sig_index", BIGINT)
            .key("is_sender_primary", BOOLEAN)
            .column("signer", TEXT)
            .column("type", TEXT)
            .nullable("public_key", TEXT)
            .nullable("signature", TEXT)
            .version("transaction_version")
            .build();

    public static final TableSchema EVENTS = TableSchema.builder("events")
            .key("transaction_version", BIGINT)
            .key("event_index", BIGINT)
            .column("account_address", TEXT)
            .column("creation_number", BIGINT)
            .column("sequence_number", BIGINT)
            .column("type", TEXT)
            .column("indexed_type", TEXT)
            .nullable("data", JSON)
            .column("block_timestamp", TIMESTAMP)
            .version("transaction_version")
            .build();

    public static final TableSchema COIN_BALANCES = TableSchema.builder("coin_balances")
            .key("transaction_version", BIGINT)
            .key("owner_address", TEXT)
            .key("coin_type_hash", TEXT)
            .column("coin_type", TEXT)
            .column("amount", NUMERIC)
            .column("transaction_timestamp", TIMESTAMP)
            .version("transaction_version")
            .build();

    public static final TableSchema CURRENT_COIN_BALANCES = TableSchema.builder("current_coin_balances")
            .key("owner_address", TEXT)
            .key("coin_type_hash", TEXT)
            .column("coin_type", TEXT)
            .column("amount", NUMERIC)
            .column("last_transaction_version", BIGINT)
            .column("last_transaction_timestamp", TIMESTAMP)
            .version("last_transaction_version")
            .current()
            .build();

    public static final TableSchema CURRENT_ANS_LOOKUP = TableSchema.builder("current_ans_lookup")
            .key("domain", TEXT)
            .key("subdomain", TEXT)
            .nullable("registered_address", TEXT)
            .nullable("expiration_timestamp", TIMESTAMP)
            .column("token_name", TEXT)
            .column("is_deleted", BOOLEAN)
            .column("last_transaction_version", BIGINT)
            .version("last_transaction_version")
            .current()
            .build();
}
