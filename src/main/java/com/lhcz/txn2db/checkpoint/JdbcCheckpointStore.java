package com.lhcz.txn2db.checkpoint;

import com.lhcz.txn2db.model.BackfillStatus;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;
import com.lhcz.txn2db.model.ColumnType;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.sink.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 关系库进度表
 * <p>
 * 表结构复用 {@link TableSchema}，写入走方言的带版本守卫 upsert，
 * 因此旧进度永远覆盖不了新进度。{@link #save(Connection, Checkpoint)}
 * 供 JdbcSink 在数据事务内一并提交。
 */
public class JdbcCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    public static final TableSchema PROCESSOR_STATUS = TableSchema.builder("processor_status")
            .key("processor", ColumnType.TEXT)
            .column("last_success_version", ColumnType.BIGINT)
            .column("last_updated", ColumnType.TIMESTAMP)
            .nullable("last_transaction_timestamp", ColumnType.TIMESTAMP)
            .version("last_success_version")
            .current()
            .build();

    public static final TableSchema BACKFILL_PROCESSOR_STATUS = TableSchema.builder("backfill_processor_status")
            .key("backfill_alias", ColumnType.TEXT)
            .column("backfill_status", ColumnType.TEXT)
            .column("last_success_version", ColumnType.BIGINT)
            .column("last_updated", ColumnType.TIMESTAMP)
            .nullable("last_transaction_timestamp", ColumnType.TIMESTAMP)
            .column("backfill_start_version", ColumnType.BIGINT)
            .nullable("backfill_end_version", ColumnType.BIGINT)
            .version("last_success_version")
            .current()
            .build();

    public static final TableSchema LEDGER_INFOS = TableSchema.builder("ledger_infos")
            .key("chain_id", ColumnType.BIGINT)
            .version("chain_id")
            .build();

    private final DataSource dataSource;
    private final SqlDialect dialect;

    public JdbcCheckpointStore(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    public List<TableSchema> tables() {
        return List.of(PROCESSOR_STATUS, BACKFILL_PROCESSOR_STATUS, LEDGER_INFOS);
    }

    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (TableSchema table : tables()) {
                stmt.execute(dialect.createTableSql(table));
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("创建进度表失败", e);
        }
    }

    @Override
    public Optional<Checkpoint> read(CheckpointKey key) {
        TableSchema table = tableFor(key);
        String sql = "SELECT * FROM " + table.name() + " WHERE " + table.keyColumns().get(0) + " = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(toCheckpoint(key, rs));
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("读取进度失败: " + key, e);
        }
    }

    @Override
    public void save(Checkpoint checkpoint) {
        try (Connection conn = dataSource.getConnection()) {
            save(conn, checkpoint);
        } catch (SQLException e) {
            throw new CheckpointStoreException("保存进度失败: " + checkpoint.key(), e);
        }
    }

    /**
     * 在调用方的连接 (事务) 内写入进度
     */
    public void save(Connection conn, Checkpoint checkpoint) throws SQLException {
        TableSchema table = tableFor(checkpoint.key());
        try (PreparedStatement ps = conn.prepareStatement(dialect.upsertSql(table))) {
            dialect.bindRow(ps, table, toRow(checkpoint));
            ps.executeUpdate();
        }
    }

    @Override
    public void clear(CheckpointKey key) {
        TableSchema table = tableFor(key);
        String sql = "DELETE FROM " + table.name() + " WHERE " + table.keyColumns().get(0) + " = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.name());
            int rows = ps.executeUpdate();
            log.warn("⚠️ 已清除进度 {} (rows={})", key, rows);
        } catch (SQLException e) {
            throw new CheckpointStoreException("清除进度失败: " + key, e);
        }
    }

    @Override
    public OptionalLong chainId() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT chain_id FROM " + LEDGER_INFOS.name())) {
            return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
        } catch (SQLException e) {
            throw new CheckpointStoreException("读取 chain_id 失败", e);
        }
    }

    @Override
    public void saveChainId(long chainId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(dialect.insertIgnoreSql(LEDGER_INFOS))) {
            dialect.bindRow(ps, LEDGER_INFOS, Map.of("chain_id", chainId));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("保存 chain_id 失败", e);
        }
    }

    private static TableSchema tableFor(CheckpointKey key) {
        return key.isBackfill() ? BACKFILL_PROCESSOR_STATUS : PROCESSOR_STATUS;
    }

    private static Map<String, Object> toRow(Checkpoint cp) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (cp.key().isBackfill()) {
            row.put("backfill_alias", cp.key().name());
            row.put("backfill_status", cp.backfillStatus().name().toLowerCase(Locale.ROOT));
            row.put("backfill_start_version", cp.backfillStartVersion());
            row.put("backfill_end_version", cp.backfillEndVersion());
        } else {
            row.put("processor", cp.key().name());
        }
        row.put("last_success_version", cp.lastSuccessVersion());
        row.put("last_updated", cp.updatedAt());
        row.put("last_transaction_timestamp", cp.lastTransactionTimestamp());
        return row;
    }

    private static Checkpoint toCheckpoint(CheckpointKey key, ResultSet rs) throws SQLException {
        long last = rs.getLong("last_success_version");
        Instant updated = instant(rs, "last_updated");
        Instant txnTs = instant(rs, "last_transaction_timestamp");
        if (!key.isBackfill()) {
            return Checkpoint.tailing(key.name(), last, txnTs, updated);
        }
        BackfillStatus status = BackfillStatus.valueOf(rs.getString("backfill_status").toUpperCase(Locale.ROOT));
        long end = rs.getLong("backfill_end_version");
        Long endVersion = rs.wasNull() ? null : end;
        return new Checkpoint(key, last, txnTs, updated, status, rs.getLong("backfill_start_version"), endVersion);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        LocalDateTime value = rs.getObject(column, LocalDateTime.class);
        return value == null ? null : value.toInstant(ZoneOffset.UTC);
    }
}
