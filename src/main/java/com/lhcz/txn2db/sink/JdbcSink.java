package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.checkpoint.JdbcCheckpointStore;
import com.lhcz.txn2db.model.Batch;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.MutationKind;
import com.lhcz.txn2db.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 关系库写入端
 * <p>
 * 每个批次一个 JDBC 事务：各表数据 + 进度行同时提交，任一失败整体回滚。
 */
public class JdbcSink implements Sink {
    private static final Logger log = LoggerFactory.getLogger(JdbcSink.class);

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final JdbcCheckpointStore checkpointStore;
    private final int commitTimeoutSecs;

    public JdbcSink(DataSource dataSource, SqlDialect dialect, JdbcCheckpointStore checkpointStore, int commitTimeoutSecs) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.checkpointStore = checkpointStore;
        this.commitTimeoutSecs = commitTimeoutSecs;
    }

    @Override
    public void initialize(List<TableSchema> tables) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (TableSchema table : tables) {
                stmt.execute(dialect.createTableSql(table));
                log.info("已确认数据表: {}", table.name());
            }
        } catch (SQLException e) {
            throw new SinkException("建表失败", e);
        }
        checkpointStore.createTables();
    }

    @Override
    public void commit(Batch batch, Checkpoint checkpoint) {
        long begin = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                for (List<ExtractedRecord> records : batch.recordsByTable().values()) {
                    writeTable(conn, records);
                }
                checkpointStore.save(conn, checkpoint);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new SinkException("批次写入失败 " + batch, e);
        }
        log.debug("批次已提交 {} ({} ms)", batch, System.currentTimeMillis() - begin);
    }

    /**
     * 删除标记按墓碑行写入 (is_deleted = true)，与 upsert 共用版本守卫；
     * 行被保留下来，旧版本重放时仍能被版本条件挡住。
     */
    private void writeTable(Connection conn, List<ExtractedRecord> records) throws SQLException {
        TableSchema table = records.get(0).table();
        List<ExtractedRecord> upserts = new ArrayList<>();
        List<ExtractedRecord> inserts = new ArrayList<>();
        for (ExtractedRecord record : dedupe(records)) {
            if (record.kind() == MutationKind.INSERT_IMMUTABLE) {
                inserts.add(record);
            } else {
                upserts.add(record);
            }
        }
        if (!upserts.isEmpty()) {
            execute(conn, dialect.upsertSql(table), upserts);
        }
        if (!inserts.isEmpty()) {
            execute(conn, dialect.insertIgnoreSql(table), inserts);
        }
    }

    private void execute(Connection conn, String sql, List<ExtractedRecord> records) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(commitTimeoutSecs);
            for (ExtractedRecord record : records) {
                dialect.bindRow(ps, record.table(), record.fields());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /**
     * 同一批次内同主键只保留一条：可变表取版本最高者 (同版本后到者优先)，只追加表保留首条
     */
    static List<ExtractedRecord> dedupe(List<ExtractedRecord> records) {
        Map<List<Object>, ExtractedRecord> byKey = new LinkedHashMap<>();
        for (ExtractedRecord record : records) {
            List<Object> key = record.primaryKey();
            if (record.kind() == MutationKind.INSERT_IMMUTABLE) {
                byKey.putIfAbsent(key, record);
                continue;
            }
            ExtractedRecord existing = byKey.get(key);
            if (existing == null || existing.version() <= record.version()) {
                byKey.put(key, record);
            }
        }
        return new ArrayList<>(byKey.values());
    }
}
