package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.model.ColumnType;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.TableSchema.Column;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 生成写入 SQL 并绑定参数
 * <p>
 * 三种写法的约定：
 * <ul>
 *   <li>upsert - 仅当库中版本 &lt;= 新记录版本时覆盖</li>
 *   <li>insertIgnore - 主键已存在则什么都不做</li>
 *   <li>删除标记 - 以墓碑行走 upsert，同样受版本守卫</li>
 * </ul>
 * 时间戳一律按 UTC 存为不带时区的 TIMESTAMP。
 */
public abstract class SqlDialect {

    public static SqlDialect forJdbcUrl(String jdbcUrl) {
        if (jdbcUrl.startsWith("jdbc:postgresql:")) {
            return new PostgresDialect();
        }
        return new MergeDialect();
    }

    protected abstract String typeName(ColumnType type);

    public abstract String upsertSql(TableSchema table);

    public abstract String insertIgnoreSql(TableSchema table);

    /** 参数占位符，需要时由子类加类型转换 */
    protected String placeholder(Column column) {
        return "?";
    }

    public String createTableSql(TableSchema table) {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(table.name()).append(" (");
        for (Column column : table.columns()) {
            sql.append(column.name()).append(' ').append(typeName(column.type()));
            if (!column.nullable()) {
                sql.append(" NOT NULL");
            }
            sql.append(", ");
        }
        sql.append("PRIMARY KEY (").append(String.join(", ", table.keyColumns())).append("))");
        return sql.toString();
    }

    protected String columnList(TableSchema table) {
        return String.join(", ", table.columnNames());
    }

    protected String placeholders(TableSchema table) {
        return table.columns().stream().map(this::placeholder).collect(Collectors.joining(", "));
    }

    /**
     * 按列顺序绑定整行
     */
    public void bindRow(PreparedStatement ps, TableSchema table, Map<String, Object> fields) throws SQLException {
        List<Column> columns = table.columns();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            bind(ps, i + 1, column, fields.get(column.name()));
        }
    }

    public void bind(PreparedStatement ps, int index, Column column, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType(column.type()));
            return;
        }
        switch (column.type()) {
            case BIGINT -> ps.setLong(index, ((Number) value).longValue());
            case BOOLEAN -> ps.setBoolean(index, (Boolean) value);
            case NUMERIC -> ps.setBigDecimal(index, value instanceof BigDecimal d ? d : new BigDecimal(value.toString()));
            case TIMESTAMP -> ps.setObject(index, toUtc(value));
            case TEXT, JSON -> ps.setString(index, value.toString());
            default -> throw new IllegalArgumentException("不支持的列类型: " + column.type());
        }
    }

    private static LocalDateTime toUtc(Object value) {
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        throw new IllegalArgumentException("TIMESTAMP 列只接受 Instant / LocalDateTime: " + value.getClass());
    }

    private static int sqlType(ColumnType type) {
        return switch (type) {
            case BIGINT -> Types.BIGINT;
            case BOOLEAN -> Types.BOOLEAN;
            case NUMERIC -> Types.NUMERIC;
            case TIMESTAMP -> Types.TIMESTAMP;
            case TEXT, JSON -> Types.VARCHAR;
        };
    }
}
