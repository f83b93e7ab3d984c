package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.model.ColumnType;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.TableSchema.Column;

import java.util.stream.Collectors;

/**
 * PostgreSQL: INSERT ... ON CONFLICT
 */
public class PostgresDialect extends SqlDialect {

    @Override
    protected String typeName(ColumnType type) {
        return switch (type) {
            case BIGINT -> "BIGINT";
            case TEXT -> "TEXT";
            case BOOLEAN -> "BOOLEAN";
            case NUMERIC -> "NUMERIC";
            case TIMESTAMP -> "TIMESTAMP";
            case JSON -> "JSONB";
        };
    }

    @Override
    protected String placeholder(Column column) {
        return column.type() == ColumnType.JSON ? "CAST(? AS JSONB)" : "?";
    }

    @Override
    public String upsertSql(TableSchema table) {
        String updates = table.nonKeyColumns().stream()
                .map(c -> c.name() + " = EXCLUDED." + c.name())
                .collect(Collectors.joining(", "));
        return insertPrefix(table)
                + " ON CONFLICT (" + String.join(", ", table.keyColumns()) + ") DO UPDATE SET " + updates
                + " WHERE " + table.name() + "." + table.versionColumn() + " <= EXCLUDED." + table.versionColumn();
    }

    @Override
    public String insertIgnoreSql(TableSchema table) {
        return insertPrefix(table) + " ON CONFLICT (" + String.join(", ", table.keyColumns()) + ") DO NOTHING";
    }

    private String insertPrefix(TableSchema table) {
        return "INSERT INTO " + table.name() + " (" + columnList(table) + ") VALUES (" + placeholders(table) + ")";
    }
}
