package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.model.ColumnType;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.TableSchema.Column;

import java.util.stream.Collectors;

/**
 * 标准 SQL MERGE (H2 等)
 */
public class MergeDialect extends SqlDialect {

    @Override
    protected String typeName(ColumnType type) {
        return switch (type) {
            case BIGINT -> "BIGINT";
            case TEXT, JSON -> "VARCHAR";
            case BOOLEAN -> "BOOLEAN";
            case NUMERIC -> "NUMERIC";
            case TIMESTAMP -> "TIMESTAMP";
        };
    }

    /** VALUES 里的参数没有上下文类型，需显式 CAST */
    @Override
    protected String placeholder(Column column) {
        return "CAST(? AS " + typeName(column.type()) + ")";
    }

    @Override
    public String upsertSql(TableSchema table) {
        String updates = table.nonKeyColumns().stream()
                .map(c -> c.name() + " = s." + c.name())
                .collect(Collectors.joining(", "));
        return mergePrefix(table)
                + " WHEN MATCHED AND t." + table.versionColumn() + " <= s." + table.versionColumn()
                + " THEN UPDATE SET " + updates
                + insertClause(table);
    }

    @Override
    public String insertIgnoreSql(TableSchema table) {
        return mergePrefix(table) + insertClause(table);
    }

    private String mergePrefix(TableSchema table) {
        String on = table.keyColumns().stream().map(k -> "t." + k + " = s." + k).collect(Collectors.joining(" AND "));
        return "MERGE INTO " + table.name() + " t USING (VALUES (" + placeholders(table) + ")) AS s ("
                + columnList(table) + ") ON " + on;
    }

    private String insertClause(TableSchema table) {
        String values = table.columnNames().stream().map(c -> "s." + c).collect(Collectors.joining(", "));
        return " WHEN NOT MATCHED THEN INSERT (" + columnList(table) + ") VALUES (" + values + ")";
    }
}
