package com.lhcz.txn2db.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 目标表定义：列、主键、版本列
 *
 * @param name          表名
 * @param columns       全部列 (有序)
 * @param keyColumns    逻辑主键
 * @param versionColumn 记录来源交易版本的列，用于 upsert/delete 的版本裁决
 * @param current       true = 可变的"当前状态"表，false = 只追加表
 */
public record TableSchema(String name, List<Column> columns, List<String> keyColumns, String versionColumn, boolean current) {

    public record Column(String name, ColumnType type, boolean nullable) {}

    public TableSchema {
        Objects.requireNonNull(name, "name");
        columns = List.copyOf(columns);
        keyColumns = List.copyOf(keyColumns);
        if (keyColumns.isEmpty()) {
            throw new IllegalArgumentException("表 " + name + " 未定义主键");
        }
        for (String key : keyColumns) {
            if (columns.stream().noneMatch(c -> c.name().equals(key))) {
                throw new IllegalArgumentException("主键列不存在: " + name + "." + key);
            }
        }
        if (columns.stream().noneMatch(c -> c.name().equals(versionColumn))) {
            throw new IllegalArgumentException("版本列不存在: " + name + "." + versionColumn);
        }
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public List<Column> nonKeyColumns() {
        return columns.stream().filter(c -> !keyColumns.contains(c.name())).toList();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<Column> columns = new ArrayList<>();
        private final List<String> keys = new ArrayList<>();
        private String versionColumn;
        private boolean current;

        private Builder(String name) {
            this.name = name;
        }

        /** 主键列 (非空) */
        public Builder key(String column, ColumnType type) {
            columns.add(new Column(column, type, false));
            keys.add(column);
            return this;
        }

        public Builder column(String column, ColumnType type) {
            columns.add(new Column(column, type, false));
            return this;
        }

        public Builder nullable(String column, ColumnType type) {
            columns.add(new Column(column, type, true));
            return this;
        }

        public Builder version(String column) {
            this.versionColumn = column;
            return this;
        }

        public Builder current() {
            this.current = true;
            return this;
        }

        public TableSchema build() {
            return new TableSchema(name, columns, keys, versionColumn, current);
        }
    }
}
