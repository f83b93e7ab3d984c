package com.lhcz.txn2db.model;

public enum ColumnType {
    BIGINT,
    TEXT,
    BOOLEAN,
    NUMERIC,
    TIMESTAMP,
    JSON
}
