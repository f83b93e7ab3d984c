package com.lhcz.txn2db.core;

public enum RunStatus {
    SUCCESS,
    FAILED,
    CANCELLED
}
