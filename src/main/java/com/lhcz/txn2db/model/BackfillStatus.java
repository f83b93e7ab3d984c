package com.lhcz.txn2db.model;

public enum BackfillStatus {
    IN_PROGRESS,
    COMPLETE
}
