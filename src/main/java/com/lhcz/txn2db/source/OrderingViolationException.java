package com.lhcz.txn2db.source;

import com.lhcz.txn2db.IndexerException;

/**
 * 收到的版本与期望不符 (乱序或有间隙)，说明上游数据损坏
 */
public class OrderingViolationException extends IndexerException {

    private final long expectedVersion;
    private final long actualVersion;

    public OrderingViolationException(long expectedVersion, long actualVersion) {
        super("版本顺序错误: 期望 " + expectedVersion + "，实际收到 " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
