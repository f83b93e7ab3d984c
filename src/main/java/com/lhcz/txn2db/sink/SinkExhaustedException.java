package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.IndexerException;

/**
 * 重试次数耗尽，流水线终止
 */
public class SinkExhaustedException extends IndexerException {

    private final int attempts;

    public SinkExhaustedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
