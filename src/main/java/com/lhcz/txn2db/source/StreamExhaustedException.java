package com.lhcz.txn2db.source;

import com.lhcz.txn2db.IndexerException;

/**
 * 交易流连续失败次数超过上限
 */
public class StreamExhaustedException extends IndexerException {

    public StreamExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
