package com.lhcz.txn2db.checkpoint;

import com.lhcz.txn2db.IndexerException;

public class CheckpointStoreException extends IndexerException {

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
