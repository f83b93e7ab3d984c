package com.lhcz.txn2db;

/**
 * 索引流水线异常基类 (非受检)
 */
public class IndexerException extends RuntimeException {

    public IndexerException(String message) {
        super(message);
    }

    public IndexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
