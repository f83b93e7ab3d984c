package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.IndexerException;

/**
 * 写入端暂时性失败 (网络 / 存储抖动)，由协调器按退避策略重试
 */
public class SinkException extends IndexerException {

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
