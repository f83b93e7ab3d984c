package com.lhcz.txn2db.source;

import com.lhcz.txn2db.IndexerException;

/**
 * 请求区间无法提供 (已裁剪 / 超出链头)，需要人工介入
 */
public class RangeUnavailableException extends IndexerException {

    public RangeUnavailableException(String message) {
        super(message);
    }
}
