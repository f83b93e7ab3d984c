package com.lhcz.txn2db.extractor;

import com.lhcz.txn2db.IndexerException;

/**
 * 单笔交易在某个 Extractor 上解析失败
 */
public class ExtractionException extends IndexerException {

    private final long version;
    private final String extractor;

    public ExtractionException(long version, String extractor, Throwable cause) {
        super("交易 " + version + " 在 [" + extractor + "] 抽取失败: " + cause.getMessage(), cause);
        this.version = version;
        this.extractor = extractor;
    }

    public long getVersion() {
        return version;
    }

    public String getExtractor() {
        return extractor;
    }
}
