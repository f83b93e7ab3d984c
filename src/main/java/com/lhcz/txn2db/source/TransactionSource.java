package com.lhcz.txn2db.source;

import java.io.Closeable;
import java.io.IOException;
import java.util.OptionalLong;

/**
 * 有序、无间隙、可续传的交易来源
 * <p>
 * 传输中断时 {@link TransactionStream#next()} 抛出 IOException，调用方从下一个未消费版本重新 fetch 即可。
 */
public interface TransactionSource extends Closeable {

    /**
     * @param startingVersion 第一笔需要的版本
     * @param endingVersion   最后一笔需要的版本 (含)，null 表示不设上限
     * @throws RangeUnavailableException 请求区间已被裁剪或超出链头
     */
    TransactionStream fetch(long startingVersion, Long endingVersion) throws IOException;

    /**
     * 来源所在链的 chain id，未知时返回 empty
     */
    default OptionalLong chainId() throws IOException {
        return OptionalLong.empty();
    }

    @Override
    default void close() throws IOException {
    }
}
