package com.lhcz.txn2db.source;

import com.lhcz.txn2db.model.Transaction;

import java.io.Closeable;
import java.io.IOException;

public interface TransactionStream extends Closeable {

    /**
     * 下一笔交易；流结束 (已追上链头或到达 endingVersion) 返回 null
     */
    Transaction next() throws IOException;
}
