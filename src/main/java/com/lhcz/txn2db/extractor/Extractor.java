package com.lhcz.txn2db.extractor;

import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.Transaction;

import java.util.List;

/**
 * 单表 (或一组相关表) 的抽取逻辑，必须无状态、无副作用，可被多个线程并发调用
 */
public interface Extractor {

    String name();

    /** 该 Extractor 可能产出的表 */
    List<TableSchema> tables();

    /**
     * 负载格式错误时直接抛出运行时异常，由 {@link ExtractionEngine} 按策略处理
     */
    List<ExtractedRecord> extract(Transaction transaction);
}
