package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.model.Batch;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;
import com.lhcz.txn2db.model.TableSchema;

import java.io.Closeable;
import java.util.List;

/**
 * 批次写入端
 * <p>
 * commit 必须保证：数据全部落地之后才推进 checkpoint；失败时不留下半个批次
 * (关系库靠单事务，文件存储靠 {@link #recover} 清理孤儿文件)。
 */
public interface Sink extends Closeable {

    /**
     * 启动时准备目标表 (auto_create_tables)
     */
    void initialize(List<TableSchema> tables);

    /**
     * 启动时根据已提交进度清理上次崩溃残留，默认无需处理
     */
    default void recover(CheckpointKey key, long lastCommittedVersion) {
    }

    /**
     * @throws SinkException 可重试的写入失败
     */
    void commit(Batch batch, Checkpoint checkpoint);

    @Override
    default void close() {
    }
}
