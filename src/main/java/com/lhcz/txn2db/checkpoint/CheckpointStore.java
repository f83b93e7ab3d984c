package com.lhcz.txn2db.checkpoint;

import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * 进度存储
 * <p>
 * 主流程与回填按 {@link CheckpointKey} 分开存放；lastSuccessVersion 只进不退。
 */
public interface CheckpointStore {

    Optional<Checkpoint> read(CheckpointKey key);

    /**
     * 写入进度。若已存储的版本更大则忽略本次写入
     */
    void save(Checkpoint checkpoint);

    /**
     * 删除进度 (overwrite_checkpoint)
     */
    void clear(CheckpointKey key);

    /**
     * 已记录的链 ID，首次运行时为空
     */
    OptionalLong chainId();

    void saveChainId(long chainId);
}
