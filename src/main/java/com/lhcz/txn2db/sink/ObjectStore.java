package com.lhcz.txn2db.sink;

import java.io.IOException;
import java.util.List;

/**
 * 对象存储 (key 用 / 分隔)
 */
public interface ObjectStore {

    /**
     * 整体写入；对象要么完整可见，要么不存在
     */
    void put(String key, byte[] content) throws IOException;

    byte[] get(String key) throws IOException;

    /**
     * 列出以 prefix 开头的全部 key
     */
    List<String> list(String prefix) throws IOException;

    void delete(String key) throws IOException;
}
