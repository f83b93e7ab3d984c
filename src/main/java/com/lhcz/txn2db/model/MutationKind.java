package com.lhcz.txn2db.model;

/**
 * 记录写入语义
 */
public enum MutationKind {
    /** 只追加，主键冲突视为幂等 no-op */
    INSERT_IMMUTABLE,
    /** 按主键覆盖，版本高者胜出 */
    UPSERT_CURRENT,
    /** 删除标记，同样按版本裁决 */
    DELETE_MARKER
}
