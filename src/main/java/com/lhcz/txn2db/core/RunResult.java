package com.lhcz.txn2db.core;

/**
 * 一次运行的最终结果
 *
 * @param lastCommittedVersion 已持久化的最后版本，-1 表示从未提交
 * @param error                FAILED 时的原因
 */
public record RunResult(RunStatus status, long lastCommittedVersion, Throwable error) {

    public static final long NONE = -1L;

    public static RunResult success(long lastCommittedVersion) {
        return new RunResult(RunStatus.SUCCESS, lastCommittedVersion, null);
    }

    public static RunResult cancelled(long lastCommittedVersion) {
        return new RunResult(RunStatus.CANCELLED, lastCommittedVersion, null);
    }

    public static RunResult failed(long lastCommittedVersion, Throwable error) {
        return new RunResult(RunStatus.FAILED, lastCommittedVersion, error);
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
