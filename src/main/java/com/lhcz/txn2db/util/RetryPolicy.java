package com.lhcz.txn2db.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避 + 抖动
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxRetries) {
        if (baseDelayMs < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("baseDelayMs / maxRetries 不能为负");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxRetries = maxRetries;
    }

    /**
     * 第 attempt 次重试 (从 0 开始) 前的等待时间: baseDelay * 2^attempt，再加抖动
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public static RetryPolicy of(long baseDelayMs, int maxRetries) {
        return new RetryPolicy(baseDelayMs, 0.2, maxRetries);
    }

    /**
     * 默认: 500ms 起步，±20% 抖动，最多重试 5 次
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 5);
    }
}
