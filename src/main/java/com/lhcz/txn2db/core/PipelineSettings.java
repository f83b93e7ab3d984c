package com.lhcz.txn2db.core;

import com.lhcz.txn2db.util.RetryPolicy;

import java.time.Clock;
import java.time.Duration;

/**
 * 流水线运行参数
 *
 * @param channelSize           阶段间通道容量，同时也是在途交易上限
 * @param extractionParallelism 抽取线程数
 * @param maxBufferBytes        批次字节阈值
 * @param uploadInterval        批次时间阈值
 * @param sourceRetry           交易流断线重试
 * @param sinkRetry             写入失败重试
 * @param idlePollInterval      追上链头后的轮询间隔
 */
public record PipelineSettings(int channelSize,
                               int extractionParallelism,
                               long maxBufferBytes,
                               Duration uploadInterval,
                               RetryPolicy sourceRetry,
                               RetryPolicy sinkRetry,
                               Duration idlePollInterval,
                               Clock clock) {

    public PipelineSettings {
        if (channelSize <= 0) {
            throw new IllegalArgumentException("channel_size 必须为正数");
        }
        if (extractionParallelism <= 0) {
            throw new IllegalArgumentException("extraction_parallelism 必须为正数");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int channelSize = 100;
        private int extractionParallelism = Runtime.getRuntime().availableProcessors();
        private long maxBufferBytes = 10_000_000L;
        private Duration uploadInterval = Duration.ofSeconds(1);
        private RetryPolicy sourceRetry = RetryPolicy.defaultPolicy();
        private RetryPolicy sinkRetry = RetryPolicy.defaultPolicy();
        private Duration idlePollInterval = Duration.ofSeconds(1);
        private Clock clock = Clock.systemUTC();

        public Builder channelSize(int channelSize) {
            this.channelSize = channelSize;
            return this;
        }

        public Builder extractionParallelism(int extractionParallelism) {
            this.extractionParallelism = extractionParallelism;
            return this;
        }

        public Builder maxBufferBytes(long maxBufferBytes) {
            this.maxBufferBytes = maxBufferBytes;
            return this;
        }

        public Builder uploadInterval(Duration uploadInterval) {
            this.uploadInterval = uploadInterval;
            return this;
        }

        public Builder sourceRetry(RetryPolicy sourceRetry) {
            this.sourceRetry = sourceRetry;
            return this;
        }

        public Builder sinkRetry(RetryPolicy sinkRetry) {
            this.sinkRetry = sinkRetry;
            return this;
        }

        public Builder idlePollInterval(Duration idlePollInterval) {
            this.idlePollInterval = idlePollInterval;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PipelineSettings build() {
            return new PipelineSettings(channelSize, extractionParallelism, maxBufferBytes, uploadInterval,
                    sourceRetry, sinkRetry, idlePollInterval, clock);
        }
    }
}
