package com.lhcz.txn2db.config;

import com.lhcz.txn2db.sink.SinkKind;

import java.time.Duration;
import java.util.List;

/**
 * 应用配置记录类 (application.yaml，snake_case)
 */
public record AppConfig(Integer healthCheckPort, ServerConfig serverConfig) {

    public record ServerConfig(
            ProcessorConfig processorConfig,
            TransactionStreamConfig transactionStreamConfig,
            ProcessorModeConfig processorMode,
            DbConfig dbConfig
    ) {}

    public record ProcessorConfig(
            String type,
            Integer channelSize,
            Long maxBufferSize,         // 字节
            Integer uploadInterval,     // 秒
            List<String> tablesToWrite,
            Integer extractionParallelism,
            Boolean failOnExtractionError,
            String deadLetterDir
    ) {
        public int channelSizeOrDefault() {
            return channelSize != null ? channelSize : 100;
        }

        public long maxBufferSizeOrDefault(SinkKind kind) {
            if (maxBufferSize != null) {
                return maxBufferSize;
            }
            return kind == SinkKind.PARQUET ? 100_000_000L : 10_000_000L;
        }

        public Duration uploadIntervalOrDefault(SinkKind kind) {
            if (uploadInterval != null) {
                return Duration.ofSeconds(uploadInterval);
            }
            return kind == SinkKind.PARQUET ? Duration.ofSeconds(600) : Duration.ofSeconds(1);
        }

        public List<String> tablesToWriteOrEmpty() {
            return tablesToWrite != null ? tablesToWrite : List.of();
        }

        public int extractionParallelismOrDefault() {
            return extractionParallelism != null ? extractionParallelism : Runtime.getRuntime().availableProcessors();
        }

        public boolean failOnExtractionErrorOrDefault() {
            return failOnExtractionError != null && failOnExtractionError;
        }

        public String deadLetterDirOrDefault() {
            return deadLetterDir != null ? deadLetterDir : "failed_data";
        }
    }

    public record TransactionStreamConfig(
            String indexerGrpcDataServiceAddress,   // http(s):// 或 file:
            String authToken,
            String requestNameHeader,
            Integer pageSize,
            Integer requestTimeoutSecs,
            Integer maxRetries,
            Long retryDelayMs,
            Long idlePollIntervalMs
    ) {
        public int pageSizeOrDefault() {
            return pageSize != null ? pageSize : 1000;
        }

        public Duration requestTimeoutOrDefault() {
            return Duration.ofSeconds(requestTimeoutSecs != null ? requestTimeoutSecs : 30);
        }

        public int maxRetriesOrDefault() {
            return maxRetries != null ? maxRetries : 5;
        }

        public long retryDelayMsOrDefault() {
            return retryDelayMs != null ? retryDelayMs : 500L;
        }

        public Duration idlePollIntervalOrDefault() {
            return Duration.ofMillis(idlePollIntervalMs != null ? idlePollIntervalMs : 1000L);
        }
    }

    public record ProcessorModeConfig(
            String type,                    // default | backfill
            String backfillAlias,
            Long initialStartingVersion,
            Long endingVersion,
            Boolean overwriteCheckpoint
    ) {}

    public record DbConfig(
            String type,                    // postgres_config | parquet_config
            String connectionString,
            Integer dbPoolSize,
            Integer maxRetries,
            Long retryDelayMs,
            Integer commitTimeoutSecs,
            Boolean autoCreateTables,
            String bucketName,              // 仅 parquet
            String bucketRoot,              // 仅 parquet，本地对象存储根目录
            String checkpointFile,          // 仅 parquet，未配置 connection_string 时使用
            String compression              // 仅 parquet，默认 SNAPPY
    ) {
        public int dbPoolSizeOrDefault() {
            return dbPoolSize != null ? dbPoolSize : 10;
        }

        public int maxRetriesOrDefault() {
            return maxRetries != null ? maxRetries : 5;
        }

        public long retryDelayMsOrDefault() {
            return retryDelayMs != null ? retryDelayMs : 500L;
        }

        public int commitTimeoutSecsOrDefault() {
            return commitTimeoutSecs != null ? commitTimeoutSecs : 30;
        }

        public boolean autoCreateTablesOrDefault() {
            return autoCreateTables == null || autoCreateTables;
        }

        public String checkpointFileOrDefault() {
            return checkpointFile != null ? checkpointFile : "checkpoint.properties";
        }

        public String compressionOrDefault() {
            return compression != null ? compression : "SNAPPY";
        }
    }
}
