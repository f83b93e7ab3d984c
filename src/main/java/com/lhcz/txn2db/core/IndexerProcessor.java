package com.lhcz.txn2db.core;

import com.lhcz.txn2db.checkpoint.CheckpointStore;
import com.lhcz.txn2db.checkpoint.FileCheckpointStore;
import com.lhcz.txn2db.checkpoint.JdbcCheckpointStore;
import com.lhcz.txn2db.config.AppConfig;
import com.lhcz.txn2db.config.ConfigLoader;
import com.lhcz.txn2db.config.JdbcTarget;
import com.lhcz.txn2db.extractor.ExtractionEngine;
import com.lhcz.txn2db.extractor.ProcessorType;
import com.lhcz.txn2db.model.ProcessorRunSpec;
import com.lhcz.txn2db.sink.JdbcSink;
import com.lhcz.txn2db.sink.LocalObjectStore;
import com.lhcz.txn2db.sink.ParquetSink;
import com.lhcz.txn2db.sink.Sink;
import com.lhcz.txn2db.sink.SinkKind;
import com.lhcz.txn2db.sink.SqlDialect;
import com.lhcz.txn2db.source.HttpTransactionSource;
import com.lhcz.txn2db.source.JsonLinesTransactionSource;
import com.lhcz.txn2db.source.TransactionSource;
import com.lhcz.txn2db.util.RetryPolicy;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * 按配置组装一个处理器：数据源、抽取引擎、写入端、进度存储、状态接口
 */
public class IndexerProcessor implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(IndexerProcessor.class);

    private final AppConfig config;
    private final ProcessorType processorType;
    private final ProcessorRunSpec runSpec;

    private HikariDataSource dataSource;
    private TransactionSource source;
    private Sink sink;
    private Pipeline pipeline;
    private WebConsole webConsole;

    public IndexerProcessor(AppConfig config) {
        this.config = config;
        this.processorType = ProcessorType.fromConfig(config.serverConfig().processorConfig().type());
        this.runSpec = ConfigLoader.toRunSpec(config);
    }

    /**
     * 创建各组件；auto_create_tables 时建表
     */
    public IndexerProcessor build() {
        AppConfig.ServerConfig server = config.serverConfig();
        AppConfig.ProcessorConfig processorConfig = server.processorConfig();
        AppConfig.DbConfig db = server.dbConfig();
        SinkKind kind = processorType.sinkKind();

        DeadLetterQueueManager deadLetters = new DeadLetterQueueManager(Path.of(processorConfig.deadLetterDirOrDefault()));
        ExtractionEngine engine = new ExtractionEngine(runSpec.processorName(), processorType.createExtractors(),
                new HashSet<>(processorConfig.tablesToWriteOrEmpty()), processorConfig.failOnExtractionErrorOrDefault(),
                deadLetters);

        CheckpointStore checkpointStore;
        if (kind == SinkKind.POSTGRES) {
            JdbcTarget target = ConfigLoader.toJdbc(db.connectionString());
            dataSource = createDataSource(target, db);
            SqlDialect dialect = SqlDialect.forJdbcUrl(target.url());
            JdbcCheckpointStore jdbcCheckpoints = new JdbcCheckpointStore(dataSource, dialect);
            checkpointStore = jdbcCheckpoints;
            sink = new JdbcSink(dataSource, dialect, jdbcCheckpoints, db.commitTimeoutSecsOrDefault());
        } else {
            if (db.connectionString() != null && !db.connectionString().isBlank()) {
                JdbcTarget target = ConfigLoader.toJdbc(db.connectionString());
                dataSource = createDataSource(target, db);
                JdbcCheckpointStore jdbcCheckpoints = new JdbcCheckpointStore(dataSource, SqlDialect.forJdbcUrl(target.url()));
                if (db.autoCreateTablesOrDefault()) {
                    jdbcCheckpoints.createTables();
                }
                checkpointStore = jdbcCheckpoints;
            } else {
                checkpointStore = new FileCheckpointStore(Path.of(db.checkpointFileOrDefault()));
            }
            CompressionCodecName codec = CompressionCodecName.valueOf(db.compressionOrDefault().toUpperCase(Locale.ROOT));
            sink = new ParquetSink(new LocalObjectStore(Path.of(db.bucketRoot())), db.bucketName(), checkpointStore, codec);
        }

        if (db.autoCreateTablesOrDefault() || kind == SinkKind.PARQUET) {
            sink.initialize(engine.tables());
        }

        source = createSource(server.transactionStreamConfig());

        AppConfig.TransactionStreamConfig stream = server.transactionStreamConfig();
        PipelineSettings settings = PipelineSettings.builder()
                .channelSize(processorConfig.channelSizeOrDefault())
                .extractionParallelism(processorConfig.extractionParallelismOrDefault())
                .maxBufferBytes(processorConfig.maxBufferSizeOrDefault(kind))
                .uploadInterval(processorConfig.uploadIntervalOrDefault(kind))
                .sourceRetry(RetryPolicy.of(stream.retryDelayMsOrDefault(), stream.maxRetriesOrDefault()))
                .sinkRetry(RetryPolicy.of(db.retryDelayMsOrDefault(), db.maxRetriesOrDefault()))
                .idlePollInterval(stream.idlePollIntervalOrDefault())
                .build();
        pipeline = new Pipeline(runSpec, source, engine, sink, checkpointStore, settings);

        List<String> tables = engine.tables().stream().map(t -> t.name()).toList();
        log.info("处理器 [{}] 已就绪: sink={} tables={} channel_size={} parallelism={}", runSpec.runName(), kind,
                tables, settings.channelSize(), settings.extractionParallelism());

        if (config.healthCheckPort() != null) {
            webConsole = new WebConsole(config.healthCheckPort(), pipeline);
            webConsole.start();
        }
        return this;
    }

    public RunResult run() {
        if (pipeline == null) {
            build();
        }
        return pipeline.run();
    }

    public void stop() {
        if (pipeline != null) {
            pipeline.stop();
        }
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public WebConsole getWebConsole() {
        return webConsole;
    }

    @Override
    public void close() throws IOException {
        if (webConsole != null) {
            webConsole.stop();
        }
        if (sink != null) {
            sink.close();
        }
        if (source != null) {
            source.close();
        }
        if (dataSource != null) {
            dataSource.close();
        }
    }

    static TransactionSource createSource(AppConfig.TransactionStreamConfig stream) {
        String address = stream.indexerGrpcDataServiceAddress();
        if (address.startsWith("file:")) {
            return new JsonLinesTransactionSource(Path.of(address.substring("file:".length())));
        }
        if (address.startsWith("http://") || address.startsWith("https://")) {
            return new HttpTransactionSource(address, stream.authToken(), stream.requestNameHeader(),
                    stream.pageSizeOrDefault(), stream.requestTimeoutOrDefault());
        }
        throw new IllegalArgumentException("不支持的交易流地址: " + address);
    }

    private static HikariDataSource createDataSource(JdbcTarget target, AppConfig.DbConfig db) {
        log.info("正在初始化数据库连接池 (HikariCP): {}", target);
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(target.url());
        if (target.user() != null) {
            hikariConfig.setUsername(target.user());
        }
        if (target.password() != null) {
            hikariConfig.setPassword(target.password());
        }
        hikariConfig.setPoolName("txn2db-pool");
        hikariConfig.setMaximumPoolSize(db.dbPoolSizeOrDefault());
        hikariConfig.setMinimumIdle(Math.min(2, db.dbPoolSizeOrDefault()));
        hikariConfig.setMaxLifetime(600_000L);
        hikariConfig.setIdleTimeout(300_000L);

        if (target.url().startsWith("jdbc:postgresql:")) {
            // 开启 TCP KeepAlive 防止防火墙静默切断连接
            hikariConfig.addDataSourceProperty("socketTimeout", String.valueOf(db.commitTimeoutSecsOrDefault() + 30));
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }
        log.info("连接池配置: PoolSize={}", db.dbPoolSizeOrDefault());
        return new HikariDataSource(hikariConfig);
    }
}
