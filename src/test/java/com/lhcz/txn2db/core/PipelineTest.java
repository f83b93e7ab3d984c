package com.lhcz.txn2db.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lhcz.txn2db.extractor.ExtractionEngine;
import com.lhcz.txn2db.extractor.ExtractionException;
import com.lhcz.txn2db.extractor.Extractor;
import com.lhcz.txn2db.model.BackfillStatus;
import com.lhcz.txn2db.model.Batch;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;
import com.lhcz.txn2db.model.ProcessorRunSpec;
import com.lhcz.txn2db.model.RunMode;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.sink.SinkExhaustedException;
import com.lhcz.txn2db.source.JsonLinesTransactionSource;
import com.lhcz.txn2db.source.OrderingViolationException;
import com.lhcz.txn2db.source.RangeUnavailableException;
import com.lhcz.txn2db.source.StreamExhaustedException;
import com.lhcz.txn2db.support.BalanceExtractor;
import com.lhcz.txn2db.support.InMemoryCheckpointStore;
import com.lhcz.txn2db.support.InMemoryTransactionSource;
import com.lhcz.txn2db.support.MutableClock;
import com.lhcz.txn2db.support.RecordingSink;
import com.lhcz.txn2db.support.TestTransactions;
import com.lhcz.txn2db.support.Waits;
import com.lhcz.txn2db.util.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineTest {

    private static final String PROCESSOR = "test_processor";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private InMemoryCheckpointStore store;
    private RecordingSink sink;
    private MutableClock clock;
    private ExtractionEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore();
        sink = new RecordingSink(store);
        clock = new MutableClock(T0);
    }

    private PipelineSettings.Builder settings() {
        return PipelineSettings.builder()
                .channelSize(10)
                .extractionParallelism(2)
                .maxBufferBytes(1_000_000)
                .uploadInterval(Duration.ofHours(1))
                .sourceRetry(new RetryPolicy(1, 0, 3))
                .sinkRetry(new RetryPolicy(1, 0, 3))
                .idlePollInterval(Duration.ofMillis(10))
                .clock(clock);
    }

    private Pipeline pipeline(ProcessorRunSpec spec, InMemoryTransactionSource source, PipelineSettings settings) {
        return pipeline(spec, source, new BalanceExtractor(), false, settings);
    }

    private Pipeline pipeline(ProcessorRunSpec spec, InMemoryTransactionSource source, Extractor extractor,
                              boolean failOnError, PipelineSettings settings) {
        engine = new ExtractionEngine(PROCESSOR, List.of(extractor), Set.of(), failOnError,
                new DeadLetterQueueManager(tempDir.resolve("failed")));
        return new Pipeline(spec, source, engine, sink, store, settings);
    }

    private static ProcessorRunSpec bounded(long start, long end) {
        return new ProcessorRunSpec(PROCESSOR, RunMode.TAILING, start, end, false, null);
    }

    private long tailingCheckpoint() {
        return store.read(CheckpointKey.tailing(PROCESSOR)).map(Checkpoint::lastSuccessVersion).orElse(-1L);
    }

    private static void assertContiguous(List<Batch> batches, long first, long last) {
        assertThat(batches).isNotEmpty();
        assertThat(batches.get(0).startVersion()).isEqualTo(first);
        for (int i = 1; i < batches.size(); i++) {
            assertThat(batches.get(i).startVersion()).isEqualTo(batches.get(i - 1).endVersion() + 1);
        }
        assertThat(batches.get(batches.size() - 1).endVersion()).isEqualTo(last);
    }

    @Test
    @DisplayName("三笔交易在时间阈值到达后合并为一个批次 [10,12]")
    void flushesSingleBatchAfterUploadInterval() throws Exception {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 12));
        Pipeline pipeline = pipeline(ProcessorRunSpec.tailing(PROCESSOR, 10), source,
                settings().uploadInterval(Duration.ofSeconds(1)).build());

        CompletableFuture<RunResult> run = CompletableFuture.supplyAsync(pipeline::run);
        Waits.until(() -> source.deliveredCount() == 3 && pipeline.getInFlight() == 0, Duration.ofSeconds(5));
        Thread.sleep(200);
        assertThat(sink.batches()).isEmpty();

        clock.advance(Duration.ofSeconds(2));
        Waits.until(() -> sink.batches().size() == 1, Duration.ofSeconds(5));
        pipeline.stop();
        RunResult result = run.get(10, TimeUnit.SECONDS);

        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(sink.batches()).hasSize(1);
        Batch batch = sink.batches().get(0);
        assertThat(batch.startVersion()).isEqualTo(10);
        assertThat(batch.endVersion()).isEqualTo(12);
        assertThat(batch.recordsByTable().get("balances")).hasSize(3);
        assertThat(tailingCheckpoint()).isEqualTo(12);
        assertThat(result.lastCommittedVersion()).isEqualTo(12);
    }

    @Test
    @DisplayName("按字节阈值切批，批次区间连续无重叠")
    void batchesAreContiguous() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 49));
        Pipeline pipeline = pipeline(bounded(0, 49), source, settings().maxBufferBytes(200).build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(sink.batches().size()).isGreaterThan(1);
        assertContiguous(sink.batches(), 0, 49);
        assertThat(tailingCheckpoint()).isEqualTo(49);
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
    }

    @Test
    @DisplayName("并行抽取时仍按版本顺序进入累加器")
    void parallelExtractionPreservesOrder() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 199));
        Pipeline pipeline = pipeline(bounded(0, 199), source, new BalanceExtractor(Set.of(), 5, 3), false,
                settings().extractionParallelism(8).maxBufferBytes(500).build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 0, 199);
        assertThat(sink.rowCount("balances")).isEqualTo(5);
        assertThat(sink.rows("balances").values())
                .allSatisfy(r -> assertThat(r.version()).isGreaterThanOrEqualTo(195));
    }

    @Test
    @DisplayName("写入失败两次后第三次成功，进度正常推进且无重复行")
    void retriesTransientSinkFailures() {
        sink.failNext(2);
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 12));
        Pipeline pipeline = pipeline(bounded(10, 12), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(sink.attempts()).isEqualTo(3);
        assertThat(sink.batches()).hasSize(1);
        assertThat(sink.rowCount("balances")).isEqualTo(3);
        assertThat(tailingCheckpoint()).isEqualTo(12);
    }

    @Test
    @DisplayName("重试耗尽后 FAILED，进度不变")
    void failsWhenSinkRetriesExhausted() {
        sink.alwaysFail();
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 12));
        Pipeline pipeline = pipeline(bounded(10, 12), source, settings().sinkRetry(new RetryPolicy(1, 0, 2)).build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(SinkExhaustedException.class);
        assertThat(((SinkExhaustedException) result.error()).getAttempts()).isEqualTo(3);
        assertThat(sink.attempts()).isEqualTo(3);
        assertThat(result.lastCommittedVersion()).isEqualTo(RunResult.NONE);
        assertThat(store.read(CheckpointKey.tailing(PROCESSOR))).isEmpty();
    }

    @Test
    @DisplayName("回填 [100,200] 只提交该区间，不影响主流程进度")
    void backfillCommitsExactRange() {
        store.save(Checkpoint.tailing(PROCESSOR, 250, null, T0));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 300));
        ProcessorRunSpec spec = ProcessorRunSpec.backfill(PROCESSOR, "bf", 100, 200L, false);
        Pipeline pipeline = pipeline(spec, source, settings().maxBufferBytes(500).build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 100, 200);
        assertThat(sink.batches().stream().mapToLong(Batch::transactionCount).sum()).isEqualTo(101);
        assertThat(source.fetches()).allSatisfy(f -> assertThat(f[1]).isEqualTo(200));

        Checkpoint backfill = store.read(CheckpointKey.backfill("bf")).orElseThrow();
        assertThat(backfill.lastSuccessVersion()).isEqualTo(200);
        assertThat(backfill.backfillStatus()).isEqualTo(BackfillStatus.COMPLETE);
        assertThat(backfill.backfillStartVersion()).isEqualTo(100);
        assertThat(backfill.backfillEndVersion()).isEqualTo(200);
        assertThat(tailingCheckpoint()).isEqualTo(250);

        List<Checkpoint> backfillHistory = new ArrayList<>();
        store.history().stream().filter(c -> c.key().isBackfill()).forEach(backfillHistory::add);
        assertThat(backfillHistory.subList(0, backfillHistory.size() - 1))
                .allSatisfy(c -> assertThat(c.backfillStatus()).isEqualTo(BackfillStatus.IN_PROGRESS));
    }

    @Test
    @DisplayName("主流程结束时经 FLUSHING 直接 STOPPED，DRAINING 只出现在回填")
    void drainingStateIsBackfillOnly() {
        Pipeline tailing = pipeline(bounded(10, 12), new InMemoryTransactionSource(TestTransactions.range(10, 12)),
                settings().build());
        assertThat(tailing.run().status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(tailing.getStateHistory())
                .containsExactly(PipelineState.INITIALIZING, PipelineState.STREAMING, PipelineState.FLUSHING,
                        PipelineState.STOPPED)
                .doesNotContain(PipelineState.DRAINING);

        Pipeline backfill = pipeline(ProcessorRunSpec.backfill(PROCESSOR, "bf", 10, 12L, false),
                new InMemoryTransactionSource(TestTransactions.range(10, 12)), settings().build());
        assertThat(backfill.run().status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(backfill.getStateHistory())
                .containsSubsequence(PipelineState.BACKFILLING, PipelineState.DRAINING, PipelineState.STOPPED)
                .doesNotContain(PipelineState.STREAMING);
    }

    @Test
    @DisplayName("已完成的回填直接返回 SUCCESS，不再拉取")
    void completedBackfillIsNoop() {
        store.save(Checkpoint.backfill("bf", 200, null, T0, BackfillStatus.COMPLETE, 100, 200));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 300));
        Pipeline pipeline = pipeline(ProcessorRunSpec.backfill(PROCESSOR, "bf", 100, 200L, false), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(result.lastCommittedVersion()).isEqualTo(200);
        assertThat(source.fetchCount()).isZero();
        assertThat(sink.batches()).isEmpty();
    }

    @Test
    @DisplayName("未完成的回填从 last_success_version + 1 继续")
    void resumesInProgressBackfill() {
        store.save(Checkpoint.backfill("bf", 150, null, T0, BackfillStatus.IN_PROGRESS, 100, 200));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 300));
        Pipeline pipeline = pipeline(ProcessorRunSpec.backfill(PROCESSOR, "bf", 100, 200L, false), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 151, 200);
        Checkpoint backfill = store.read(CheckpointKey.backfill("bf")).orElseThrow();
        assertThat(backfill.isComplete()).isTrue();
        assertThat(backfill.backfillStartVersion()).isEqualTo(100);
    }

    @Test
    @DisplayName("回填未配置结束版本时以主流程进度为终点")
    void backfillEndsAtTailingCheckpoint() {
        store.save(Checkpoint.tailing(PROCESSOR, 40, null, T0));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 100));
        Pipeline pipeline = pipeline(ProcessorRunSpec.backfill(PROCESSOR, "bf", 10, null, false), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 10, 40);
        assertThat(store.read(CheckpointKey.backfill("bf")).orElseThrow().isComplete()).isTrue();
    }

    @Test
    @DisplayName("回填未配置结束版本且主流程无进度时初始化失败")
    void backfillWithoutEndFailsWithoutTailingCheckpoint() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 100));
        Pipeline pipeline = pipeline(ProcessorRunSpec.backfill(PROCESSOR, "bf", 10, null, false), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(IllegalStateException.class);
        assertThat(source.fetchCount()).isZero();
    }

    @Test
    @DisplayName("版本跳号视为上游数据损坏，已缓冲的连续部分照常提交")
    void orderingViolationIsFatal() {
        List<Transaction> txns = new ArrayList<>(TestTransactions.range(10, 11));
        txns.add(TestTransactions.txn(13));
        InMemoryTransactionSource source = new InMemoryTransactionSource(txns);
        Pipeline pipeline = pipeline(bounded(10, 13), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(OrderingViolationException.class);
        OrderingViolationException error = (OrderingViolationException) result.error();
        assertThat(error.getExpectedVersion()).isEqualTo(12);
        assertThat(error.getActualVersion()).isEqualTo(13);
        assertThat(result.lastCommittedVersion()).isEqualTo(11);
        assertThat(tailingCheckpoint()).isEqualTo(11);
    }

    @Test
    @DisplayName("抽取失败默认跳过：记入补录目录，版本照常推进")
    void skipsExtractionFailureByDefault() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 12));
        Pipeline pipeline = pipeline(bounded(10, 12), source, new BalanceExtractor(Set.of(11L), 1000, 0), false,
                settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(tailingCheckpoint()).isEqualTo(12);
        assertThat(sink.rowCount("balances")).isEqualTo(2);
        assertThat(engine.skippedCount()).isEqualTo(1);
        assertThat(pipeline.getSkippedTransactions()).isEqualTo(1);
        assertThat(Files.exists(tempDir.resolve("failed").resolve("failed_test_processor_11_BalanceExtractor.json"))).isTrue();
    }

    @Test
    @DisplayName("fail_on_extraction_error=true 时抽取失败终止流水线")
    void extractionFailureIsFatalWhenConfigured() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 12));
        Pipeline pipeline = pipeline(bounded(10, 12), source, new BalanceExtractor(Set.of(11L), 1000, 0), true,
                settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(ExtractionException.class);
        assertThat(((ExtractionException) result.error()).getVersion()).isEqualTo(11);
        assertThat(tailingCheckpoint()).isEqualTo(10);
    }

    private Path transactionFileWithBadTimestamp(long badVersion) throws Exception {
        List<String> lines = new ArrayList<>();
        for (long v = 0; v <= 4; v++) {
            ObjectNode node = TestTransactions.json(v);
            if (v == badVersion) {
                node.put("timestamp", "not-a-number");
            }
            lines.add(node.toString());
        }
        Path file = tempDir.resolve("txns.jsonl");
        Files.write(file, lines);
        return file;
    }

    private Pipeline filePipeline(Path file, boolean failOnError) {
        engine = new ExtractionEngine(PROCESSOR, List.of(new BalanceExtractor()), Set.of(), failOnError,
                new DeadLetterQueueManager(tempDir.resolve("failed")));
        return new Pipeline(bounded(0, 4), new JsonLinesTransactionSource(file), engine, sink, store, settings().build());
    }

    @Test
    @DisplayName("时间戳无法解码的交易按抽取失败跳过，不当作断线重试")
    void undecodableTransactionIsSkippedByDefault() throws Exception {
        Pipeline pipeline = filePipeline(transactionFileWithBadTimestamp(2), false);

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(result.lastCommittedVersion()).isEqualTo(4);
        assertThat(tailingCheckpoint()).isEqualTo(4);
        assertThat(sink.rowCount("balances")).isEqualTo(4);
        assertThat(pipeline.getSkippedTransactions()).isEqualTo(1);
        assertContiguous(sink.batches(), 0, 4);
        assertThat(Files.exists(tempDir.resolve("failed")
                .resolve("failed_test_processor_2_" + ExtractionEngine.DECODER + ".json"))).isTrue();
    }

    @Test
    @DisplayName("时间戳无法解码且配置为致命时以 ExtractionException 终止，之前的版本已提交")
    void undecodableTransactionIsFatalWhenConfigured() throws Exception {
        Pipeline pipeline = filePipeline(transactionFileWithBadTimestamp(2), true);

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(ExtractionException.class);
        ExtractionException error = (ExtractionException) result.error();
        assertThat(error.getVersion()).isEqualTo(2);
        assertThat(error.getExtractor()).isEqualTo(ExtractionEngine.DECODER);
        assertThat(tailingCheckpoint()).isEqualTo(1);
    }

    @Test
    @DisplayName("写入端变慢时在途交易数不超过 channel_size")
    void backpressureBoundsInFlightTransactions() {
        sink.commitDelayMs(5);
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 99));
        Pipeline pipeline = pipeline(bounded(0, 99), source, settings().channelSize(4).maxBufferBytes(1).build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(pipeline.getMaxInFlight()).isBetween(1L, 4L);
        assertThat(tailingCheckpoint()).isEqualTo(99);
    }

    @Test
    @DisplayName("从已有进度继续：起点为 max(checkpoint + 1, starting_version)")
    void resumesFromCheckpoint() {
        store.save(Checkpoint.tailing(PROCESSOR, 20, null, T0));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 30));
        Pipeline pipeline = pipeline(bounded(0, 30), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 21, 30);
        assertThat(sink.recoveredAt()).containsExactly(20L);
    }

    @Test
    @DisplayName("starting_version 大于进度时以 starting_version 为准")
    void startingVersionWinsWhenAheadOfCheckpoint() {
        store.save(Checkpoint.tailing(PROCESSOR, 20, null, T0));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 30));
        Pipeline pipeline = pipeline(bounded(25, 30), source, settings().build());

        pipeline.run();

        assertContiguous(sink.batches(), 25, 30);
    }

    @Test
    @DisplayName("overwrite_checkpoint 丢弃已有进度，从 starting_version 重跑")
    void overwriteCheckpointRestartsFromStartingVersion() {
        store.save(Checkpoint.tailing(PROCESSOR, 20, null, T0));
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 30));
        ProcessorRunSpec spec = new ProcessorRunSpec(PROCESSOR, RunMode.TAILING, 5, 30L, true, null);
        Pipeline pipeline = pipeline(spec, source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 5, 30);
        assertThat(tailingCheckpoint()).isEqualTo(30);
    }

    @Test
    @DisplayName("写入后崩溃再重放，结果与一次性跑完相同")
    void replayAfterCrashIsIdempotent() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 20));
        BalanceExtractor extractor = new BalanceExtractor(Set.of(), 3, 0);
        PipelineSettings settings = settings().maxBufferBytes(1).sinkRetry(new RetryPolicy(1, 0, 0)).build();

        sink.applyThenFailOnCommit(4);
        RunResult first = pipeline(bounded(10, 20), source, extractor, false, settings).run();
        assertThat(first.status()).isEqualTo(RunStatus.FAILED);
        assertThat(tailingCheckpoint()).isEqualTo(12);

        RunResult second = pipeline(bounded(10, 20), source, extractor, false, settings).run();
        assertThat(second.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(tailingCheckpoint()).isEqualTo(20);

        InMemoryCheckpointStore cleanStore = new InMemoryCheckpointStore();
        RecordingSink clean = new RecordingSink(cleanStore);
        engine = new ExtractionEngine(PROCESSOR, List.of(extractor), Set.of(), false,
                new DeadLetterQueueManager(tempDir.resolve("failed")));
        new Pipeline(bounded(10, 20), new InMemoryTransactionSource(TestTransactions.range(10, 20)), engine, clean,
                cleanStore, settings).run();

        assertThat(sink.rows("balances")).isEqualTo(clean.rows("balances"));
    }

    @Test
    @DisplayName("请求的版本已被裁剪时 FAILED")
    void rangeUnavailableIsFatal() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(50, 60));
        Pipeline pipeline = pipeline(bounded(0, 60), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(RangeUnavailableException.class);
        assertThat(sink.batches()).isEmpty();
    }

    @Test
    @DisplayName("交易流断线后从下一个未消费版本重连")
    void reconnectsAfterTransientSourceFailure() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 15)).failAt(12, 2);
        Pipeline pipeline = pipeline(bounded(10, 15), source, settings().build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertContiguous(sink.batches(), 10, 15);
        assertThat(source.fetchCount()).isGreaterThanOrEqualTo(3);
        assertThat(source.fetches().get(1)[0]).isEqualTo(12);
    }

    @Test
    @DisplayName("交易流连续失败超过次数后 FAILED")
    void failsWhenSourceRetriesExhausted() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(10, 15)).failAt(12, 100);
        Pipeline pipeline = pipeline(bounded(10, 15), source, settings().sourceRetry(new RetryPolicy(1, 0, 2)).build());

        RunResult result = pipeline.run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(StreamExhaustedException.class);
        assertThat(tailingCheckpoint()).isEqualTo(11);
    }

    @Test
    @DisplayName("首次运行记录链 ID，之后不一致则拒绝启动")
    void verifiesChainId() {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 2)).withChainId(1);
        assertThat(pipeline(bounded(0, 2), source, settings().build()).run().status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(store.chainId()).hasValue(1);

        InMemoryTransactionSource other = new InMemoryTransactionSource(TestTransactions.range(0, 5)).withChainId(2);
        RunResult result = pipeline(bounded(0, 5), other, settings().build()).run();

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.error()).isInstanceOf(IllegalStateException.class).hasMessageContaining("链 ID");
        assertThat(other.fetchCount()).isZero();
    }

    @Test
    @DisplayName("stop() 后提交已缓冲数据并以 CANCELLED 结束")
    void stopFlushesBufferedData() throws Exception {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 4));
        Pipeline pipeline = pipeline(ProcessorRunSpec.tailing(PROCESSOR, 0), source, settings().build());

        CompletableFuture<RunResult> run = CompletableFuture.supplyAsync(pipeline::run);
        Waits.until(() -> source.deliveredCount() == 5 && pipeline.getInFlight() == 0, Duration.ofSeconds(5));
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STREAMING);
        pipeline.stop();
        RunResult result = run.get(10, TimeUnit.SECONDS);

        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
        assertContiguous(sink.batches(), 0, 4);
        assertThat(result.lastCommittedVersion()).isEqualTo(4);
    }

    @Test
    @DisplayName("追上链头后继续轮询新交易")
    void tailingPicksUpNewTransactions() throws Exception {
        InMemoryTransactionSource source = new InMemoryTransactionSource(TestTransactions.range(0, 2));
        Pipeline pipeline = pipeline(ProcessorRunSpec.tailing(PROCESSOR, 0), source, settings().build());

        CompletableFuture<RunResult> run = CompletableFuture.supplyAsync(pipeline::run);
        Waits.until(() -> source.deliveredCount() == 3, Duration.ofSeconds(5));
        source.append(TestTransactions.txn(3));
        source.append(TestTransactions.txn(4));
        Waits.until(() -> source.deliveredCount() == 5 && pipeline.getInFlight() == 0, Duration.ofSeconds(5));
        pipeline.stop();
        run.get(10, TimeUnit.SECONDS);

        assertContiguous(sink.batches(), 0, 4);
    }
}
