package com.lhcz.txn2db.core;

import com.lhcz.txn2db.checkpoint.CheckpointStore;
import com.lhcz.txn2db.extractor.ExtractionEngine;
import com.lhcz.txn2db.model.BackfillStatus;
import com.lhcz.txn2db.model.Batch;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;
import com.lhcz.txn2db.model.ExtractedTransaction;
import com.lhcz.txn2db.model.ProcessorRunSpec;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.sink.Sink;
import com.lhcz.txn2db.sink.SinkException;
import com.lhcz.txn2db.sink.SinkExhaustedException;
import com.lhcz.txn2db.source.OrderingViolationException;
import com.lhcz.txn2db.source.StreamExhaustedException;
import com.lhcz.txn2db.source.TransactionSource;
import com.lhcz.txn2db.source.TransactionStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 核心流水线控制器
 * <p>
 * 三个阶段，阶段之间是容量为 channel_size 的有界队列：
 * <pre>
 *   fetch 线程 --&gt; [fetched] --&gt; extract 线程 (+ 抽取线程池) --&gt; [extracted] --&gt; sink (调用 run() 的线程)
 * </pre>
 * 另有一个全局信号量限制在途交易总数：fetch 每取一笔申请一个许可，sink 放入累加器后归还。
 * 抽取可以并行，但结果按版本顺序转发。
 * <p>
 * 状态: INITIALIZING -&gt; STREAMING/BACKFILLING &lt;-&gt; FLUSHING -&gt; DRAINING -&gt; STOPPED
 */
public class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);
    private static final long POLL_MS = 100;

    private final ProcessorRunSpec runSpec;
    private final TransactionSource source;
    private final ExtractionEngine engine;
    private final Sink sink;
    private final CheckpointStore checkpointStore;
    private final PipelineSettings settings;
    private final BatchAccumulator accumulator;

    private final BlockingQueue<ChannelItem<Transaction>> fetched;
    private final BlockingQueue<ChannelItem<ExtractedTransaction>> extracted;
    private final Semaphore permits;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile boolean aborted;

    private volatile PipelineState state = PipelineState.INITIALIZING;
    private final List<PipelineState> stateHistory = new CopyOnWriteArrayList<>(List.of(PipelineState.INITIALIZING));
    private volatile long lastCommittedVersion = RunResult.NONE;
    private final AtomicLong inFlight = new AtomicLong();
    private final AtomicLong maxInFlight = new AtomicLong();
    private final AtomicLong committedBatches = new AtomicLong();

    // 回填进度里记录的起止版本
    private long backfillStart;
    private Long end;

    public Pipeline(ProcessorRunSpec runSpec, TransactionSource source, ExtractionEngine engine, Sink sink,
                    CheckpointStore checkpointStore, PipelineSettings settings) {
        this.runSpec = runSpec;
        this.source = source;
        this.engine = engine;
        this.sink = sink;
        this.checkpointStore = checkpointStore;
        this.settings = settings;
        this.accumulator = new BatchAccumulator(settings.maxBufferBytes(), settings.uploadInterval(), settings.clock());
        this.fetched = new ArrayBlockingQueue<>(settings.channelSize());
        this.extracted = new ArrayBlockingQueue<>(settings.channelSize());
        this.permits = new Semaphore(settings.channelSize());
    }

    /**
     * 阻塞运行直到结束 (到达 ending_version / 被 stop / 致命错误)
     */
    public RunResult run() {
        long start;
        try {
            OptionalLong resolved = initialize();
            if (resolved.isEmpty()) {
                moveTo(PipelineState.STOPPED);
                return RunResult.success(lastCommittedVersion);
            }
            start = resolved.getAsLong();
        } catch (RuntimeException e) {
            log.error("❌ [{}] 初始化失败: {}", runSpec.runName(), e.getMessage(), e);
            moveTo(PipelineState.STOPPED);
            return RunResult.failed(lastCommittedVersion, e);
        }

        if (end != null && start > end) {
            log.info("[{}] 起始版本 {} 已超过结束版本 {}，无需处理", runSpec.runName(), start, end);
            moveTo(PipelineState.STOPPED);
            return RunResult.success(lastCommittedVersion);
        }

        log.info("🚀 [{}] 开始处理 mode={} 版本区间 [{}, {}]", runSpec.runName(), runSpec.mode(), start,
                end == null ? "∞" : end);
        accumulator.expect(start);
        moveTo(streamingState());

        ExecutorService stages = Executors.newFixedThreadPool(2, named(runSpec.runName() + "-stage"));
        ExecutorService workers = Executors.newFixedThreadPool(settings.extractionParallelism(),
                named(runSpec.runName() + "-extract"));
        Throwable failure = null;
        try {
            final long from = start;
            stages.submit(() -> fetchLoop(from));
            stages.submit(() -> extractLoop(workers));

            failure = consume();
            // 上游失败时已缓冲的交易仍是连续的，照常提交；只有回填有 DRAINING 阶段
            moveTo(runSpec.isBackfill() ? PipelineState.DRAINING : PipelineState.FLUSHING);
            flush();
        } catch (SinkExhaustedException e) {
            if (failure != null) {
                e.addSuppressed(failure);
            }
            failure = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            log.warn("⚠️ [{}] 运行线程被中断", runSpec.runName());
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            aborted = true;
            stopSignal.countDown();
            shutdown(stages);
            shutdown(workers);
            moveTo(PipelineState.STOPPED);
        }

        if (failure != null) {
            log.error("❌ [{}] 流水线异常终止，最后提交版本 {}", runSpec.runName(), lastCommittedVersion, failure);
            return RunResult.failed(lastCommittedVersion, failure);
        }
        if (stopRequested) {
            log.info("🛑 [{}] 已停止，最后提交版本 {}", runSpec.runName(), lastCommittedVersion);
            return RunResult.cancelled(lastCommittedVersion);
        }
        log.info("✅ [{}] 处理完成，最后提交版本 {}", runSpec.runName(), lastCommittedVersion);
        return RunResult.success(lastCommittedVersion);
    }

    /**
     * 请求优雅停止：不再拉取新交易，已在途的交易处理完并做最后一次提交
     */
    public void stop() {
        stopRequested = true;
        stopSignal.countDown();
    }

    // ---------------------------------------------------------------- 初始化

    /**
     * @return 起始版本；为空表示无事可做 (回填已完成)
     */
    private OptionalLong initialize() {
        moveTo(PipelineState.INITIALIZING);
        verifyChainId();

        CheckpointKey key = runSpec.checkpointKey();
        long start;
        backfillStart = runSpec.startingVersion();
        if (runSpec.overwriteCheckpoint()) {
            checkpointStore.clear(key);
            start = runSpec.startingVersion();
            log.warn("⚠️ [{}] overwrite_checkpoint=true，从 {} 重新开始", runSpec.runName(), start);
        } else {
            Optional<Checkpoint> checkpoint = checkpointStore.read(key);
            if (checkpoint.isPresent()) {
                lastCommittedVersion = checkpoint.get().lastSuccessVersion();
            }
            if (runSpec.isBackfill()) {
                if (checkpoint.isPresent() && checkpoint.get().isComplete()) {
                    log.info("[{}] 回填已完成 (last_success_version={})，跳过", runSpec.runName(), lastCommittedVersion);
                    return OptionalLong.empty();
                }
                if (checkpoint.isPresent()) {
                    start = checkpoint.get().lastSuccessVersion() + 1;
                    if (checkpoint.get().backfillStartVersion() != null) {
                        backfillStart = checkpoint.get().backfillStartVersion();
                    }
                } else {
                    start = runSpec.startingVersion();
                }
            } else {
                start = checkpoint.map(cp -> Math.max(cp.lastSuccessVersion() + 1, runSpec.startingVersion()))
                        .orElse(runSpec.startingVersion());
            }
        }

        end = runSpec.endingVersion();
        if (runSpec.isBackfill() && end == null) {
            end = checkpointStore.read(CheckpointKey.tailing(runSpec.processorName()))
                    .map(Checkpoint::lastSuccessVersion)
                    .orElseThrow(() -> new IllegalStateException(
                            "回填未配置 ending_version，且主流程 " + runSpec.processorName() + " 没有进度可作为结束版本"));
            log.info("[{}] 回填结束版本取主流程进度: {}", runSpec.runName(), end);
        }

        sink.recover(key, start - 1);
        return OptionalLong.of(start);
    }

    private void verifyChainId() {
        OptionalLong remote;
        try {
            remote = source.chainId();
        } catch (IOException e) {
            throw new IllegalStateException("无法获取链 ID", e);
        }
        if (remote.isEmpty()) {
            return;
        }
        OptionalLong stored = checkpointStore.chainId();
        if (stored.isEmpty()) {
            checkpointStore.saveChainId(remote.getAsLong());
            log.info("记录链 ID: {}", remote.getAsLong());
        } else if (stored.getAsLong() != remote.getAsLong()) {
            throw new IllegalStateException("链 ID 不一致: 库中为 " + stored.getAsLong() + "，交易流为 " + remote.getAsLong());
        }
    }

    // ---------------------------------------------------------------- fetch 阶段

    private void fetchLoop(long start) {
        long next = start;
        long openedAt = start;
        int failures = 0;
        TransactionStream stream = null;
        try {
            while (!stopRequested && !aborted && (end == null || next <= end)) {
                try {
                    if (stream == null) {
                        stream = source.fetch(next, end);
                        openedAt = next;
                    }
                    Transaction txn = stream.next();
                    if (txn == null) {
                        // 本轮数据取完，从下一个未消费的版本重新打开；一笔都没取到说明已追上链头
                        stream.close();
                        stream = null;
                        if (openedAt == next) {
                            stopSignal.await(settings.idlePollInterval().toMillis(), TimeUnit.MILLISECONDS);
                        }
                        continue;
                    }
                    if (txn.version() != next) {
                        throw new OrderingViolationException(next, txn.version());
                    }
                    if (!acquirePermit()) {
                        break;
                    }
                    if (!send(fetched, ChannelItem.of(txn))) {
                        break;
                    }
                    next++;
                    failures = 0;
                } catch (IOException e) {
                    stream = closeAfterFailure(stream, e);
                    if (++failures > settings.sourceRetry().getMaxRetries()) {
                        throw new StreamExhaustedException("交易流连续失败 " + failures + " 次，停在版本 " + next, e);
                    }
                    long delay = settings.sourceRetry().delayMs(failures - 1);
                    log.warn("⚠️ [{}] 交易流异常，{} ms 后从 {} 重连 ({}/{}): {}", runSpec.runName(), delay, next,
                            failures, settings.sourceRetry().getMaxRetries(), e.getMessage());
                    stopSignal.await(delay, TimeUnit.MILLISECONDS);
                }
            }
            send(fetched, ChannelItem.end());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("❌ [{}] 拉取阶段失败: {}", runSpec.runName(), e.getMessage());
            sendQuietly(fetched, ChannelItem.failed(e));
        } finally {
            if (stream != null) {
                try {
                    stream.close();
                } catch (IOException e) {
                    log.warn("关闭交易流失败: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * 失败后关闭流，关闭时的异常附加到原异常上
     */
    private static TransactionStream closeAfterFailure(TransactionStream stream, IOException cause) {
        if (stream != null) {
            try {
                stream.close();
            } catch (IOException closeError) {
                cause.addSuppressed(closeError);
            }
        }
        return null;
    }

    private boolean acquirePermit() throws InterruptedException {
        while (!permits.tryAcquire(POLL_MS, TimeUnit.MILLISECONDS)) {
            if (aborted) {
                return false;
            }
        }
        long current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        return true;
    }

    // ---------------------------------------------------------------- extract 阶段

    private void extractLoop(ExecutorService workers) {
        try {
            while (!aborted) {
                ChannelItem<Transaction> first = fetched.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                List<Transaction> chunk = new ArrayList<>();
                ChannelItem<Transaction> terminal = null;
                ChannelItem<Transaction> item = first;
                while (item != null) {
                    if (item.isTerminal()) {
                        terminal = item;
                        break;
                    }
                    chunk.add(item.value());
                    if (chunk.size() >= settings.extractionParallelism()) {
                        break;
                    }
                    item = fetched.poll();
                }

                List<Future<ExtractedTransaction>> futures = new ArrayList<>(chunk.size());
                for (Transaction txn : chunk) {
                    futures.add(workers.submit(() -> engine.extract(txn)));
                }
                // 按提交顺序取结果，保证版本有序
                for (Future<ExtractedTransaction> future : futures) {
                    ExtractedTransaction result;
                    try {
                        result = future.get();
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.error("❌ [{}] 抽取阶段失败: {}", runSpec.runName(), cause.getMessage());
                        sendQuietly(extracted, ChannelItem.failed(cause));
                        return;
                    }
                    if (!send(extracted, ChannelItem.of(result))) {
                        return;
                    }
                }

                if (terminal != null) {
                    send(extracted, terminal.isFailed() ? ChannelItem.failed(terminal.error()) : ChannelItem.end());
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------- sink 阶段

    /**
     * 消费抽取结果直到上游结束
     *
     * @return 上游或累加器报告的失败，正常结束为 null
     */
    private Throwable consume() throws InterruptedException {
        while (true) {
            ChannelItem<ExtractedTransaction> item = extracted.poll(POLL_MS, TimeUnit.MILLISECONDS);
            if (item != null) {
                if (item.isEnd()) {
                    return null;
                }
                if (item.isFailed()) {
                    aborted = true;
                    return item.error();
                }
                try {
                    accumulator.add(item.value());
                } catch (OrderingViolationException e) {
                    aborted = true;
                    return e;
                } finally {
                    permits.release();
                    inFlight.decrementAndGet();
                }
            }
            if (accumulator.shouldFlush()) {
                flush();
            }
        }
    }

    /**
     * 提交当前缓冲；暂时性失败按退避重试，超过次数抛 {@link SinkExhaustedException}
     */
    private void flush() throws InterruptedException {
        Batch batch = accumulator.drain();
        if (batch == null) {
            return;
        }
        PipelineState previous = state;
        moveTo(PipelineState.FLUSHING);
        Checkpoint checkpoint = checkpointFor(batch);
        long begin = System.currentTimeMillis();
        int attempt = 0;
        while (true) {
            try {
                sink.commit(batch, checkpoint);
                break;
            } catch (SinkException e) {
                if (attempt >= settings.sinkRetry().getMaxRetries()) {
                    aborted = true;
                    log.error("❌ [{}] 写入重试耗尽 {}: {}", runSpec.runName(), batch, e.getMessage());
                    throw new SinkExhaustedException("批次 [" + batch.startVersion() + ", " + batch.endVersion()
                            + "] 写入失败，已重试 " + attempt + " 次", attempt + 1, e);
                }
                long delay = settings.sinkRetry().delayMs(attempt);
                attempt++;
                log.warn("⚠️ [{}] 写入失败，{} ms 后重试 {}/{}: {}", runSpec.runName(), delay, attempt,
                        settings.sinkRetry().getMaxRetries(), e.getMessage());
                Thread.sleep(delay);
            }
        }
        lastCommittedVersion = batch.endVersion();
        committedBatches.incrementAndGet();
        log.info("✅ [{}] 已提交 {} ({} ms)", runSpec.runName(), batch, System.currentTimeMillis() - begin);
        moveTo(previous);
    }

    private Checkpoint checkpointFor(Batch batch) {
        if (!runSpec.isBackfill()) {
            return Checkpoint.tailing(runSpec.processorName(), batch.endVersion(), batch.lastTransactionTimestamp(),
                    settings.clock().instant());
        }
        BackfillStatus status = end != null && batch.endVersion() >= end ? BackfillStatus.COMPLETE : BackfillStatus.IN_PROGRESS;
        return Checkpoint.backfill(runSpec.backfillAlias(), batch.endVersion(), batch.lastTransactionTimestamp(),
                settings.clock().instant(), status, backfillStart, end);
    }

    // ---------------------------------------------------------------- 工具

    /**
     * 发送到下游，下游满时阻塞；流水线中止时放弃并返回 false
     */
    private <T> boolean send(BlockingQueue<ChannelItem<T>> queue, ChannelItem<T> item) throws InterruptedException {
        while (!queue.offer(item, POLL_MS, TimeUnit.MILLISECONDS)) {
            if (aborted) {
                return false;
            }
        }
        return true;
    }

    private <T> void sendQuietly(BlockingQueue<ChannelItem<T>> queue, ChannelItem<T> item) {
        try {
            send(queue, item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private PipelineState streamingState() {
        return runSpec.isBackfill() ? PipelineState.BACKFILLING : PipelineState.STREAMING;
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("⚠️ [{}] 工作线程未能在 10 秒内退出", runSpec.runName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void moveTo(PipelineState next) {
        if (state != next) {
            log.debug("[{}] 状态 {} -> {}", runSpec.runName(), state, next);
            state = next;
            stateHistory.add(next);
        }
    }

    // ---------------------------------------------------------------- 监控

    public PipelineState getState() {
        return state;
    }

    /**
     * 本次运行经历过的状态 (相邻去重)
     */
    public List<PipelineState> getStateHistory() {
        return List.copyOf(stateHistory);
    }

    public long getLastCommittedVersion() {
        return lastCommittedVersion;
    }

    public long getInFlight() {
        return inFlight.get();
    }

    public long getMaxInFlight() {
        return maxInFlight.get();
    }

    public long getCommittedBatches() {
        return committedBatches.get();
    }

    public long getSkippedTransactions() {
        return engine.skippedCount();
    }

    public ProcessorRunSpec getRunSpec() {
        return runSpec;
    }
}
