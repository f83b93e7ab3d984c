package com.lhcz.txn2db.checkpoint;

import com.lhcz.txn2db.model.BackfillStatus;
import com.lhcz.txn2db.model.Checkpoint;
import com.lhcz.txn2db.model.CheckpointKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Properties;

/**
 * Properties 文件进度存储，供 Parquet 写入端使用
 * <p>
 * key 格式: {@code <processor>.version}，回填为 {@code backfill.<alias>.version}。
 * 每次写入先写临时文件再原子替换，进程崩溃不会留下半个文件。
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final String CHAIN_ID = "ledger.chain_id";
    /** 每个 key 下可能出现的字段；名字本身可以含 '.'，所以 clear 只按完整字段名删除 */
    private static final List<String> FIELDS = List.of("version", "last_transaction_timestamp", "last_updated",
            "status", "start_version", "end_version");

    private final Path file;
    private final Properties props = new Properties();

    public FileCheckpointStore(Path file) {
        this.file = file;
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("未找到进度文件 {}，将从配置的起始版本开始", file);
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
            log.info("已加载历史进度文件: {}", file);
        } catch (IOException e) {
            throw new CheckpointStoreException("读取进度文件失败: " + file, e);
        }
    }

    @Override
    public synchronized Optional<Checkpoint> read(CheckpointKey key) {
        String prefix = prefix(key);
        String version = props.getProperty(prefix + "version");
        if (version == null || version.isBlank()) {
            return Optional.empty();
        }
        long last = Long.parseLong(version);
        Instant txnTs = instant(prefix + "last_transaction_timestamp");
        Instant updated = instant(prefix + "last_updated");
        if (!key.isBackfill()) {
            return Optional.of(Checkpoint.tailing(key.name(), last, txnTs, updated));
        }
        BackfillStatus status = BackfillStatus.valueOf(props.getProperty(prefix + "status"));
        String end = props.getProperty(prefix + "end_version");
        return Optional.of(new Checkpoint(key, last, txnTs, updated, status,
                Long.parseLong(props.getProperty(prefix + "start_version")),
                end == null ? null : Long.parseLong(end)));
    }

    @Override
    public synchronized void save(Checkpoint checkpoint) {
        String prefix = prefix(checkpoint.key());
        String existing = props.getProperty(prefix + "version");
        if (existing != null && Long.parseLong(existing) > checkpoint.lastSuccessVersion()) {
            log.warn("⚠️ 忽略回退的进度 {} : {} < {}", checkpoint.key(), checkpoint.lastSuccessVersion(), existing);
            return;
        }
        props.setProperty(prefix + "version", String.valueOf(checkpoint.lastSuccessVersion()));
        put(prefix + "last_transaction_timestamp", checkpoint.lastTransactionTimestamp());
        put(prefix + "last_updated", checkpoint.updatedAt());
        if (checkpoint.key().isBackfill()) {
            props.setProperty(prefix + "status", checkpoint.backfillStatus().name());
            put(prefix + "start_version", checkpoint.backfillStartVersion());
            put(prefix + "end_version", checkpoint.backfillEndVersion());
        }
        saveToFile();
    }

    @Override
    public synchronized void clear(CheckpointKey key) {
        String prefix = prefix(key);
        for (String field : FIELDS) {
            props.remove(prefix + field);
        }
        saveToFile();
        log.warn("⚠️ 已清除进度 {}", key);
    }

    @Override
    public synchronized OptionalLong chainId() {
        String value = props.getProperty(CHAIN_ID);
        return value == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(value));
    }

    @Override
    public synchronized void saveChainId(long chainId) {
        props.setProperty(CHAIN_ID, String.valueOf(chainId));
        saveToFile();
    }

    private static String prefix(CheckpointKey key) {
        return key.isBackfill() ? "backfill." + key.name() + "." : key.name() + ".";
    }

    private void put(String name, Object value) {
        if (value == null) {
            props.remove(name);
        } else {
            props.setProperty(name, value.toString());
        }
    }

    private Instant instant(String name) {
        String value = props.getProperty(name);
        return value == null ? null : Instant.parse(value);
    }

    private void saveToFile() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, "txn2db 同步进度");
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CheckpointStoreException("保存进度失败: " + file, e);
        }
    }
}
