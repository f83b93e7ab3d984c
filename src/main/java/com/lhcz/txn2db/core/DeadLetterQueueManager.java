package com.lhcz.txn2db.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 死信目录 (数据补录)
 * 作用：抽取失败被跳过的交易原样落盘，便于事后人工重放。
 */
public class DeadLetterQueueManager {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueManager.class);

    private final Path dir;

    public DeadLetterQueueManager(Path dir) {
        this.dir = dir;
    }

    public Path getDir() {
        return dir;
    }

    /**
     * 保存一笔抽取失败的交易
     * 文件名: failed_处理器_版本_抽取器.json
     */
    public void save(String processorName, Transaction transaction, String extractorName, Throwable error) {
        String safeExtractor = extractorName.replaceAll("[^a-zA-Z0-9]", "_");
        Path file = dir.resolve(String.format("failed_%s_%d_%s.json", processorName, transaction.version(), safeExtractor));

        ObjectNode node = JsonUtil.mapper().createObjectNode();
        node.put("processor", processorName);
        node.put("version", transaction.version());
        node.put("extractor", extractorName);
        node.put("reason", String.valueOf(error.getMessage()));
        node.set("transaction", transaction.payload());
        try {
            Files.createDirectories(dir);
            JsonUtil.mapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), node);
            log.warn("💾 [补录保存] 抽取失败的交易已保存: {}", file);
        } catch (IOException e) {
            log.error("🚨 [严重错误] 无法保存失败交易! version={} extractor={}", transaction.version(), extractorName, e);
        }
    }
}
