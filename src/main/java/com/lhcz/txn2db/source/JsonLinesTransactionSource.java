package com.lhcz.txn2db.source;

import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 本地文件来源：每行一笔交易 JSON (按版本升序)，用于离线重放和联调
 */
public class JsonLinesTransactionSource implements TransactionSource {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesTransactionSource.class);

    private final Path file;

    public JsonLinesTransactionSource(Path file) {
        this.file = file;
    }

    @Override
    public TransactionStream fetch(long startingVersion, Long endingVersion) throws IOException {
        if (!Files.exists(file)) {
            throw new RangeUnavailableException("交易文件不存在: " + file);
        }
        log.info("从文件读取交易: {} [{} - {}]", file, startingVersion, endingVersion == null ? "EOF" : endingVersion);
        BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        return new FileStream(reader, startingVersion, endingVersion);
    }

    private static class FileStream implements TransactionStream {
        private final BufferedReader reader;
        private final long startingVersion;
        private final Long endingVersion;
        private boolean first = true;

        FileStream(BufferedReader reader, long startingVersion, Long endingVersion) {
            this.reader = reader;
            this.startingVersion = startingVersion;
            this.endingVersion = endingVersion;
        }

        @Override
        public Transaction next() throws IOException {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Transaction txn = TransactionParser.parse(JsonUtil.readTree(line));
                if (first) {
                    first = false;
                    if (txn.version() > startingVersion) {
                        throw new RangeUnavailableException("文件最早版本为 " + txn.version() + "，无法从 " + startingVersion + " 开始");
                    }
                }
                if (txn.version() < startingVersion) {
                    continue;
                }
                if (endingVersion != null && txn.version() > endingVersion) {
                    return null;
                }
                return txn;
            }
            return null;
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }
}
