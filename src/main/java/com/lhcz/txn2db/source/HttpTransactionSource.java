package com.lhcz.txn2db.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalLong;

/**
 * 通过节点 REST 接口分页拉取交易
 * <pre>
 *   GET {address}/v1                               -> 账本信息 (chain_id / ledger_version / oldest_ledger_version)
 *   GET {address}/v1/transactions?start=S&amp;limit=L -> 交易数组
 * </pre>
 */
public class HttpTransactionSource implements TransactionSource {
    private static final Logger log = LoggerFactory.getLogger(HttpTransactionSource.class);

    static final String REQUEST_NAME_HEADER = "x-aptos-request-name";

    private final String baseUrl;
    private final String authToken;
    private final String requestName;
    private final int pageSize;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public record LedgerInfo(long chainId, long ledgerVersion, long oldestLedgerVersion) {}

    public HttpTransactionSource(String address, String authToken, String requestName, int pageSize, Duration requestTimeout) {
        this.baseUrl = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
        this.authToken = authToken;
        this.requestName = requestName;
        this.pageSize = pageSize;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public OptionalLong chainId() throws IOException {
        return OptionalLong.of(ledgerInfo().chainId());
    }

    public LedgerInfo ledgerInfo() throws IOException {
        JsonNode root = get("/v1");
        return new LedgerInfo(
                JsonUtil.requiredLong(root, "chain_id"),
                JsonUtil.requiredLong(root, "ledger_version"),
                root.hasNonNull("oldest_ledger_version") ? JsonUtil.requiredLong(root, "oldest_ledger_version") : 0L);
    }

    @Override
    public TransactionStream fetch(long startingVersion, Long endingVersion) throws IOException {
        LedgerInfo info = ledgerInfo();
        if (startingVersion < info.oldestLedgerVersion()) {
            throw new RangeUnavailableException("起始版本 " + startingVersion + " 已被裁剪，节点最早版本为 " + info.oldestLedgerVersion());
        }
        if (endingVersion != null && endingVersion > info.ledgerVersion()) {
            throw new RangeUnavailableException("结束版本 " + endingVersion + " 超出链头 " + info.ledgerVersion());
        }
        log.info("开始拉取交易流: [{} - {}]，链头 {}", startingVersion, endingVersion == null ? "∞" : endingVersion, info.ledgerVersion());
        return new PagedStream(startingVersion, endingVersion);
    }

    private JsonNode get(String pathAndQuery) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (authToken != null && !authToken.isBlank()) {
            builder.header("Authorization", "Bearer " + authToken);
        }
        if (requestName != null && !requestName.isBlank()) {
            builder.header(REQUEST_NAME_HEADER, requestName);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.GET().build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("请求被中断: " + pathAndQuery);
        }

        int status = response.statusCode();
        if (status == 200) {
            return JsonUtil.readTree(response.body());
        }
        if (status == 410) {
            throw new RangeUnavailableException("节点返回 410 (版本已裁剪): " + pathAndQuery);
        }
        throw new IOException("HTTP_" + status + " " + pathAndQuery + ": " + response.body());
    }

    private class PagedStream implements TransactionStream {
        private final Long endingVersion;
        private final Deque<Transaction> buffer = new ArrayDeque<>();
        private long nextVersion;
        private boolean exhausted;

        PagedStream(long startingVersion, Long endingVersion) {
            this.nextVersion = startingVersion;
            this.endingVersion = endingVersion;
        }

        @Override
        public Transaction next() throws IOException {
            if (buffer.isEmpty() && !exhausted) {
                loadPage();
            }
            return buffer.pollFirst();
        }

        private void loadPage() throws IOException {
            if (endingVersion != null && nextVersion > endingVersion) {
                exhausted = true;
                return;
            }
            long limit = pageSize;
            if (endingVersion != null) {
                limit = Math.min(limit, endingVersion - nextVersion + 1);
            }
            JsonNode page = get("/v1/transactions?start=" + nextVersion + "&limit=" + limit);
            if (!page.isArray() || page.isEmpty()) {
                // 已追上链头
                exhausted = true;
                return;
            }
            for (JsonNode node : page) {
                Transaction txn = TransactionParser.parse(node);
                buffer.addLast(txn);
                nextVersion = txn.version() + 1;
            }
        }

        @Override
        public void close() {
            buffer.clear();
        }
    }
}
