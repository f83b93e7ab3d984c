package com.lhcz.txn2db.source;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lhcz.txn2db.model.Transaction;
import com.lhcz.txn2db.support.TestTransactions;
import com.lhcz.txn2db.util.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTransactionSourceTest {

    private static final long OLDEST = 5;
    private static final long HEAD = 20;

    private HttpServer server;
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final Map<String, String> headers = new ConcurrentHashMap<>();
    private volatile int forcedStatus = 200;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/v1", exchange -> {
            recordHeaders(exchange);
            ObjectNode info = JsonUtil.mapper().createObjectNode();
            info.put("chain_id", 4);
            info.put("ledger_version", String.valueOf(HEAD));
            info.put("oldest_ledger_version", String.valueOf(OLDEST));
            respond(exchange, 200, info.toString());
        });
        server.createContext("/v1/transactions", exchange -> {
            recordHeaders(exchange);
            String query = exchange.getRequestURI().getQuery();
            queries.add(query);
            if (forcedStatus != 200) {
                respond(exchange, forcedStatus, "{\"error_code\":\"forced\"}");
                return;
            }
            long start = 0;
            long limit = 0;
            for (String param : query.split("&")) {
                String[] kv = param.split("=");
                if (kv[0].equals("start")) {
                    start = Long.parseLong(kv[1]);
                } else if (kv[0].equals("limit")) {
                    limit = Long.parseLong(kv[1]);
                }
            }
            ArrayNode page = JsonUtil.mapper().createArrayNode();
            for (long v = start; v < start + limit && v <= HEAD; v++) {
                page.add(TestTransactions.json(v));
            }
            respond(exchange, 200, page.toString());
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void recordHeaders(HttpExchange exchange) {
        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        if (auth != null) {
            headers.put("Authorization", auth);
        }
        String name = exchange.getRequestHeaders().getFirst(HttpTransactionSource.REQUEST_NAME_HEADER);
        if (name != null) {
            headers.put(HttpTransactionSource.REQUEST_NAME_HEADER, name);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private HttpTransactionSource source(int pageSize) {
        return new HttpTransactionSource("http://localhost:" + server.getAddress().getPort() + "/", "secret-token",
                "coin_processor", pageSize, Duration.ofSeconds(5));
    }

    private static List<Long> drain(TransactionStream stream) throws IOException {
        List<Long> versions = new ArrayList<>();
        Transaction txn;
        while ((txn = stream.next()) != null) {
            versions.add(txn.version());
        }
        return versions;
    }

    @Test
    @DisplayName("按页拉取有界区间，最后一页只请求剩余数量")
    void fetch_pagesThroughBoundedRange() throws Exception {
        try (TransactionStream stream = source(4).fetch(5, 14L)) {
            assertThat(drain(stream)).containsExactly(5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L, 13L, 14L);
        }

        assertThat(queries).containsExactly("start=5&limit=4", "start=9&limit=4", "start=13&limit=2");
    }

    @Test
    @DisplayName("无上限时读到链头即结束本次流")
    void fetch_unboundedStopsAtHead() throws Exception {
        try (TransactionStream stream = source(100).fetch(18, null)) {
            assertThat(drain(stream)).containsExactly(18L, 19L, 20L);
        }
    }

    @Test
    @DisplayName("请求携带鉴权与请求名头")
    void fetch_sendsHeaders() throws Exception {
        try (TransactionStream stream = source(2).fetch(5, 6L)) {
            drain(stream);
        }

        assertThat(headers).containsEntry("Authorization", "Bearer secret-token")
                .containsEntry(HttpTransactionSource.REQUEST_NAME_HEADER, "coin_processor");
    }

    @Test
    @DisplayName("chain_id 取自账本信息")
    void chainId_fromLedgerInfo() throws Exception {
        assertThat(source(10).chainId()).hasValue(4);
        assertThat(source(10).ledgerInfo().oldestLedgerVersion()).isEqualTo(OLDEST);
    }

    @Test
    @DisplayName("起始版本已被裁剪或结束版本超出链头时抛 RangeUnavailableException")
    void fetch_rejectsUnavailableRange() {
        assertThatThrownBy(() -> source(10).fetch(2, 10L)).isInstanceOf(RangeUnavailableException.class);
        assertThatThrownBy(() -> source(10).fetch(5, 25L)).isInstanceOf(RangeUnavailableException.class);
    }

    @Test
    @DisplayName("节点返回 410 视为区间不可用")
    void next_gone_isRangeUnavailable() throws Exception {
        forcedStatus = 410;
        try (TransactionStream stream = source(10).fetch(5, 10L)) {
            assertThatThrownBy(stream::next).isInstanceOf(RangeUnavailableException.class);
        }
    }

    @Test
    @DisplayName("其他错误码抛 IOException，由调用方重连")
    void next_serverError_isIOException() throws Exception {
        forcedStatus = 503;
        try (TransactionStream stream = source(10).fetch(5, 10L)) {
            assertThatThrownBy(stream::next).isInstanceOf(IOException.class).hasMessageContaining("HTTP_503");
        }
    }
}
