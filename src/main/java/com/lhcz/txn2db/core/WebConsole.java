package com.lhcz.txn2db.core;

import com.lhcz.txn2db.util.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查 + 运行状态
 * <ul>
 *   <li>{@code /} 存活探针，返回 ok</li>
 *   <li>{@code /api/status} 流水线状态 JSON</li>
 * </ul>
 */
public class WebConsole {
    private static final Logger log = LoggerFactory.getLogger(WebConsole.class);
    private final int port;
    private final Pipeline pipeline;
    private HttpServer server;

    public WebConsole(int port, Pipeline pipeline) {
        this.port = port;
        this.pipeline = pipeline;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("状态端口启动失败: " + port, e);
        }
        server.createContext("/", new HealthHandler());
        server.createContext("/api/status", new StatusHandler());
        server.setExecutor(null);
        server.start();
        log.info("🌐 状态接口已启动: http://localhost:{}/api/status", getPort());
    }

    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
    }

    Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("processor", pipeline.getRunSpec().processorName());
        status.put("mode", pipeline.getRunSpec().mode().name().toLowerCase());
        status.put("run", pipeline.getRunSpec().runName());
        status.put("state", pipeline.getState().name());
        status.put("lastCommittedVersion", pipeline.getLastCommittedVersion());
        status.put("committedBatches", pipeline.getCommittedBatches());
        status.put("inFlight", pipeline.getInFlight());
        status.put("skippedTransactions", pipeline.getSkippedTransactions());
        return status;
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange t) throws IOException {
            write(t, "text/plain; charset=utf-8", "ok");
        }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange t) throws IOException {
            write(t, "application/json", JsonUtil.toJson(status()));
        }
    }

    private static void write(HttpExchange t, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        t.getResponseHeaders().set("Content-Type", contentType);
        t.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = t.getResponseBody()) {
            os.write(bytes);
        }
    }
}
