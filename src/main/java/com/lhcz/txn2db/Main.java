package com.lhcz.txn2db;

import com.lhcz.txn2db.config.AppConfig;
import com.lhcz.txn2db.config.ConfigLoader;
import com.lhcz.txn2db.core.IndexerProcessor;
import com.lhcz.txn2db.core.RunResult;
import com.lhcz.txn2db.core.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        // 读取 YAML 配置 (参数 -> ./application.yaml -> ./config/application.yaml -> classpath)
        AppConfig config = ConfigLoader.locate(args);
        log.info("Starting txn2db ...");

        RunResult result;
        CountDownLatch finished = new CountDownLatch(1);
        try (IndexerProcessor processor = new IndexerProcessor(config)) {
            // Ctrl+C / SIGTERM: 停止拉取，提交已缓冲的数据后退出
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                processor.stop();
                try {
                    if (!finished.await(60, TimeUnit.SECONDS)) {
                        log.warn("⚠️ 等待流水线退出超时");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "txn2db-shutdown"));

            result = processor.run();
        } finally {
            finished.countDown();
        }

        if (result.status() == RunStatus.FAILED) {
            log.error("❌ 运行失败: {}", result.error() != null ? result.error().getMessage() : "unknown");
            System.exit(1);
        }
        log.info("运行结束: {} (last_success_version={})", result.status(), result.lastCommittedVersion());
    }
}
