package com.p14n.filebroker;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.filebroker.config.ConfigData;
import com.p14n.filebroker.config.MonitorConfig;
import com.p14n.filebroker.telemetry.DefaultTelemetryConfig;
import com.p14n.filebroker.telemetry.TelemetryConfig;

/**
 * Command line entry point. Watches {@code $FILE_SERVER_ROOT_PATH/important_stuff}
 * until the process is stopped.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        MonitorConfig cfg = ConfigData.fromEnvironment(System.getenv());
        run(cfg);
    }

    private static void close(AutoCloseable c) {
        try {
            if (c != null)
                c.close();
        } catch (Exception e) {
            logger.atWarn().setCause(e).log("Error during shutdown");
        }
    }

    private static void run(MonitorConfig cfg) throws IOException, InterruptedException {
        TelemetryConfig telemetry = new DefaultTelemetryConfig("file-monitor");
        FileMonitorApp app = new FileMonitorApp(cfg, telemetry.getOpenTelemetry());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down...");
            close(app);
            close(telemetry);
            stopped.countDown();
        }, "file-monitor-shutdown"));

        app.start();
        logger.atInfo().log("Listening for messages on {}", cfg.subscriptionPattern());
        stopped.await();
    }
}
