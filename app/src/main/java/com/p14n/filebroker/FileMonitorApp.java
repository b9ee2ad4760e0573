package com.p14n.filebroker;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.filebroker.audit.FileAuditSink;
import com.p14n.filebroker.broker.AsyncExecutor;
import com.p14n.filebroker.broker.DefaultExecutor;
import com.p14n.filebroker.broker.DefaultMessageBroker;
import com.p14n.filebroker.broker.MessageBroker;
import com.p14n.filebroker.broker.SubscriptionRegistry;
import com.p14n.filebroker.config.MonitorConfig;
import com.p14n.filebroker.watcher.FileChangeMonitor;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Wires the broker, the audit log, the audit consumer and the directory
 * watcher together.
 *
 * <p>
 * Shutdown runs in a fixed order: the watcher stops first, then the broker
 * closes (waiting for any publish still running), then the audit log and the
 * handler executor are released.
 * </p>
 *
 * <pre>{@code
 * var cfg = new ConfigData(Path.of("/srv/files"));
 * try (var app = new FileMonitorApp(cfg, OpenTelemetry.noop())) {
 *     app.start();
 *     // ...
 * }
 * }</pre>
 */
public class FileMonitorApp implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FileMonitorApp.class);

    public static final String CONSUMER_NAME = "AuditConsumer";

    private final MonitorConfig cfg;
    private final OpenTelemetry ot;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private FileAuditSink auditSink;
    private AsyncExecutor asyncExecutor;
    private DefaultMessageBroker broker;
    private AuditConsumer consumer;
    private FileChangeMonitor monitor;
    private List<AutoCloseable> closeables = List.of();

    public FileMonitorApp(MonitorConfig cfg, OpenTelemetry ot) {
        this.cfg = cfg;
        this.ot = ot;
    }

    /**
     * Opens the audit log, subscribes the audit consumer and starts watching.
     *
     * @throws IOException if the audit log cannot be opened or the directory
     *                     cannot be watched
     */
    public void start() throws IOException {
        logger.atInfo().log("Starting file monitor for {}", cfg.monitoringPath());

        if (broker != null) {
            logger.atError().log("File monitor already started");
            throw new IllegalStateException("Already started");
        }

        List<AutoCloseable> opened = new ArrayList<>();
        try {
            auditSink = new FileAuditSink(cfg.auditLogPath());
            opened.add(auditSink);
            if (cfg.handlerTimeout() != null) {
                asyncExecutor = new DefaultExecutor();
                opened.add(asyncExecutor);
            }
            broker = new DefaultMessageBroker(new SubscriptionRegistry(), auditSink, asyncExecutor,
                    cfg.handlerTimeout(), ot, "file_monitor");
            opened.add(0, broker);

            consumer = new AuditConsumer(CONSUMER_NAME);
            broker.subscribe(cfg.subscriptionPattern(), consumer);

            monitor = new FileChangeMonitor(broker, cfg.rootPath(), cfg.monitoringPath(), cfg.topicNamespace(), ot);
            monitor.start();
            opened.add(0, monitor);

            logger.atInfo().log("Observer created and monitoring started");
        } catch (IOException | RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start file monitor");
            closeAll(opened);
            auditSink = null;
            asyncExecutor = null;
            broker = null;
            consumer = null;
            monitor = null;
            throw e;
        }

        // monitor, broker, audit sink, executor
        closeables = opened;
    }

    public MessageBroker broker() {
        return broker;
    }

    public AuditConsumer consumer() {
        return consumer;
    }

    public FileChangeMonitor monitor() {
        return monitor;
    }

    public FileAuditSink auditSink() {
        return auditSink;
    }

    /**
     * Stops the watcher, the broker and the audit log, in that order. Safe to
     * call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo().log("Stopping file monitor");
        closeAll(closeables);
        logger.atInfo().log("File monitor stopped");
    }

    private static void closeAll(List<AutoCloseable> toClose) {
        for (var c : toClose) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
    }
}
