package com.p14n.filebroker.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public record ConfigData(Path rootPath,
        String watchDirectory,
        Path auditLogPath,
        String topicNamespace,
        String subscriptionPattern,
        Duration handlerTimeout) implements MonitorConfig {

    public static final String ROOT_PATH_ENV = "FILE_SERVER_ROOT_PATH";
    public static final String WATCH_DIRECTORY_ENV = "FILE_MONITOR_DIRECTORY";
    public static final String AUDIT_LOG_ENV = "FILE_MONITOR_AUDIT_LOG";
    public static final String NAMESPACE_ENV = "FILE_MONITOR_NAMESPACE";
    public static final String PATTERN_ENV = "FILE_MONITOR_PATTERN";
    public static final String HANDLER_TIMEOUT_ENV = "FILE_MONITOR_HANDLER_TIMEOUT_MS";

    public ConfigData(Path rootPath,
            String watchDirectory,
            Path auditLogPath,
            String topicNamespace) {
        this(rootPath, watchDirectory, auditLogPath, topicNamespace,
                topicNamespace + "/" + watchDirectory + "/#", null);
    }

    public ConfigData(Path rootPath) {
        this(rootPath, DEFAULT_WATCH_DIRECTORY, Path.of(DEFAULT_AUDIT_LOG), DEFAULT_NAMESPACE);
    }

    /**
     * Reads the configuration from environment variables. Only
     * {@value #ROOT_PATH_ENV} is required.
     *
     * @param env the environment, usually {@code System.getenv()}
     * @return the configuration
     * @throws IllegalStateException    if the root path is not set
     * @throws IllegalArgumentException if the handler timeout is not a positive
     *                                  number
     */
    public static ConfigData fromEnvironment(Map<String, String> env) {
        String root = env.get(ROOT_PATH_ENV);
        if (root == null || root.isBlank()) {
            throw new IllegalStateException(ROOT_PATH_ENV + " environment variable is not set.");
        }
        String directory = valueOr(env, WATCH_DIRECTORY_ENV, DEFAULT_WATCH_DIRECTORY);
        String namespace = valueOr(env, NAMESPACE_ENV, DEFAULT_NAMESPACE);
        return new ConfigData(
                Path.of(root),
                directory,
                Path.of(valueOr(env, AUDIT_LOG_ENV, DEFAULT_AUDIT_LOG)),
                namespace,
                valueOr(env, PATTERN_ENV, namespace + "/" + directory + "/#"),
                timeout(env.get(HANDLER_TIMEOUT_ENV)));
    }

    private static String valueOr(Map<String, String> env, String name, String fallback) {
        String value = env.get(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static Duration timeout(String millis) {
        if (millis == null || millis.isBlank()) {
            return null;
        }
        try {
            long value = Long.parseLong(millis.trim());
            if (value <= 0) {
                throw new IllegalArgumentException(HANDLER_TIMEOUT_ENV + " must be positive: " + millis);
            }
            return Duration.ofMillis(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(HANDLER_TIMEOUT_ENV + " is not a number: " + millis, e);
        }
    }
}
