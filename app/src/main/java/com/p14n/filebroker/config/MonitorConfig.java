package com.p14n.filebroker.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the file monitor: what to watch, where to write the audit
 * log and how change events are named.
 */
public interface MonitorConfig {

    String DEFAULT_WATCH_DIRECTORY = "important_stuff";
    String DEFAULT_AUDIT_LOG = "file_change_audit.log";
    String DEFAULT_NAMESPACE = "files";

    /**
     * Gets the root of the file server. Topics and payload paths are relative
     * to it.
     *
     * @return The root path
     */
    Path rootPath();

    /**
     * Gets the directory, relative to {@link #rootPath()}, that is watched
     * recursively.
     *
     * @return The directory name
     */
    String watchDirectory();

    /**
     * Gets the file that receives one audit line per change.
     *
     * @return The audit log path
     */
    Path auditLogPath();

    /**
     * Gets the first topic segment of every change event.
     *
     * @return The topic namespace
     */
    String topicNamespace();

    /**
     * Gets the pattern the audit consumer subscribes to. Defaults to every
     * change below the watched directory.
     *
     * @return The subscription pattern
     */
    default String subscriptionPattern() {
        return topicNamespace() + "/" + watchDirectory() + "/#";
    }

    /**
     * Gets the per-subscriber timeout, or null to let subscribers run as long
     * as they need.
     *
     * @return The handler timeout
     */
    Duration handlerTimeout();

    default Path monitoringPath() {
        return rootPath().resolve(watchDirectory());
    }
}
