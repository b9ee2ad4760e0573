package com.p14n.filebroker.watcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.filebroker.broker.DeliveryOutcome;
import com.p14n.filebroker.broker.DeliveryReport;
import com.p14n.filebroker.broker.MessageBroker;
import com.p14n.filebroker.data.Message;
import com.p14n.filebroker.telemetry.OpenTelemetryFunctions;
import com.p14n.filebroker.topic.InvalidTopicException;
import com.p14n.filebroker.topic.Topic;

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import io.opentelemetry.api.OpenTelemetry;

/**
 * Watches a directory tree and publishes a message for every file that is
 * created, modified or deleted.
 *
 * <p>
 * The topic is the namespace, then the directories from the root path down to
 * the file, then the event kind: a change to
 * {@code <root>/important_stuff/x.txt} is published to
 * {@code files/important_stuff/modified}. Events are published directly from
 * the watcher thread, one at a time, so nothing is buffered in between.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var monitor = new FileChangeMonitor(broker, root, root.resolve("important_stuff"), "files", ot);
 * monitor.start();
 * // ...
 * monitor.close();
 * }</pre>
 */
public class FileChangeMonitor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FileChangeMonitor.class);

    private final MessageBroker broker;
    private final Path rootPath;
    private final Path watchPath;
    private final Topic namespace;
    private final FileDiffer differ;
    private final OpenTelemetry ot;
    private final Clock clock;

    private ExecutorService watcherExecutor;
    private DirectoryWatcher watcher;
    private CompletableFuture<Void> watching;
    private volatile boolean running = false;

    public FileChangeMonitor(MessageBroker broker, Path rootPath, Path watchPath, String namespace,
            OpenTelemetry ot) {
        this(broker, rootPath, watchPath, namespace, new FileDiffer(), ot, Clock.systemDefaultZone());
    }

    public FileChangeMonitor(MessageBroker broker, Path rootPath, Path watchPath, String namespace,
            FileDiffer differ, OpenTelemetry ot, Clock clock) {
        this.broker = broker;
        this.rootPath = rootPath.toAbsolutePath().normalize();
        this.watchPath = watchPath.toAbsolutePath().normalize();
        this.namespace = Topic.parse(namespace);
        this.differ = differ;
        this.ot = ot;
        this.clock = clock;
    }

    /**
     * Starts watching on a dedicated thread.
     *
     * @throws IOException if the directory does not exist or cannot be watched
     */
    public void start() throws IOException {
        if (running) {
            throw new IllegalStateException("Already started");
        }
        if (!Files.isDirectory(watchPath)) {
            throw new NoSuchFileException(watchPath.toString(), null, "directory to watch does not exist");
        }
        logger.atInfo().log("Starting file change monitor on {}", watchPath);

        differ.rememberAll(watchPath);
        watcher = DirectoryWatcher.builder()
                .path(watchPath)
                .listener(this::handleEvent)
                .build();
        watcherExecutor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("file-watcher-%d").setDaemon(true).build());
        running = true;
        watching = watcher.watchAsync(watcherExecutor);
    }

    public boolean isRunning() {
        return running;
    }

    void handleEvent(DirectoryChangeEvent event) {
        if (!running || event.isDirectory()) {
            return;
        }
        switch (event.eventType()) {
            case CREATE -> onFileEvent(event.path(), FileEventKind.CREATED);
            case MODIFY -> onFileEvent(event.path(), FileEventKind.MODIFIED);
            case DELETE -> onFileEvent(event.path(), FileEventKind.DELETED);
            default -> logger.atWarn().log("Watcher reported {} for {}, some changes may have been missed",
                    event.eventType(), event.path());
        }
    }

    /**
     * Publishes one file change. Directories and files outside the root are
     * skipped, as are paths whose directory names cannot be used as topic
     * segments.
     *
     * @param path the changed file
     * @param kind what happened to it
     * @return the delivery report, empty if nothing was published
     */
    public Optional<DeliveryReport> onFileEvent(Path path, FileEventKind kind) {
        Path file = path.toAbsolutePath().normalize();
        if (kind != FileEventKind.DELETED && Files.isDirectory(file)) {
            return Optional.empty();
        }
        if (!file.startsWith(rootPath)) {
            logger.atWarn().log("Ignoring change outside {}: {}", rootPath, file);
            return Optional.empty();
        }

        Topic topic;
        try {
            topic = topicFor(file, kind);
        } catch (InvalidTopicException e) {
            logger.atWarn().setCause(e).log("Cannot name a topic for {}", file);
            return Optional.empty();
        }

        Instant now = clock.instant();
        FileChange change = new FileChange(relativePath(file), kind, diffFor(file, kind),
                FileChange.TIMESTAMP_FORMAT.format(now));
        Message message = new Message(UUID.randomUUID().toString(), topic, change.toJson(), now,
                file.toString(), OpenTelemetryFunctions.serializeTraceContext(ot));

        try {
            DeliveryReport report = broker.publish(message);
            logReport(report);
            return Optional.of(report);
        } catch (IllegalStateException e) {
            logger.atWarn().log("Broker closed, dropping {} of {}", kind, file);
            return Optional.empty();
        }
    }

    /**
     * Builds {@code <namespace>/<directories below root>/<kind>} for a file.
     */
    Topic topicFor(Path file, FileEventKind kind) {
        Topic topic = namespace;
        Path relative = rootPath.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            topic = topic.child(relative.getName(i).toString());
        }
        return topic.child(kind.topicSegment());
    }

    String relativePath(Path file) {
        Path relative = rootPath.relativize(file);
        List<String> names = new ArrayList<>(relative.getNameCount());
        relative.forEach(name -> names.add(name.toString()));
        return String.join("/", names);
    }

    private String diffFor(Path file, FileEventKind kind) {
        if (kind == FileEventKind.DELETED) {
            differ.forget(file);
            return null;
        }
        try {
            return differ.diff(file);
        } catch (IOException e) {
            logger.atWarn().log("Could not read {} for a diff: {}", file, e.getMessage());
            return null;
        }
    }

    private void logReport(DeliveryReport report) {
        logger.atDebug().log("{} delivered to {} subscription(s)", report.message().topic(),
                report.matchedCount());
        for (DeliveryOutcome failure : report.failures()) {
            logger.atWarn().log("Subscription {} ({}) failed for {}: {}", failure.subscriptionId(),
                    failure.subscriberName(), report.message().topic(), failure.error().toString());
        }
        if (!report.audit().succeeded()) {
            logger.atError().log("Change to {} was not written to the audit log: {}",
                    report.message().sourcePath(), report.audit().error().toString());
        }
    }

    /**
     * Stops watching. A publish already running on the watcher thread is left
     * to finish.
     */
    @Override
    public void close() throws IOException {
        if (!running) {
            return;
        }
        running = false;
        logger.atInfo().log("Stopping file change monitor on {}", watchPath);
        try {
            watcher.close();
            watching.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.atWarn().setCause(e).log("Watcher did not stop cleanly");
        } finally {
            watcherExecutor.shutdown();
        }
    }
}
