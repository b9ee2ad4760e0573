package com.p14n.filebroker.audit;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.filebroker.data.Message;
import com.p14n.filebroker.watcher.FileChange;

/**
 * Appends one line per message to a text file:
 * {@code <yyyy-MM-dd HH:mm:ss>, <topic>, <source path>}. Each line is flushed
 * before {@link #append(Message)} returns.
 */
public class FileAuditSink implements AuditSink, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FileAuditSink.class);

    private final Path logPath;
    private final BufferedWriter writer;
    private boolean closed = false;

    public FileAuditSink(Path logPath) throws IOException {
        this.logPath = logPath.toAbsolutePath();
        Path parent = this.logPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(this.logPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        logger.atInfo().log("Appending audit records to {}", this.logPath);
    }

    static String format(Message message) {
        String source = message.sourcePath() == null ? "" : message.sourcePath();
        return FileChange.TIMESTAMP_FORMAT.format(message.timestamp()) + ", " + message.topic() + ", " + source;
    }

    @Override
    public synchronized void append(Message message) throws AuditSinkException {
        if (closed) {
            throw new AuditSinkException("Audit log " + logPath + " is closed");
        }
        try {
            writer.write(format(message));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new AuditSinkException("Failed to append to audit log " + logPath, e);
        }
    }

    public Path logPath() {
        return logPath;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.close();
    }
}
