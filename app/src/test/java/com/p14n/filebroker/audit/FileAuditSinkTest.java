package com.p14n.filebroker.audit;

import com.p14n.filebroker.data.Message;
import com.p14n.filebroker.topic.Topic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileAuditSinkTest {

    @TempDir
    Path dir;

    private static Message message(String topic, String source) {
        Instant at = LocalDateTime.of(2024, 12, 6, 12, 30, 45).atZone(ZoneId.systemDefault()).toInstant();
        return new Message("id-" + source, Topic.parse(topic), new byte[0], at, source, null);
    }

    @Test
    void shouldAppendOneLinePerMessage() throws Exception {
        Path log = dir.resolve("logs/audit.log");
        try (var sink = new FileAuditSink(log)) {
            sink.append(message("files/important_stuff/modified", "/srv/important_stuff/x.txt"));
            sink.append(message("files/important_stuff/deleted", "/srv/important_stuff/y.txt"));
        }

        assertEquals(List.of(
                "2024-12-06 12:30:45, files/important_stuff/modified, /srv/important_stuff/x.txt",
                "2024-12-06 12:30:45, files/important_stuff/deleted, /srv/important_stuff/y.txt"),
                Files.readAllLines(log));
    }

    @Test
    void shouldKeepExistingRecords() throws Exception {
        Path log = dir.resolve("audit.log");
        Files.writeString(log, "earlier\n");
        try (var sink = new FileAuditSink(log)) {
            sink.append(message("files/a/created", "/srv/a/z.txt"));
        }
        List<String> lines = Files.readAllLines(log);
        assertEquals(2, lines.size());
        assertEquals("earlier", lines.get(0));
    }

    @Test
    void shouldFlushEachRecord() throws Exception {
        Path log = dir.resolve("audit.log");
        try (var sink = new FileAuditSink(log)) {
            sink.append(message("files/a/created", "/srv/a/z.txt"));
            assertEquals(1, Files.readAllLines(log).size());
        }
    }

    @Test
    void shouldFailAfterClose() throws Exception {
        var sink = new FileAuditSink(dir.resolve("audit.log"));
        sink.close();
        sink.close();
        assertThrows(AuditSinkException.class, () -> sink.append(message("files/a/created", "/srv/a/z.txt")));
    }
}
