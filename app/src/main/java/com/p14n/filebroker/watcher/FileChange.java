package com.p14n.filebroker.watcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.filebroker.data.Message;

/**
 * Payload of a file change message, carried as JSON.
 *
 * @param path      the file, relative to the file server root, with {@code /}
 *                  separators
 * @param kind      what happened to it
 * @param diff      unified line diff for creations and modifications, null for
 *                  deletions or unreadable files
 * @param timestamp local time of the change, {@code yyyy-MM-dd HH:mm:ss}
 */
public record FileChange(String path, FileEventKind kind, String diff, String timestamp) {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public byte[] toJson() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize change to " + path, e);
        }
    }

    public static FileChange fromJson(byte[] json) {
        try {
            return MAPPER.readValue(json, FileChange.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Payload is not a file change", e);
        }
    }

    public static FileChange from(Message message) {
        return fromJson(message.payload());
    }
}
