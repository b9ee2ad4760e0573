package com.p14n.filebroker.data;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

import com.p14n.filebroker.topic.Topic;

/**
 * Immutable message delivered to every matching subscriber and to the audit
 * sink. The payload is copied on the way in and on the way out, so a handler
 * cannot change what the next handler sees.
 */
public final class Message implements Traceable {

    private final String id;
    private final Topic topic;
    private final byte[] payload;
    private final Instant timestamp;
    private final String sourcePath;
    private final String traceparent;

    public Message(String id, Topic topic, byte[] payload, Instant timestamp, String sourcePath,
            String traceparent) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        this.id = id;
        this.topic = topic;
        this.payload = payload == null ? new byte[0] : payload.clone();
        this.timestamp = timestamp;
        this.sourcePath = sourcePath;
        this.traceparent = traceparent;
    }

    /**
     * Creates a message with a random id and the current time.
     */
    public static Message create(Topic topic, byte[] payload, String sourcePath, String traceparent) {
        return new Message(UUID.randomUUID().toString(), topic, payload, Instant.now(), sourcePath, traceparent);
    }

    public static Message create(Topic topic, byte[] payload) {
        return create(topic, payload, null, null);
    }

    public static Message create(Topic topic, String payload) {
        return create(topic, payload.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String id() {
        return id;
    }

    public Topic topicName() {
        return topic;
    }

    @Override
    public String topic() {
        return topic.toString();
    }

    public byte[] payload() {
        return payload.clone();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String sourcePath() {
        return sourcePath;
    }

    @Override
    public String subject() {
        return sourcePath == null ? "" : sourcePath;
    }

    @Override
    public String traceparent() {
        return traceparent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message other)) {
            return false;
        }
        return id.equals(other.id)
                && topic.equals(other.topic)
                && Arrays.equals(payload, other.payload)
                && timestamp.equals(other.timestamp)
                && Objects.equals(sourcePath, other.sourcePath)
                && Objects.equals(traceparent, other.traceparent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, topic, timestamp, sourcePath, traceparent) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Message[id=" + id + ", topic=" + topic + ", sourcePath=" + sourcePath
                + ", timestamp=" + timestamp + ", payload=" + payload.length + " bytes]";
    }
}
