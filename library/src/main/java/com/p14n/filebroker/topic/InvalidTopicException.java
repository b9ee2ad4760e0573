package com.p14n.filebroker.topic;

/**
 * Thrown when a topic name cannot be parsed into a {@link Topic}.
 */
public class InvalidTopicException extends IllegalArgumentException {

    private final String topic;

    public InvalidTopicException(String topic, String reason) {
        super("Invalid topic '" + topic + "': " + reason);
        this.topic = topic;
    }

    /**
     * @return the text that failed to parse, may be null
     */
    public String topic() {
        return topic;
    }
}
