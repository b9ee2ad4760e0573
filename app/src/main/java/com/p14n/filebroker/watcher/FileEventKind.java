package com.p14n.filebroker.watcher;

/**
 * Kind of filesystem change; {@link #topicSegment()} is the last segment of
 * the event topic.
 */
public enum FileEventKind {
    CREATED("created"),
    MODIFIED("modified"),
    DELETED("deleted");

    private final String topicSegment;

    FileEventKind(String topicSegment) {
        this.topicSegment = topicSegment;
    }

    public String topicSegment() {
        return topicSegment;
    }
}
