package com.p14n.filebroker.topic;

import java.util.ArrayList;
import java.util.List;

/**
 * A concrete hierarchical topic name such as
 * {@code files/important_stuff/modified}.
 *
 * <p>
 * A topic is an ordered, non-empty list of non-empty segments separated by
 * {@link #LEVEL_SEPARATOR}. Wildcard characters are reserved for
 * {@link TopicPattern} and may not appear in a topic.
 * </p>
 */
public record Topic(List<String> segments) {

    public static final String LEVEL_SEPARATOR = "/";

    public Topic {
        if (segments == null || segments.isEmpty()) {
            throw new InvalidTopicException(null, "a topic needs at least one segment");
        }
        String text = String.join(LEVEL_SEPARATOR, segments);
        for (String segment : segments) {
            validateSegment(text, segment);
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parses a topic name.
     *
     * @param text the topic name, segments separated by {@code /}
     * @return the parsed topic
     * @throws InvalidTopicException if the text is null, empty or has an empty
     *                               or wildcard segment
     */
    public static Topic parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidTopicException(text, "topic cannot be empty");
        }
        return new Topic(split(text));
    }

    /**
     * Builds a topic from already separated segments.
     */
    public static Topic of(String... segments) {
        return new Topic(List.of(segments));
    }

    /**
     * Returns a new topic with the given segment appended.
     */
    public Topic child(String segment) {
        List<String> next = new ArrayList<>(segments);
        next.add(segment);
        return new Topic(next);
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        return String.join(LEVEL_SEPARATOR, segments);
    }

    // String.split drops trailing empty strings unless the limit is negative
    static List<String> split(String text) {
        return List.of(text.split(LEVEL_SEPARATOR, -1));
    }

    private static void validateSegment(String text, String segment) {
        if (segment == null || segment.isEmpty()) {
            throw new InvalidTopicException(text, "empty segment");
        }
        if (segment.contains(TopicPattern.SINGLE_LEVEL_WILDCARD)
                || segment.contains(TopicPattern.MULTI_LEVEL_WILDCARD)) {
            throw new InvalidTopicException(text, "wildcards are only allowed in patterns");
        }
    }
}
