package com.p14n.filebroker.topic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A subscription pattern: a topic template that may contain wildcards.
 *
 * <ul>
 * <li>{@code *} matches exactly one topic segment</li>
 * <li>{@code #} matches zero or more trailing segments and must be the final
 * segment</li>
 * </ul>
 *
 * <p>
 * Example patterns: {@code files/important_stuff/*}, {@code files/#},
 * {@code files/*}{@code /modified}.
 * </p>
 */
public final class TopicPattern {

    public static final String SINGLE_LEVEL_WILDCARD = "*";
    public static final String MULTI_LEVEL_WILDCARD = "#";

    /**
     * One level of a pattern.
     */
    public interface Segment {
    }

    public record Literal(String value) implements Segment {
        @Override
        public String toString() {
            return value;
        }
    }

    public record SingleLevel() implements Segment {
        @Override
        public String toString() {
            return SINGLE_LEVEL_WILDCARD;
        }
    }

    public record MultiLevel() implements Segment {
        @Override
        public String toString() {
            return MULTI_LEVEL_WILDCARD;
        }
    }

    private static final Segment ANY_ONE = new SingleLevel();
    private static final Segment ANY_REMAINING = new MultiLevel();

    private final String text;
    private final List<Segment> segments;

    private TopicPattern(String text, List<Segment> segments) {
        this.text = text;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * Parses pattern text. The empty string parses to the empty pattern, which
     * only matches an empty list of segments.
     *
     * @param text the pattern text
     * @return the parsed pattern
     * @throws InvalidPatternException if {@code #} is not the single, final
     *                                 segment, a wildcard is mixed with other
     *                                 characters, or a segment is empty
     */
    public static TopicPattern parse(String text) {
        if (text == null) {
            throw new InvalidPatternException(null, "pattern cannot be null");
        }
        if (text.isEmpty()) {
            return new TopicPattern(text, List.of());
        }
        List<String> levels = Topic.split(text);
        List<Segment> segments = new ArrayList<>(levels.size());
        for (int i = 0; i < levels.size(); i++) {
            String level = levels.get(i);
            if (level.isEmpty()) {
                throw new InvalidPatternException(text, "empty segment at position " + i);
            }
            if (level.equals(MULTI_LEVEL_WILDCARD)) {
                if (i != levels.size() - 1) {
                    throw new InvalidPatternException(text, "'#' is only allowed as the final segment");
                }
                segments.add(ANY_REMAINING);
            } else if (level.equals(SINGLE_LEVEL_WILDCARD)) {
                segments.add(ANY_ONE);
            } else if (level.contains(MULTI_LEVEL_WILDCARD) || level.contains(SINGLE_LEVEL_WILDCARD)) {
                throw new InvalidPatternException(text, "wildcard must occupy a whole segment: " + level);
            } else {
                segments.add(new Literal(level));
            }
        }
        return new TopicPattern(text, segments);
    }

    public List<Segment> segments() {
        return segments;
    }

    public String text() {
        return text;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * @return true if this pattern has no wildcard segments
     */
    public boolean isLiteral() {
        return segments.stream().allMatch(s -> s instanceof Literal);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TopicPattern other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
