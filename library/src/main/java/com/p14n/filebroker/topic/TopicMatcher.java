package com.p14n.filebroker.topic;

import java.util.List;

import com.p14n.filebroker.topic.TopicPattern.Literal;
import com.p14n.filebroker.topic.TopicPattern.MultiLevel;
import com.p14n.filebroker.topic.TopicPattern.Segment;
import com.p14n.filebroker.topic.TopicPattern.SingleLevel;

/**
 * Decides whether a topic matches a subscription pattern.
 *
 * <p>
 * Pattern and topic segments are compared left to right. A literal must be
 * equal to the topic segment (exact, case sensitive), {@code *} consumes
 * exactly one segment and a trailing {@code #} consumes whatever remains,
 * including nothing.
 * </p>
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    public static boolean matches(TopicPattern pattern, Topic topic) {
        return matches(pattern, topic.segments());
    }

    /**
     * Parses both arguments and matches them.
     *
     * @throws InvalidPatternException if the pattern text is invalid
     * @throws InvalidTopicException   if the topic text is invalid
     */
    public static boolean matches(String pattern, String topic) {
        return matches(TopicPattern.parse(pattern), Topic.parse(topic));
    }

    public static boolean matches(TopicPattern pattern, List<String> topicSegments) {
        List<Segment> segments = pattern.segments();
        int level = 0;
        for (Segment segment : segments) {
            if (segment instanceof MultiLevel) {
                return true;
            }
            if (level == topicSegments.size()) {
                return false;
            }
            if (segment instanceof Literal literal && !literal.value().equals(topicSegments.get(level))) {
                return false;
            }
            // SingleLevel accepts whatever is at this level
            assert segment instanceof Literal || segment instanceof SingleLevel;
            level++;
        }
        return level == topicSegments.size();
    }
}
