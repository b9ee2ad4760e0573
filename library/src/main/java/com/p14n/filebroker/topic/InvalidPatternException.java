package com.p14n.filebroker.topic;

/**
 * Thrown when subscription pattern text cannot be parsed into a
 * {@link TopicPattern}.
 */
public class InvalidPatternException extends IllegalArgumentException {

    private final String pattern;

    public InvalidPatternException(String pattern, String reason) {
        super("Invalid pattern '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    /**
     * @return the text that failed to parse, may be null
     */
    public String pattern() {
        return pattern;
    }
}
