package com.p14n.filebroker.topic;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicTest {

    @Test
    void shouldSplitOnSeparator() {
        Topic topic = Topic.parse("files/important_stuff/modified");
        assertEquals(List.of("files", "important_stuff", "modified"), topic.segments());
        assertEquals(3, topic.depth());
    }

    @Test
    void shouldKeepDotsInsideSegments() {
        assertEquals(List.of("files", "x.txt"), Topic.parse("files/x.txt").segments());
    }

    @Test
    void shouldRejectEmptyText() {
        assertThrows(InvalidTopicException.class, () -> Topic.parse(""));
        assertThrows(InvalidTopicException.class, () -> Topic.parse(null));
    }

    @Test
    void shouldTreatWhitespaceAsAnOrdinarySegment() {
        assertEquals(List.of("   "), Topic.parse("   ").segments());
        assertEquals(List.of("a", " "), Topic.parse("a/ ").segments());
    }

    @Test
    void shouldRejectEmptySegments() {
        assertThrows(InvalidTopicException.class, () -> Topic.parse("/files"));
        assertThrows(InvalidTopicException.class, () -> Topic.parse("files/"));
        assertThrows(InvalidTopicException.class, () -> Topic.parse("files//modified"));
        assertThrows(InvalidTopicException.class, () -> Topic.parse("/"));
    }

    @Test
    void shouldRejectWildcards() {
        var e = assertThrows(InvalidTopicException.class, () -> Topic.parse("files/*"));
        assertEquals("files/*", e.topic());
        assertThrows(InvalidTopicException.class, () -> Topic.parse("files/#"));
        assertThrows(InvalidTopicException.class, () -> Topic.of("files", "a#b"));
    }

    @Test
    void shouldAppendChild() {
        Topic parent = Topic.of("files", "important_stuff");
        Topic child = parent.child("modified");
        assertEquals("files/important_stuff/modified", child.toString());
        assertEquals("files/important_stuff", parent.toString());
        assertThrows(InvalidTopicException.class, () -> parent.child(""));
    }

    @Test
    void shouldBeImmutable() {
        var segments = new java.util.ArrayList<>(List.of("a", "b"));
        Topic topic = new Topic(segments);
        segments.add("c");
        assertEquals(2, topic.depth());
        assertThrows(UnsupportedOperationException.class, () -> topic.segments().add("d"));
    }

    @Property
    void parseThenJoinReproducesText(@ForAll("topicTexts") String text) {
        assertEquals(text, Topic.parse(text).toString());
    }

    @Provide
    Arbitrary<String> topicTexts() {
        Arbitrary<String> segment = Arbitraries.strings()
                .alpha().numeric().withChars('_', '.', '-')
                .ofMinLength(1).ofMaxLength(8);
        return segment.list().ofMinSize(1).ofMaxSize(6).map(l -> String.join("/", l));
    }
}
