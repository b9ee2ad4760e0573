package com.p14n.filebroker.broker;

import com.p14n.filebroker.topic.InvalidPatternException;
import com.p14n.filebroker.topic.Topic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;

    private static MessageSubscriber named(String name) {
        return new MessageSubscriber() {
            @Override
            public void onMessage(com.p14n.filebroker.data.Message message) {
            }

            @Override
            public String name() {
                return name;
            }
        };
    }

    private static List<Long> ids(List<Subscription> subscriptions) {
        return subscriptions.stream().map(Subscription::id).toList();
    }

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
    }

    @Test
    void shouldGiveEverySubscriptionItsOwnId() {
        long first = registry.subscribe("files/#", named("a"));
        long second = registry.subscribe("files/#", named("a"));
        assertNotEquals(first, second);
        assertEquals(2, registry.size());
    }

    @Test
    void shouldPropagateInvalidPatterns() {
        assertThrows(InvalidPatternException.class, () -> registry.subscribe("files/#/x", named("a")));
        assertThrows(IllegalArgumentException.class, () -> registry.subscribe("files/#", null));
        assertEquals(0, registry.size());
    }

    @Test
    void shouldFindMatchingSubscriptionsInIdOrder() {
        long wide = registry.subscribe("#", named("wide"));
        long exact = registry.subscribe("files/important_stuff/modified", named("exact"));
        long other = registry.subscribe("files/other/#", named("other"));
        long star = registry.subscribe("files/important_stuff/*", named("star"));
        long wideAgain = registry.subscribe("#", named("wide-again"));

        List<Subscription> matched = registry.findMatching(Topic.parse("files/important_stuff/modified"));

        assertEquals(List.of(wide, exact, star, wideAgain), ids(matched));
        assertFalse(ids(matched).contains(other));
    }

    @Test
    void shouldReturnTheSameOrderOnRepeatedCalls() {
        for (int i = 0; i < 10; i++) {
            registry.subscribe(i % 2 == 0 ? "a/*" : "a/#", named("s" + i));
        }
        Topic topic = Topic.parse("a/b");
        List<Long> first = ids(registry.findMatching(topic));
        assertEquals(10, first.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(first, ids(registry.findMatching(topic)));
        }
    }

    @Test
    void shouldRemoveOnlyTheUnsubscribedId() {
        long first = registry.subscribe("a/*", named("first"));
        long second = registry.subscribe("a/*", named("second"));

        assertTrue(registry.unsubscribe(first).isPresent());

        assertEquals(List.of(second), ids(registry.findMatching(Topic.parse("a/b"))));
        assertEquals(Map.of("a/*", List.of("second")), registry.listSubscriptions());
    }

    @Test
    void unsubscribingAnUnknownIdIsANoOp() {
        long id = registry.subscribe("a/*", named("first"));
        assertTrue(registry.unsubscribe(id).isPresent());
        assertTrue(registry.unsubscribe(id).isEmpty());
        assertTrue(registry.unsubscribe(12345).isEmpty());
        assertTrue(registry.listSubscriptions().isEmpty());
    }

    @Test
    void shouldReportUnknownIdsOnLookup() {
        long id = registry.subscribe("a/*", named("first"));
        assertEquals("first", registry.subscription(id).subscriberName());
        var e = assertThrows(SubscriptionNotFoundException.class, () -> registry.subscription(id + 1));
        assertEquals(id + 1, e.subscriptionId());
    }

    @Test
    void shouldListSubscriptionsByPattern() {
        registry.subscribe("topicA", named("TestConsumer"));
        registry.subscribe("topicB", named("TestConsumer"));
        registry.subscribe("topicA", named("NewConsumer"));

        Map<String, List<String>> expected = Map.of(
                "topicA", List.of("TestConsumer", "NewConsumer"),
                "topicB", List.of("TestConsumer"));
        assertEquals(expected, registry.listSubscriptions());
    }

    @Test
    void clearShouldDropEverything() {
        registry.subscribe("a/*", named("first"));
        registry.subscribe("b/#", named("second"));
        assertEquals(2, registry.clear().size());
        assertEquals(0, registry.size());
        assertTrue(registry.findMatching(Topic.parse("a/b")).isEmpty());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void matchingShouldSeeWholeSubscriptionsWhileOthersChange() throws InterruptedException {
        long stable = registry.subscribe("a/#", named("stable"));
        Topic topic = Topic.parse("a/b");
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(2);

        Thread writer = new Thread(() -> {
            try {
                List<Long> added = new ArrayList<>();
                for (int i = 0; i < 2_000; i++) {
                    added.add(registry.subscribe(i % 2 == 0 ? "a/*" : "a/#", named("w" + i)));
                    if (added.size() > 10) {
                        registry.unsubscribe(added.remove(0));
                    }
                }
            } catch (Throwable t) {
                failure.compareAndSet(null, t);
            } finally {
                running.set(false);
                done.countDown();
            }
        });
        Thread reader = new Thread(() -> {
            try {
                while (running.get()) {
                    List<Subscription> matched = registry.findMatching(topic);
                    assertEquals(stable, matched.get(0).id());
                    List<Long> ids = ids(matched);
                    List<Long> sorted = new ArrayList<>(ids);
                    sorted.sort(Long::compare);
                    assertEquals(sorted, ids);
                    for (Subscription s : matched) {
                        assertNotNull(s.subscriber());
                        assertNotNull(s.pattern());
                    }
                }
            } catch (Throwable t) {
                failure.compareAndSet(null, t);
            } finally {
                done.countDown();
            }
        });
        writer.start();
        reader.start();

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertNull(failure.get());
    }
}
