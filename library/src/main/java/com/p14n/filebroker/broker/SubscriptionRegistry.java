package com.p14n.filebroker.broker;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.filebroker.topic.Topic;
import com.p14n.filebroker.topic.TopicMatcher;
import com.p14n.filebroker.topic.TopicPattern;

/**
 * Holds every live {@link Subscription}, grouped by pattern text so that a
 * pattern shared by several subscribers is matched once per topic.
 *
 * <p>
 * Thread-safe. Lookups take a read lock and mutations a write lock, so
 * {@link #findMatching(Topic)} never sees a half-added or half-removed
 * subscription. Results are ordered by ascending subscription id.
 * </p>
 */
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong nextId = new AtomicLong(1);

    // guarded by lock
    private final Map<String, PatternSubscriptions> byPattern = new LinkedHashMap<>();
    private final Map<Long, Subscription> byId = new HashMap<>();

    private static final class PatternSubscriptions {
        private final TopicPattern pattern;
        private final TreeMap<Long, Subscription> subscriptions = new TreeMap<>();

        private PatternSubscriptions(TopicPattern pattern) {
            this.pattern = pattern;
        }
    }

    /**
     * Registers a subscriber for every topic matching the pattern.
     *
     * @param patternText pattern text, may contain {@code *} and a trailing
     *                    {@code #}
     * @param subscriber  the handler to invoke
     * @return a new subscription id, unique for the life of this registry
     * @throws com.p14n.filebroker.topic.InvalidPatternException if the pattern
     *                                                           does not parse
     */
    public long subscribe(String patternText, MessageSubscriber subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        TopicPattern pattern = TopicPattern.parse(patternText);
        Subscription subscription = new Subscription(nextId.getAndIncrement(), pattern, subscriber);

        lock.writeLock().lock();
        try {
            byPattern.computeIfAbsent(pattern.text(), k -> new PatternSubscriptions(pattern))
                    .subscriptions.put(subscription.id(), subscription);
            byId.put(subscription.id(), subscription);
        } finally {
            lock.writeLock().unlock();
        }
        logger.atDebug().log("Subscription {} added for pattern '{}' ({})", subscription.id(), pattern,
                subscriber.name());
        return subscription.id();
    }

    /**
     * Removes a subscription. Unknown ids are ignored.
     *
     * @return the removed subscription, empty if the id was not registered
     */
    public Optional<Subscription> unsubscribe(long subscriptionId) {
        lock.writeLock().lock();
        try {
            Subscription removed = byId.remove(subscriptionId);
            if (removed == null) {
                logger.atDebug().log("Unsubscribe ignored, no subscription with id {}", subscriptionId);
                return Optional.empty();
            }
            PatternSubscriptions group = byPattern.get(removed.patternText());
            group.subscriptions.remove(subscriptionId);
            if (group.subscriptions.isEmpty()) {
                byPattern.remove(removed.patternText());
            }
            return Optional.of(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws SubscriptionNotFoundException if no subscription has this id
     */
    public Subscription subscription(long subscriptionId) {
        lock.readLock().lock();
        try {
            Subscription s = byId.get(subscriptionId);
            if (s == null) {
                throw new SubscriptionNotFoundException(subscriptionId);
            }
            return s;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds every subscription whose pattern matches the topic.
     *
     * @return a snapshot ordered by ascending subscription id
     */
    public List<Subscription> findMatching(Topic topic) {
        List<Subscription> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (PatternSubscriptions group : byPattern.values()) {
                if (TopicMatcher.matches(group.pattern, topic)) {
                    matched.addAll(group.subscriptions.values());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        matched.sort(Comparator.comparingLong(Subscription::id));
        return matched;
    }

    /**
     * @return pattern text to subscriber names, in registration order
     */
    public Map<String, List<String>> listSubscriptions() {
        Map<String, List<String>> listing = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            byPattern.forEach((text, group) -> listing.put(text,
                    group.subscriptions.values().stream().map(Subscription::subscriberName).toList()));
        } finally {
            lock.readLock().unlock();
        }
        return listing;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every subscription.
     *
     * @return the subscriptions that were removed
     */
    public List<Subscription> clear() {
        lock.writeLock().lock();
        try {
            List<Subscription> removed = new ArrayList<>(byId.values());
            byId.clear();
            byPattern.clear();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
