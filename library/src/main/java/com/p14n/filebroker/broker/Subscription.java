package com.p14n.filebroker.broker;

import com.p14n.filebroker.topic.TopicPattern;

/**
 * A registered interest in the topics matching {@code pattern}. Only the
 * {@link SubscriptionRegistry} creates these; callers keep the id.
 */
public record Subscription(long id, TopicPattern pattern, MessageSubscriber subscriber) {

    public String patternText() {
        return pattern.text();
    }

    public String subscriberName() {
        return subscriber.name();
    }
}
