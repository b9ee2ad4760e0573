package com.p14n.filebroker.broker;

import java.util.List;
import java.util.Map;

import com.p14n.filebroker.data.Message;

/**
 * Thread-safe, in-process broker that routes messages to the subscriptions
 * whose pattern matches the message topic and records every message in an
 * audit sink.
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Publishes a message to every matching subscription, then appends it to
     * the audit sink. Subscriber and audit failures are reported, not thrown.
     *
     * @param topic   The topic to publish to
     * @param payload The message body
     * @return what happened to each matched subscription and to the audit append
     * @throws com.p14n.filebroker.topic.InvalidTopicException if the topic is not
     *                                                         valid
     * @throws IllegalStateException                           if the broker is
     *                                                         closed
     */
    DeliveryReport publish(String topic, byte[] payload);

    /**
     * Publishes a message that the caller already built.
     */
    DeliveryReport publish(Message message);

    /**
     * Adds a subscriber for every topic that matches the pattern.
     *
     * @param pattern    The pattern to subscribe to, may contain wildcards
     * @param subscriber The subscriber to add
     * @return the new subscription id
     * @throws com.p14n.filebroker.topic.InvalidPatternException if the pattern is
     *                                                           not valid
     */
    long subscribe(String pattern, MessageSubscriber subscriber);

    /**
     * Removes a subscription. Publishes already running still complete their
     * delivery to it.
     *
     * @param subscriptionId The id returned by {@link #subscribe}
     * @return true if the subscription was removed, false if it wasn't present
     */
    boolean unsubscribe(long subscriptionId);

    /**
     * @return pattern text to subscriber names
     */
    Map<String, List<String>> subscriptions();

    /**
     * Closes the broker once in-flight publishes have finished. After closing,
     * no more messages can be published or subscribers added.
     */
    @Override
    void close();
}
