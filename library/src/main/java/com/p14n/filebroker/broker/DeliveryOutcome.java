package com.p14n.filebroker.broker;

/**
 * Result of handing one message to one subscription.
 *
 * @param subscriptionId the subscription the message was delivered to
 * @param subscriberName the subscriber's name
 * @param error          null when the subscriber handled the message
 */
public record DeliveryOutcome(long subscriptionId, String subscriberName, Throwable error) {

    public static DeliveryOutcome delivered(Subscription s) {
        return new DeliveryOutcome(s.id(), s.subscriberName(), null);
    }

    public static DeliveryOutcome failed(Subscription s, Throwable error) {
        return new DeliveryOutcome(s.id(), s.subscriberName(), error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
