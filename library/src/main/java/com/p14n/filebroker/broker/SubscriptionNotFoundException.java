package com.p14n.filebroker.broker;

/**
 * A subscription id was looked up that the registry does not hold.
 */
public class SubscriptionNotFoundException extends RuntimeException {

    private final long subscriptionId;

    public SubscriptionNotFoundException(long subscriptionId) {
        super("No subscription with id " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }

    public long subscriptionId() {
        return subscriptionId;
    }
}
