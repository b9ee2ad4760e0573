package com.p14n.filebroker.broker;

import java.time.Duration;

/**
 * Recorded when a subscriber did not finish within the broker's handler
 * timeout.
 */
public class HandlerTimeoutException extends Exception {

    private final long subscriptionId;
    private final Duration timeout;

    public HandlerTimeoutException(long subscriptionId, Duration timeout) {
        super("Subscription " + subscriptionId + " did not complete within " + timeout.toMillis() + "ms");
        this.subscriptionId = subscriptionId;
        this.timeout = timeout;
    }

    public long subscriptionId() {
        return subscriptionId;
    }

    public Duration timeout() {
        return timeout;
    }
}
