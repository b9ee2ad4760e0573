package com.p14n.filebroker.broker;

import com.p14n.filebroker.data.Message;

/**
 * A subscriber that receives the messages matching its subscription pattern.
 */
@FunctionalInterface
public interface MessageSubscriber {

    /**
     * Called once for every published message whose topic matches the
     * subscription. The message must be treated as read-only.
     *
     * @param message The message to process
     * @throws Exception if the message could not be handled; the broker records
     *                   the failure and carries on with the other subscribers
     */
    void onMessage(Message message) throws Exception;

    /**
     * Called after {@link #onMessage(Message)} failed for this subscriber.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }

    /**
     * Name used in logs and subscription listings.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
