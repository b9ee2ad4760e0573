package com.p14n.filebroker.data;

/**
 * Something that can be followed through the broker by telemetry.
 *
 * <ul>
 * <li>{@code id}: unique identifier of the message</li>
 * <li>{@code topic}: routing name the message was published to</li>
 * <li>{@code subject}: what the message is about, e.g. the changed file</li>
 * <li>{@code traceparent}: W3C trace context of the publisher, may be null</li>
 * </ul>
 */
public interface Traceable {

    String id();

    String topic();

    String subject();

    String traceparent();
}
