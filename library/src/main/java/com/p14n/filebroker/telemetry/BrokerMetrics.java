package com.p14n.filebroker.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for broker activity.
 *
 * <ul>
 * <li>messages_published: messages accepted by publish, per topic</li>
 * <li>messages_delivered: successful handler invocations, per topic</li>
 * <li>delivery_failures: handler invocations that threw or timed out, per
 * topic</li>
 * <li>audit_failures: audit appends that failed, per topic</li>
 * <li>active_subscriptions: current subscriptions, per pattern</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> PATTERN = AttributeKey.stringKey("pattern");

        private final LongCounter publishedMessages;
        private final LongCounter deliveredMessages;
        private final LongCounter deliveryFailures;
        private final LongCounter auditFailures;
        private final LongUpDownCounter activeSubscriptions;

        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of messages handled successfully by subscribers")
                                .build();

                deliveryFailures = meter.counterBuilder("delivery_failures")
                                .setDescription("Number of subscriber invocations that failed")
                                .build();

                auditFailures = meter.counterBuilder("audit_failures")
                                .setDescription("Number of audit appends that failed")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active subscriptions")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic) {
                deliveredMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDeliveryFailure(String topic) {
                deliveryFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordAuditFailure(String topic) {
                auditFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriptionAdded(String pattern) {
                activeSubscriptions.add(1, Attributes.of(PATTERN, pattern));
        }

        public void recordSubscriptionRemoved(String pattern) {
                activeSubscriptions.add(-1, Attributes.of(PATTERN, pattern));
        }
}
