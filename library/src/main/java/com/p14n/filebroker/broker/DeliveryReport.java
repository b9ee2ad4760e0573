package com.p14n.filebroker.broker;

import java.util.List;
import java.util.Optional;

import com.p14n.filebroker.data.Message;

/**
 * Summary of one publish call: what was delivered to whom and whether the
 * audit append worked. Deliveries are in subscription id order.
 */
public record DeliveryReport(Message message, List<DeliveryOutcome> deliveries, AuditOutcome audit) {

    public DeliveryReport {
        deliveries = List.copyOf(deliveries);
    }

    public int matchedCount() {
        return deliveries.size();
    }

    public List<DeliveryOutcome> failures() {
        return deliveries.stream().filter(d -> !d.succeeded()).toList();
    }

    public Optional<DeliveryOutcome> outcomeFor(long subscriptionId) {
        return deliveries.stream().filter(d -> d.subscriptionId() == subscriptionId).findFirst();
    }

    /**
     * @return true if every matched subscriber handled the message and the
     *         audit append succeeded
     */
    public boolean allDelivered() {
        return audit.succeeded() && deliveries.stream().allMatch(DeliveryOutcome::succeeded);
    }
}
