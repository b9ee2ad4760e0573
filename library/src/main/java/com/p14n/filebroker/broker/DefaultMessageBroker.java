package com.p14n.filebroker.broker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.filebroker.audit.AuditSink;
import com.p14n.filebroker.audit.AuditSinkException;
import com.p14n.filebroker.data.Message;
import com.p14n.filebroker.telemetry.BrokerMetrics;
import com.p14n.filebroker.topic.Topic;

import static com.p14n.filebroker.telemetry.OpenTelemetryFunctions.processWithTelemetry;
import static com.p14n.filebroker.telemetry.OpenTelemetryFunctions.serializeTraceContext;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * Synchronous fan-out broker.
 *
 * <p>
 * Each publish looks up the matching subscriptions, calls them one after the
 * other in subscription id order, then appends the message to the audit sink.
 * A failing subscriber is recorded in the {@link DeliveryReport} and does not
 * stop delivery to the others, and an audit failure never undoes a delivery.
 * </p>
 *
 * <p>
 * Publishes may come from any thread, concurrently. When built with an
 * {@link AsyncExecutor} and a handler timeout, each subscriber runs on the
 * executor and the broker waits at most the timeout for it; delivery is still
 * one subscriber at a time.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var broker = new DefaultMessageBroker(auditSink, OpenTelemetry.noop(), "files");
 * long id = broker.subscribe("files/important_stuff/*", message -> handle(message));
 * DeliveryReport report = broker.publish("files/important_stuff/modified", payload);
 * }</pre>
 */
public class DefaultMessageBroker implements MessageBroker {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageBroker.class);

    private final SubscriptionRegistry registry;
    private final AuditSink auditSink;
    private final AsyncExecutor asyncExecutor;
    private final Duration handlerTimeout;
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean closed = false;
    private volatile boolean drained = false;

    protected final BrokerMetrics metrics;
    protected final Tracer tracer;
    protected final OpenTelemetry openTelemetry;

    public DefaultMessageBroker(AuditSink auditSink, OpenTelemetry ot, String scopeName) {
        this(new SubscriptionRegistry(), auditSink, ot, scopeName);
    }

    public DefaultMessageBroker(SubscriptionRegistry registry, AuditSink auditSink, OpenTelemetry ot,
            String scopeName) {
        this(registry, auditSink, null, null, ot, scopeName);
    }

    /**
     * @param registry       where subscriptions are kept
     * @param auditSink      receives every published message once
     * @param asyncExecutor  runs subscribers when a handler timeout is set, may
     *                       be null
     * @param handlerTimeout how long to wait for each subscriber, null for no
     *                       limit
     * @param ot             OpenTelemetry instance for metrics and spans
     * @param scopeName      instrumentation scope name
     */
    public DefaultMessageBroker(SubscriptionRegistry registry, AuditSink auditSink, AsyncExecutor asyncExecutor,
            Duration handlerTimeout, OpenTelemetry ot, String scopeName) {
        if (registry == null) {
            throw new IllegalArgumentException("Registry cannot be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("Audit sink cannot be null");
        }
        if (handlerTimeout != null && asyncExecutor == null) {
            throw new IllegalArgumentException("A handler timeout needs an executor to run handlers on");
        }
        if (handlerTimeout != null && (handlerTimeout.isNegative() || handlerTimeout.isZero())) {
            throw new IllegalArgumentException("Handler timeout must be positive");
        }
        this.registry = registry;
        this.auditSink = auditSink;
        this.asyncExecutor = asyncExecutor;
        this.handlerTimeout = handlerTimeout;
        this.metrics = new BrokerMetrics(ot.getMeter(scopeName));
        this.tracer = ot.getTracer(scopeName);
        this.openTelemetry = ot;
    }

    @Override
    public DeliveryReport publish(String topic, byte[] payload) {
        return publish(topic, payload, null);
    }

    /**
     * Publishes a payload about a source file.
     *
     * @param topic      The topic to publish to
     * @param payload    The message body
     * @param sourcePath the file the message describes, may be null
     */
    public DeliveryReport publish(String topic, byte[] payload, String sourcePath) {
        Topic parsed = Topic.parse(topic);
        return publish(Message.create(parsed, payload, sourcePath, serializeTraceContext(openTelemetry)));
    }

    @Override
    public DeliveryReport publish(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        lifecycle.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Broker is closed");
            }
            metrics.recordPublished(message.topic());
            return processWithTelemetry(openTelemetry, tracer, message, "publish_message",
                    () -> deliver(message));
        } finally {
            lifecycle.readLock().unlock();
            // a subscriber asked to close while this thread held the read lock
            if (closed && !drained && lifecycle.getReadHoldCount() == 0) {
                close();
            }
        }
    }

    private DeliveryReport deliver(Message message) {
        List<Subscription> matched = registry.findMatching(message.topicName());
        logger.atDebug().log("Publishing {} to {} subscription(s)", message.id(), matched.size());

        List<DeliveryOutcome> outcomes = new ArrayList<>(matched.size());
        AuditOutcome audit;
        try {
            for (Subscription subscription : matched) {
                outcomes.add(deliverTo(subscription, message));
            }
        } finally {
            audit = appendToAudit(message);
        }
        return new DeliveryReport(message, outcomes, audit);
    }

    private DeliveryOutcome deliverTo(Subscription subscription, Message message) {
        return processWithTelemetry(openTelemetry, tracer, message, "process_message", () -> {
            try {
                invoke(subscription, message);
                metrics.recordDelivered(message.topic());
                return DeliveryOutcome.delivered(subscription);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                Span.current().recordException(e);
                metrics.recordDeliveryFailure(message.topic());
                logger.atWarn()
                        .setCause(e)
                        .log("Subscription {} ({}) failed to handle message {} on topic {}",
                                subscription.id(), subscription.subscriberName(), message.id(), message.topic());
                notifyError(subscription, e);
                return DeliveryOutcome.failed(subscription, e);
            }
        });
    }

    private void invoke(Subscription subscription, Message message) throws Exception {
        if (handlerTimeout == null) {
            subscription.subscriber().onMessage(message);
            return;
        }
        Future<Object> result = asyncExecutor.submit(Context.current().wrap(() -> {
            subscription.subscriber().onMessage(message);
            return null;
        }));
        try {
            result.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new HandlerTimeoutException(subscription.id(), handlerTimeout);
        } catch (InterruptedException e) {
            result.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void notifyError(Subscription subscription, Throwable error) {
        try {
            subscription.subscriber().onError(error);
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .log("Subscription {} threw from onError", subscription.id());
        }
    }

    private AuditOutcome appendToAudit(Message message) {
        try {
            auditSink.append(message);
            return AuditOutcome.appended();
        } catch (AuditSinkException | RuntimeException e) {
            metrics.recordAuditFailure(message.topic());
            logger.atError()
                    .setCause(e)
                    .log("Failed to append message {} on topic {} to the audit sink", message.id(),
                            message.topic());
            return AuditOutcome.failed(e);
        }
    }

    @Override
    public long subscribe(String pattern, MessageSubscriber subscriber) {
        lifecycle.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Broker is closed");
            }
            long id = registry.subscribe(pattern, subscriber);
            metrics.recordSubscriptionAdded(pattern);
            return id;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        return registry.unsubscribe(subscriptionId)
                .map(removed -> {
                    metrics.recordSubscriptionRemoved(removed.patternText());
                    return true;
                })
                .orElse(false);
    }

    @Override
    public Map<String, List<String>> subscriptions() {
        return registry.listSubscriptions();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Waits for publishes already in progress, then refuses new ones and drops
     * every subscription. Closing twice is harmless.
     *
     * <p>
     * Called from a subscriber, close cannot wait for the publish it is part of.
     * The broker then refuses new work straight away and drops its
     * subscriptions once that publish returns.
     * </p>
     */
    @Override
    public void close() {
        if (lifecycle.getReadHoldCount() > 0) {
            closed = true;
            logger.atInfo().log("Message broker close requested during a publish, finishing when it returns");
            return;
        }
        lifecycle.writeLock().lock();
        try {
            if (drained) {
                return;
            }
            closed = true;
            drained = true;
            for (Subscription s : registry.clear()) {
                metrics.recordSubscriptionRemoved(s.patternText());
            }
        } finally {
            lifecycle.writeLock().unlock();
        }
        logger.atInfo().log("Message broker closed");
    }
}
