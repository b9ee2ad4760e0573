package com.p14n.filebroker;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.EvictingQueue;
import com.p14n.filebroker.broker.MessageSubscriber;
import com.p14n.filebroker.data.Message;
import com.p14n.filebroker.watcher.FileChange;

/**
 * Subscriber that logs every change it receives and keeps the most recent
 * ones for inspection.
 */
public class AuditConsumer implements MessageSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(AuditConsumer.class);

    private final String name;
    private final EvictingQueue<Message> messages;

    public AuditConsumer(String name) {
        this(name, 1000);
    }

    public AuditConsumer(String name, int capacity) {
        this.name = name;
        this.messages = EvictingQueue.create(capacity);
    }

    @Override
    public void onMessage(Message message) {
        synchronized (messages) {
            messages.add(message);
        }
        FileChange change = FileChange.from(message);
        logger.atInfo().log("Message received on {}: {} {} at {}", message.topic(), change.kind(),
                change.path(), change.timestamp());
        if (change.diff() != null && !change.diff().isEmpty()) {
            logger.atDebug().log("Diff:\n{}", change.diff());
        }
    }

    @Override
    public void onError(Throwable error) {
        logger.atWarn().setCause(error).log("{} could not process a message", name);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * @return the retained messages, oldest first
     */
    public List<Message> messages() {
        synchronized (messages) {
            return new ArrayList<>(messages);
        }
    }
}
