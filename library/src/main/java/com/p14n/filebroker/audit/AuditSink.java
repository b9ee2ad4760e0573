package com.p14n.filebroker.audit;

import com.p14n.filebroker.data.Message;

/**
 * Durable, append-only record of every published message.
 *
 * <p>
 * The broker calls {@link #append(Message)} exactly once per publish, after
 * subscribers have been notified. Buffering and flushing are the sink's own
 * business; the broker only looks at whether the call succeeded.
 * </p>
 */
public interface AuditSink {

    /**
     * Appends one record for the message.
     *
     * @param message the published message
     * @throws AuditSinkException if the record could not be written
     */
    void append(Message message) throws AuditSinkException;
}
