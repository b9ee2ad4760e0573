package com.p14n.filebroker.audit;

/**
 * An audit record could not be written.
 */
public class AuditSinkException extends Exception {

    public AuditSinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public AuditSinkException(String message) {
        super(message);
    }
}
