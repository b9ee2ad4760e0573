package com.p14n.filebroker.broker;

/**
 * Result of appending a published message to the audit sink.
 *
 * @param error null when the record was appended
 */
public record AuditOutcome(Exception error) {

    private static final AuditOutcome APPENDED = new AuditOutcome(null);

    public static AuditOutcome appended() {
        return APPENDED;
    }

    public static AuditOutcome failed(Exception error) {
        return new AuditOutcome(error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
