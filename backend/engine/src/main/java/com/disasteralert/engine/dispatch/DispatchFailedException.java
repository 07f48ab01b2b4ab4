package com.disasteralert.engine.dispatch;

/**
 * Thrown when a dispatch pass could not reach or update storage. The report holds whatever
 * was decided before or despite the failure, including {@link DispatchOutcome#SENT_BUT_UNLOGGED}
 * groups that must not be blindly retried.
 */
public class DispatchFailedException extends RuntimeException {
    private final transient DispatchReport report;

    public DispatchFailedException(String message, DispatchReport report) {
        super(message);
        this.report = report;
    }

    public DispatchFailedException(String message, DispatchReport report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public DispatchReport report() {
        return report;
    }
}
