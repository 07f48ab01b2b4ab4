package com.disasteralert.engine.dispatch;

public enum DispatchOutcome {
    SENT,
    SUPPRESSED_DUPLICATE,
    SKIPPED_NO_SUBSCRIBERS,
    /** Recipients were contacted but the alert log write failed; a retry would notify them again. */
    SENT_BUT_UNLOGGED,
    /** The alert log could not be consulted; nothing was sent. */
    FAILED;

    public boolean attempted() {
        return this == SENT || this == SENT_BUT_UNLOGGED;
    }

    public boolean storageFailure() {
        return this == SENT_BUT_UNLOGGED || this == FAILED;
    }
}
