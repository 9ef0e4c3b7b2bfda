package com.phillippitts.streamscribe.domain;

/**
 * Lifecycle of one ingestion session. Transitions only move forward:
 * {@code ACTIVE -> FINALIZING -> CLOSED}.
 */
public enum SessionState {
    /** Receiving and buffering audio. */
    ACTIVE,
    /** Draining the last batch and archiving; inbound events are ignored. */
    FINALIZING,
    /** Removed from the registry. Terminal. */
    CLOSED
}
