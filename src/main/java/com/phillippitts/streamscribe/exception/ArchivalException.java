package com.phillippitts.streamscribe.exception;

/**
 * Thrown by an object store when a finished session recording cannot be persisted.
 * Session-level and log-only: never retried and never reported to the client.
 */
public class ArchivalException extends StreamScribeException {

    private final String sessionId;

    public ArchivalException(String sessionId, String message) {
        super("Archival failed for session " + sessionId + ": " + message);
        this.sessionId = sessionId;
    }

    public ArchivalException(String sessionId, String message, Throwable cause) {
        super("Archival failed for session " + sessionId + ": " + message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
