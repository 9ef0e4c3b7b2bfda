package com.phillippitts.streamscribe.exception;

/**
 * Thrown when an inbound WebSocket message is malformed (invalid JSON, missing or
 * mistyped fields). Reported to the client as an {@code error} event; the session continues.
 */
public class ProtocolException extends StreamScribeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
