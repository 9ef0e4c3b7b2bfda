package com.phillippitts.streamscribe.service.ingest;

/**
 * Outbound side of a session's connection.
 *
 * <p>Implementations must tolerate calls after the peer has gone away: sending to a closed
 * connection is logged and dropped, never thrown.
 */
public interface SessionOutbound {

    void send(OutboundMessage message);

    boolean isOpen();

    /** Closes the connection normally. Idempotent. */
    void close();
}
