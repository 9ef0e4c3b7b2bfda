package com.phillippitts.streamscribe.service.ingest;

/**
 * Creates the state machine for a newly connected session.
 */
@FunctionalInterface
public interface SessionStateMachineFactory {

    /**
     * @param sessionId id of the new session
     * @param outbound  connection to the client
     * @param onClosed  callback the machine runs once when the session is finalized
     */
    SessionStateMachine create(String sessionId, SessionOutbound outbound, Runnable onClosed);
}
