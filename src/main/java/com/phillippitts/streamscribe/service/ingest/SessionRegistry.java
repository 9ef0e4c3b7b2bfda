package com.phillippitts.streamscribe.service.ingest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrency-safe map of active sessions.
 *
 * <p>Owns only existence: session buffers are never touched here, so no operation blocks on
 * audio work. A session is present from {@link #create} until its finalizer runs.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, SessionStateMachine> sessions = new ConcurrentHashMap<>();
    private final SessionStateMachineFactory factory;

    public SessionRegistry(SessionStateMachineFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Creates and registers a session.
     *
     * @throws IllegalStateException if {@code sessionId} is already registered
     */
    public SessionStateMachine create(String sessionId, SessionOutbound outbound) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionStateMachine machine = factory.create(sessionId, outbound, () -> remove(sessionId));
        SessionStateMachine existing = sessions.putIfAbsent(sessionId, machine);
        if (existing != null) {
            throw new IllegalStateException("Session already registered: " + sessionId);
        }
        LOG.debug("Registered session {} ({} active)", sessionId, sessions.size());
        return machine;
    }

    public Optional<SessionStateMachine> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Removes the session if present. Idempotent.
     */
    public void remove(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            LOG.debug("Removed session {} ({} active)", sessionId, sessions.size());
        }
    }

    public int size() {
        return sessions.size();
    }
}
