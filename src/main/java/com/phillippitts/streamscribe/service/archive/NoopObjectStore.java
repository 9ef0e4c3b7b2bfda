package com.phillippitts.streamscribe.service.archive;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Used when archiving is disabled; every session is reported as skipped.
 */
public final class NoopObjectStore implements ObjectStore {

    private static final Logger LOG = LogManager.getLogger(NoopObjectStore.class);

    @Override
    public Optional<String> store(String sessionId, byte[] wavContainer, Map<String, String> metadata) {
        LOG.debug("Archive disabled; skipping {} bytes for session {}", wavContainer.length, sessionId);
        return Optional.empty();
    }
}
