package com.phillippitts.streamscribe.service.archive;

import com.phillippitts.streamscribe.exception.ArchivalException;

import java.util.Map;
import java.util.Optional;

/**
 * Persistent store for finished session recordings.
 */
public interface ObjectStore {

    /**
     * Stores one session recording.
     *
     * @param sessionId    session the recording belongs to
     * @param wavContainer canonical WAV container of the whole session
     * @param metadata     descriptive key/value pairs stored alongside the recording
     * @return handle of the stored object, or empty when the store is not configured (a skip, not an error)
     * @throws ArchivalException if the store is configured but the write fails
     */
    Optional<String> store(String sessionId, byte[] wavContainer, Map<String, String> metadata);
}
