package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.exception.ArchivalException;
import com.phillippitts.streamscribe.service.archive.ObjectStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Object store that keeps recordings in memory.
 */
public class RecordingObjectStore implements ObjectStore {

    /** One stored recording. */
    public record Stored(String sessionId, byte[] wav, Map<String, String> metadata) {}

    private final List<Stored> stored = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingObjectStore failing() {
        this.failing = true;
        return this;
    }

    @Override
    public Optional<String> store(String sessionId, byte[] wavContainer, Map<String, String> metadata) {
        if (failing) {
            throw new ArchivalException(sessionId, "scripted store failure");
        }
        stored.add(new Stored(sessionId, wavContainer, Map.copyOf(metadata)));
        return Optional.of("memory/" + sessionId + ".wav");
    }

    public List<Stored> stored() {
        return stored;
    }
}
