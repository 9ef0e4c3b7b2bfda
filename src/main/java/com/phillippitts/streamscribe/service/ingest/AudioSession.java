package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.ChunkMeta;
import com.phillippitts.streamscribe.domain.SessionState;
import com.phillippitts.streamscribe.domain.SourceFormat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one ingestion session (one per connection).
 *
 * <p>Mutated only by the session's worker, except {@link #markFinalized()} and {@link #getState()},
 * which are safe to call from any thread.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code sourceFormat} is {@link SourceFormat#UNKNOWN} until the first chunk and never
 *       changes afterwards</li>
 *   <li>{@code totalChunkCount} never decreases</li>
 *   <li>{@code chunkMeta} is cleared only when a batch was transcribed</li>
 * </ul>
 */
public class AudioSession {

    private final String sessionId;
    private final Instant startTime;
    private final AtomicBoolean finalized = new AtomicBoolean(false);
    private final List<ChunkMeta> chunkMeta = new ArrayList<>();

    private SourceFormat sourceFormat = SourceFormat.UNKNOWN;
    private String declaredMimeType;
    private SessionAudioBuffer buffer;
    private String language;
    private long totalChunkCount;
    private Instant lastBatchTime;
    private volatile SessionState state = SessionState.ACTIVE;

    public AudioSession(String sessionId, Instant startTime, String language) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.language = Objects.requireNonNull(language, "language");
        this.lastBatchTime = startTime;
    }

    /**
     * Returns the session's buffer, fixing the source format from {@code mimeType} if this is the
     * first chunk. Later mime types are ignored.
     */
    public SessionAudioBuffer bufferFor(String mimeType) {
        if (buffer == null) {
            sourceFormat = SourceFormat.fromMimeType(mimeType);
            declaredMimeType = mimeType;
            buffer = SessionAudioBuffer.create(sourceFormat, mimeType);
        }
        return buffer;
    }

    /** Records an accepted chunk. */
    public void addChunk(ChunkMeta meta) {
        chunkMeta.add(meta);
        totalChunkCount++;
    }

    public int pendingChunkCount() {
        return chunkMeta.size();
    }

    /** Called only after a batch was transcribed. */
    void completeBatch(Instant now) {
        chunkMeta.clear();
        lastBatchTime = now;
    }

    /**
     * Claims the one-time archival right.
     *
     * @return {@code true} for the first caller only
     */
    public boolean markFinalized() {
        return finalized.compareAndSet(false, true);
    }

    public boolean isFinalized() {
        return finalized.get();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    public String getDeclaredMimeType() {
        return declaredMimeType;
    }

    /**
     * @return the buffer, or {@code null} before the first chunk
     */
    public SessionAudioBuffer getBuffer() {
        return buffer;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public List<ChunkMeta> getChunkMeta() {
        return Collections.unmodifiableList(chunkMeta);
    }

    public long getTotalChunkCount() {
        return totalChunkCount;
    }

    public Instant getLastBatchTime() {
        return lastBatchTime;
    }

    public SessionState getState() {
        return state;
    }

    void setState(SessionState state) {
        this.state = state;
    }
}
