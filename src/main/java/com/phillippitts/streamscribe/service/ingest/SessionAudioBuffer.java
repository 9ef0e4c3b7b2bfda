package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.SourceFormat;
import com.phillippitts.streamscribe.exception.DecodeException;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;

import java.util.Optional;

/**
 * Audio accumulated by one session, in one of two modes fixed by the first chunk.
 *
 * <p>Batching is a two-phase operation: {@link #pendingSlice(PcmDecoder)} selects the PCM not yet
 * handed off without changing any offset, and {@link #commit(BatchSlice)} advances the offset only
 * after the batch was transcribed. A failed batch therefore leaves the buffer untouched and the
 * same audio is offered again on the next attempt.
 *
 * <p>Not thread-safe; only the owning session's worker touches it.
 */
public abstract class SessionAudioBuffer {

    private final String mimeType;

    protected SessionAudioBuffer(String mimeType) {
        this.mimeType = mimeType;
    }

    /**
     * Creates the buffer matching {@code format}.
     *
     * @throws IllegalArgumentException for {@link SourceFormat#UNKNOWN}
     */
    public static SessionAudioBuffer create(SourceFormat format, String mimeType) {
        return switch (format) {
            case RAW_PCM_CONTAINER -> new PcmAccumulator(mimeType);
            case STREAMING_CONTAINER -> new ContainerAccumulator(mimeType);
            case UNKNOWN -> throw new IllegalArgumentException("No buffer for source format " + format);
        };
    }

    public abstract SourceFormat format();

    /**
     * @return {@code true} if chunks must be decoded before {@link #append(byte[])}
     */
    public abstract boolean decodesOnArrival();

    /**
     * Appends one chunk: decoded PCM when {@link #decodesOnArrival()}, raw container bytes otherwise.
     */
    public abstract void append(byte[] bytes);

    /**
     * Selects the PCM that has not been handed off yet. Changes nothing.
     *
     * @return the pending slice, or empty when there is no new PCM
     * @throws DecodeException if a cumulative container cannot be decoded
     */
    public abstract Optional<BatchSlice> pendingSlice(PcmDecoder decoder);

    /**
     * Marks {@code slice} as handed off.
     *
     * @throws IllegalArgumentException if the slice does not continue from the current offset
     */
    public abstract void commit(BatchSlice slice);

    /**
     * @return every PCM byte the session has produced, handed off or not
     * @throws DecodeException if a cumulative container cannot be decoded
     */
    public abstract byte[] fullSessionPcm(PcmDecoder decoder);

    /** Mime type of the first chunk; used for every decode of this buffer. */
    public String mimeType() {
        return mimeType;
    }
}
