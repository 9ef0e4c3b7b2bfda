package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.exception.DecodeException;
import com.phillippitts.streamscribe.service.audio.WavContainer;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Produces one self-contained WAV container from a session's pending audio.
 *
 * <p>Packaging never changes the session; the processor commits the slice after a successful
 * transcription.
 */
@Component
public class BatchPackager {

    private final PcmDecoder decoder;

    public BatchPackager(PcmDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * @return the batch, or empty when the session has no buffer or no new PCM
     * @throws DecodeException if a streaming session's container cannot be decoded
     */
    public Optional<PackagedBatch> pack(AudioSession session) {
        SessionAudioBuffer buffer = session.getBuffer();
        if (buffer == null) {
            return Optional.empty();
        }
        return buffer.pendingSlice(decoder)
                .map(slice -> new PackagedBatch(slice, WavContainer.wrap(slice.pcm()), session.pendingChunkCount()));
    }
}
