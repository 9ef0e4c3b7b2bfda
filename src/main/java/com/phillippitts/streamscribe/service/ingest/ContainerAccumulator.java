package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.SourceFormat;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Optional;

/**
 * Buffer for cumulative streaming containers (WebM/Opus from MediaRecorder).
 *
 * <p>Only the first chunk carries the container header, so later chunks cannot be decoded on
 * their own. Every batch re-decodes the whole {@code containerBuffer} and hands off the PCM past
 * {@code processedPcmOffset}. The buffer is never compacted; memory grows with session length.
 *
 * <p>Invariant: {@code processedPcmOffset} never decreases. A re-decode shorter than the offset
 * (a trailing partial frame decoded differently) yields no batch rather than rewinding.
 */
public final class ContainerAccumulator extends SessionAudioBuffer {

    private static final Logger LOG = LogManager.getLogger(ContainerAccumulator.class);

    private final ByteArrayOutputStream containerBuffer = new ByteArrayOutputStream();
    private int processedPcmOffset;

    ContainerAccumulator(String mimeType) {
        super(mimeType);
    }

    @Override
    public SourceFormat format() {
        return SourceFormat.STREAMING_CONTAINER;
    }

    @Override
    public boolean decodesOnArrival() {
        return false;
    }

    @Override
    public void append(byte[] raw) {
        containerBuffer.write(raw, 0, raw.length);
    }

    @Override
    public Optional<BatchSlice> pendingSlice(PcmDecoder decoder) {
        if (containerBuffer.size() == 0) {
            return Optional.empty();
        }
        byte[] full = decoder.decode(containerBuffer.toByteArray(), mimeType()).orElseThrow();
        if (full.length <= processedPcmOffset) {
            LOG.debug("No new PCM: decoded {}B, already processed {}B", full.length, processedPcmOffset);
            return Optional.empty();
        }
        return Optional.of(new BatchSlice(Arrays.copyOfRange(full, processedPcmOffset, full.length), full.length));
    }

    @Override
    public void commit(BatchSlice slice) {
        int start = slice.end() - slice.length();
        if (start != processedPcmOffset) {
            throw new IllegalArgumentException("Slice starting at " + start
                    + " does not continue from processed offset " + processedPcmOffset);
        }
        processedPcmOffset = slice.end();
    }

    @Override
    public byte[] fullSessionPcm(PcmDecoder decoder) {
        if (containerBuffer.size() == 0) {
            return new byte[0];
        }
        return decoder.decode(containerBuffer.toByteArray(), mimeType()).orElseThrow();
    }

    public int processedPcmOffset() {
        return processedPcmOffset;
    }

    public int containerLength() {
        return containerBuffer.size();
    }
}
