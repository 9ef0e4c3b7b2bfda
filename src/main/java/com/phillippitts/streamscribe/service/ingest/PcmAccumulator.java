package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.SourceFormat;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Optional;

/**
 * Buffer for self-delimited sources: each chunk is decoded on arrival.
 *
 * <p>Holds two copies of the decoded PCM:
 * <ul>
 *   <li>{@code pcmBatchBuffer} - PCM not yet handed off, compacted after every successful batch
 *       so {@code batchOffset} returns to 0</li>
 *   <li>{@code fullSessionPcm} - append-only, used for archival</li>
 * </ul>
 * Invariant: {@code 0 <= batchOffset <= batchLength}.
 */
public final class PcmAccumulator extends SessionAudioBuffer {

    private byte[] pcmBatchBuffer = new byte[0];
    private int batchLength;
    private int batchOffset;
    private long committedBytes;
    private final ByteArrayOutputStream fullSessionPcm = new ByteArrayOutputStream();

    PcmAccumulator(String mimeType) {
        super(mimeType);
    }

    @Override
    public SourceFormat format() {
        return SourceFormat.RAW_PCM_CONTAINER;
    }

    @Override
    public boolean decodesOnArrival() {
        return true;
    }

    @Override
    public void append(byte[] pcm) {
        ensureCapacity(batchLength + pcm.length);
        System.arraycopy(pcm, 0, pcmBatchBuffer, batchLength, pcm.length);
        batchLength += pcm.length;
        fullSessionPcm.write(pcm, 0, pcm.length);
    }

    @Override
    public Optional<BatchSlice> pendingSlice(PcmDecoder decoder) {
        if (batchOffset >= batchLength) {
            return Optional.empty();
        }
        return Optional.of(new BatchSlice(Arrays.copyOfRange(pcmBatchBuffer, batchOffset, batchLength), batchLength));
    }

    @Override
    public void commit(BatchSlice slice) {
        int start = slice.end() - slice.length();
        if (start != batchOffset || slice.end() > batchLength) {
            throw new IllegalArgumentException("Slice [" + start + ", " + slice.end()
                    + ") does not continue from offset " + batchOffset + " (length " + batchLength + ")");
        }
        batchOffset = slice.end();
        committedBytes += slice.length();
        compact();
    }

    private void compact() {
        int remaining = batchLength - batchOffset;
        System.arraycopy(pcmBatchBuffer, batchOffset, pcmBatchBuffer, 0, remaining);
        batchLength = remaining;
        batchOffset = 0;
    }

    @Override
    public byte[] fullSessionPcm(PcmDecoder decoder) {
        return fullSessionPcm.toByteArray();
    }

    private void ensureCapacity(int required) {
        if (required > pcmBatchBuffer.length) {
            pcmBatchBuffer = Arrays.copyOf(pcmBatchBuffer, Math.max(required, pcmBatchBuffer.length * 2));
        }
    }

    public int batchOffset() {
        return batchOffset;
    }

    public int batchLength() {
        return batchLength;
    }

    public int fullSessionLength() {
        return fullSessionPcm.size();
    }

    /** Total PCM bytes handed off by successful batches. */
    public long committedBytes() {
        return committedBytes;
    }
}
