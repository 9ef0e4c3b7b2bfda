package com.phillippitts.streamscribe.domain;

/**
 * Metadata of one accepted audio chunk awaiting the next batch.
 *
 * @param sequenceNumber     client-assigned sequence number (-1 when the client sent none)
 * @param timestamp          client timestamp string, echoed back verbatim (may be null)
 * @param declaredMime       mime type the client declared for this chunk
 * @param decodedByteCount   PCM bytes the chunk contributed, or 0 for streaming chunks whose
 *                           decoding is deferred to the batch
 */
public record ChunkMeta(
        int sequenceNumber,
        String timestamp,
        String declaredMime,
        int decodedByteCount
) {}
