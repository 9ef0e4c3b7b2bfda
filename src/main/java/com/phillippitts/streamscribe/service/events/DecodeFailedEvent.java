package com.phillippitts.streamscribe.service.events;

import java.time.Instant;

/**
 * Published when source audio could not be decoded, either for a single chunk or for a
 * whole streaming batch.
 *
 * @param sessionId      affected session
 * @param sequenceNumber failed chunk's sequence number, or -1 for a batch-level failure
 * @param formatHint     hint used by the last attempt (null for auto-detection)
 * @param reason         short diagnostic, including a hex preview of the input head
 * @param at             when the failure happened
 */
public record DecodeFailedEvent(
        String sessionId,
        int sequenceNumber,
        String formatHint,
        String reason,
        Instant at
) {

    public boolean isBatchLevel() {
        return sequenceNumber < 0;
    }
}
