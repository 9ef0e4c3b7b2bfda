package com.phillippitts.streamscribe.service.ingest;

/**
 * Result of one batch attempt.
 */
public enum BatchOutcome {
    /** Transcribed and committed; pending chunks cleared. */
    TRANSCRIBED,
    /** Nothing new to hand off; session unchanged. */
    SKIPPED,
    /** Decode or transcription failed; session unchanged so the batch is retried. */
    FAILED
}
