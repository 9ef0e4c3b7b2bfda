package com.phillippitts.streamscribe.util;

import java.time.Duration;

/**
 * Standard timeout values for external process management.
 *
 * <p>Used by {@link com.phillippitts.streamscribe.service.process.ExternalProcessRunner}, which
 * backs both the ffmpeg transcoder and the whisper.cpp transcription oracle.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time for stream gobbler threads to flush buffered output after process completion.
     * ffmpeg writes whole batches of PCM to stdout, so this is longer than a text-only tool needs.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Best-effort wait for gobbler threads during cleanup. They are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after {@link Process#destroy()} before escalating.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
