package com.phillippitts.streamscribe.service.process;

import java.nio.charset.StandardCharsets;

/**
 * Captured outcome of one external process run.
 *
 * @param exitCode   process exit code, or -1 when the run timed out
 * @param stdout     captured stdout bytes (capped)
 * @param stderr     captured stderr text (capped)
 * @param durationMs wall-clock time from start to exit or kill
 * @param timedOut   {@code true} if the process was killed for exceeding its timeout
 * @param stdoutTruncated {@code true} if stdout hit its cap and the rest was discarded
 */
public record ProcessOutput(
        int exitCode,
        byte[] stdout,
        String stderr,
        long durationMs,
        boolean timedOut,
        boolean stdoutTruncated
) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public String stdoutAsString() {
        return new String(stdout, StandardCharsets.UTF_8);
    }
}
