package com.phillippitts.streamscribe.exception;

/**
 * Thrown when source audio cannot be transcoded into canonical PCM.
 *
 * <p>Recoverable: a failed chunk is simply not counted, a failed batch is retried on the
 * next trigger evaluation. The {@code preview} holds a short hex dump of the leading input
 * bytes for diagnostics; it never contains decoded audio.
 */
public class DecodeException extends StreamScribeException {

    private final String formatHint;
    private final String preview;

    public DecodeException(String message, String formatHint, String preview) {
        super(message + " (hint=" + (formatHint == null ? "auto" : formatHint) + ", head=" + preview + ")");
        this.formatHint = formatHint;
        this.preview = preview;
    }

    public DecodeException(String message, String formatHint, String preview, Throwable cause) {
        super(message + " (hint=" + (formatHint == null ? "auto" : formatHint) + ", head=" + preview + ")", cause);
        this.formatHint = formatHint;
        this.preview = preview;
    }

    /**
     * @return format hint used for the failed attempt, or {@code null} for auto-detection
     */
    public String getFormatHint() {
        return formatHint;
    }

    public String getPreview() {
        return preview;
    }
}
