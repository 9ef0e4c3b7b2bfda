package com.phillippitts.streamscribe.service.codec;

import java.util.Locale;

/**
 * Maps a declared mime type to the container name the transcoder understands.
 */
public final class FormatHints {

    private FormatHints() {}

    /**
     * @param mimeType declared mime type, possibly with parameters ("audio/webm;codecs=opus")
     * @return container hint, or {@code null} when the mime type is missing or unrecognized
     */
    public static String fromMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return null;
        }
        String m = mimeType.toLowerCase(Locale.ROOT);
        if (m.contains("webm")) {
            return "webm";
        }
        if (m.contains("ogg")) {
            return "ogg";
        }
        if (m.contains("wav") || m.contains("wave")) {
            return "wav";
        }
        if (m.contains("mp4") || m.contains("m4a")) {
            return "mp4";
        }
        if (m.contains("mpeg") || m.contains("mp3")) {
            return "mp3";
        }
        return null;
    }
}
