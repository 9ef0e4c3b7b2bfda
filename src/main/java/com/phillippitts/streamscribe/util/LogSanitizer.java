package com.phillippitts.streamscribe.util;

/** Utility for privacy-safe logging of text and byte previews. */
public final class LogSanitizer {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Lowercase hex of at most {@code maxBytes} leading bytes; returns "" for null or empty input.
     * Used to describe undecodable audio without dumping the payload.
     */
    public static String hexPreview(byte[] data, int maxBytes) {
        if (data == null || data.length == 0 || maxBytes <= 0) {
            return "";
        }
        int n = Math.min(data.length, maxBytes);
        StringBuilder sb = new StringBuilder(n * 2);
        for (int i = 0; i < n; i++) {
            sb.append(HEX[(data[i] >> 4) & 0x0F]).append(HEX[data[i] & 0x0F]);
        }
        return sb.toString();
    }
}
