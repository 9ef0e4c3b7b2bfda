package com.phillippitts.streamscribe.service.transcription.whisper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts text and detected language from whisper.cpp JSON output ({@code -oj}).
 *
 * <p>whisper.cpp writes:
 * <pre>
 * {"result": {"language": "en"}, "transcription": [{"text": " Hello"}, {"text": " world."}]}
 * </pre>
 * Older builds and wrappers emit a top-level {@code text} or a {@code segments} array instead;
 * both are accepted. Malformed input yields empty text.
 */
final class WhisperJsonParser {

    private static final Logger LOG = LogManager.getLogger(WhisperJsonParser.class);

    private WhisperJsonParser() {}

    /**
     * @param json whisper.cpp JSON output
     * @return trimmed transcript text, or "" when there is none
     */
    static String extractText(String json) {
        JSONObject obj = parse(json);
        if (obj == null) {
            return "";
        }
        if (obj.has("text")) {
            return obj.optString("text", "").trim();
        }
        if (obj.has("transcription")) {
            return joinSegments(obj.optJSONArray("transcription"));
        }
        if (obj.has("segments")) {
            return joinSegments(obj.optJSONArray("segments"));
        }
        return "";
    }

    /**
     * @param json whisper.cpp JSON output
     * @return detected language code, or {@code null} if the output does not report one
     */
    static String extractLanguage(String json) {
        JSONObject obj = parse(json);
        if (obj == null) {
            return null;
        }
        JSONObject result = obj.optJSONObject("result");
        String language = result != null ? result.optString("language", "") : obj.optString("language", "");
        return language.isBlank() ? null : language;
    }

    private static String joinSegments(JSONArray segs) {
        if (segs == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segs.length(); i++) {
            JSONObject seg = segs.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            String t = seg.optString("text", "").trim();
            if (!t.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(t);
            }
        }
        return sb.toString();
    }

    private static JSONObject parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            LOG.debug("Unparseable whisper output ({} chars): {}", json.length(), e.getMessage());
            return null;
        }
    }
}
