package com.phillippitts.streamscribe.service.ingest;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One JSON message sent to the client: a {@code type} plus type-specific fields.
 *
 * @param type   message type (e.g. "audio_ack")
 * @param fields remaining fields in insertion order; null values serialize as JSON null
 */
public record OutboundMessage(String type, Map<String, Object> fields) {

    public OutboundMessage {
        Objects.requireNonNull(type, "type");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String toJson() {
        JSONObject json = new JSONObject();
        json.put("type", type);
        fields.forEach((k, v) -> json.put(k, v == null ? JSONObject.NULL : v));
        return json.toString();
    }
}
