package com.phillippitts.streamscribe.service.archive;

import com.phillippitts.streamscribe.exception.ArchivalException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ObjectStore} that writes recordings under a local root directory.
 *
 * <p>Each recording becomes {@code recordings/{sessionId}_{timestamp}.wav} with a
 * {@code .json} sidecar holding its metadata. The returned handle is the path relative to the
 * root. Metadata keys are normalized to lowercase alphanumerics, {@code -} and {@code _}
 * (max 1024 chars); values are trimmed and capped at 2048 chars.
 */
public final class FileSystemObjectStore implements ObjectStore {

    private static final Logger LOG = LogManager.getLogger(FileSystemObjectStore.class);

    static final String PREFIX = "recordings";
    static final int MAX_KEY_LENGTH = 1024;
    static final int MAX_VALUE_LENGTH = 2048;

    private static final DateTimeFormatter NAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final Path root;
    private final Clock clock;

    public FileSystemObjectStore(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> store(String sessionId, byte[] wavContainer, Map<String, String> metadata) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(wavContainer, "wavContainer");

        String name = sessionId + "_" + NAME_TIMESTAMP.format(clock.instant()) + ".wav";
        String handle = PREFIX + "/" + name;
        Path dir = root.resolve(PREFIX);
        Path wavPath = dir.resolve(name);
        Path sidecar = dir.resolve(name + ".json");

        Map<String, String> stored = new LinkedHashMap<>();
        stored.put("session_id", sessionId);
        stored.put("uploaded_at", clock.instant().toString());
        if (metadata != null) {
            stored.putAll(metadata);
        }
        stored.putIfAbsent("language", "unknown");
        Map<String, String> normalized = normalizeMetadata(stored);

        try {
            Files.createDirectories(dir);
            Files.write(wavPath, wavContainer);
            Files.writeString(sidecar, new JSONObject(normalized).toString(2), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArchivalException(sessionId, "could not write " + wavPath + ": " + e.getMessage(), e);
        }
        LOG.info("Archived session recording '{}' ({} bytes)", handle, wavContainer.length);
        return Optional.of(handle);
    }

    static Map<String, String> normalizeMetadata(Map<String, String> metadata) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            if (e.getKey() == null || e.getKey().isEmpty()) {
                continue;
            }
            out.put(sanitizeKey(e.getKey()), sanitizeValue(e.getValue()));
        }
        return out;
    }

    static String sanitizeKey(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (char ch : key.toLowerCase(Locale.ROOT).toCharArray()) {
            sb.append(Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' ? ch : '_');
        }
        return sb.length() > MAX_KEY_LENGTH ? sb.substring(0, MAX_KEY_LENGTH) : sb.toString();
    }

    static String sanitizeValue(String value) {
        String v = value == null ? "" : value.strip();
        return v.length() > MAX_VALUE_LENGTH ? v.substring(0, MAX_VALUE_LENGTH) : v;
    }
}
