package com.phillippitts.streamscribe.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operational error events. Throttled per key so a client streaming an
 * undecodable format does not flood the log.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onDecodeFailed(DecodeFailedEvent e) {
        String scope = e.isBatchLevel() ? "batch" : "chunk";
        String key = "decode-" + scope + '-' + e.sessionId();
        if (shouldLog(key)) {
            LOG.warn("Decode failure ({}) in session {}: seq={}, hint={}, reason={}. "
                    + "Check the client's mimeType and that ffmpeg supports it.",
                    scope, e.sessionId(), e.sequenceNumber(), e.formatHint(), e.reason());
        }
    }

    @EventListener
    void onArchivalFailed(ArchivalFailedEvent e) {
        if (shouldLog("archive")) {
            LOG.error("Archival failed for session {}: {}. Check archive.* settings and disk space.",
                    e.sessionId(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
