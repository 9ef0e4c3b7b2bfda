package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.config.properties.BatchingProperties;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether pending chunks form a batch. Pure; no side effects.
 *
 * <p>Fires when any holds:
 * <ul>
 *   <li>{@code pending >= minChunks}</li>
 *   <li>{@code pending >= maxChunks}</li>
 *   <li>{@code now - lastBatchTime >= window}</li>
 * </ul>
 */
@Component
public class BatchTriggerPolicy {

    private final int minChunks;
    private final int maxChunks;
    private final Duration window;

    public BatchTriggerPolicy(BatchingProperties props) {
        Objects.requireNonNull(props, "props");
        this.minChunks = props.getMinChunks();
        this.maxChunks = props.getMaxChunks();
        this.window = props.window();
    }

    public boolean shouldTrigger(int pendingChunks, Instant lastBatchTime, Instant now) {
        return pendingChunks >= minChunks
                || pendingChunks >= maxChunks
                || TimeUtils.hasElapsed(lastBatchTime, now, window);
    }
}
