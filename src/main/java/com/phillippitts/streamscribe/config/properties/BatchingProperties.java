package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Thresholds that decide when pending chunks become a batch.
 *
 * <p>A batch fires when the pending chunk count reaches {@code min-chunks}, when it reaches
 * {@code max-chunks}, or when {@code window-seconds} have passed since the last successful batch.
 * With the defaults (5 / 20 / 5s) the max-chunk bound only matters after failed batches, where
 * pending chunks keep growing until a retry succeeds.
 */
@ConfigurationProperties(prefix = "ingest.batch")
@Validated
public class BatchingProperties {

    @Positive(message = "Minimum chunks per batch must be positive")
    private int minChunks = 5;

    @Positive(message = "Maximum chunks per batch must be positive")
    private int maxChunks = 20;

    @Positive(message = "Batch window must be positive")
    private int windowSeconds = 5;

    public BatchingProperties() {
    }

    public BatchingProperties(int minChunks, int maxChunks, int windowSeconds) {
        this.minChunks = minChunks;
        this.maxChunks = maxChunks;
        this.windowSeconds = windowSeconds;
    }

    @AssertTrue(message = "ingest.batch.min-chunks must not exceed ingest.batch.max-chunks")
    public boolean isChunkRangeValid() {
        return minChunks <= maxChunks;
    }

    public int getMinChunks() {
        return minChunks;
    }

    public void setMinChunks(int minChunks) {
        this.minChunks = minChunks;
    }

    public int getMaxChunks() {
        return maxChunks;
    }

    public void setMaxChunks(int maxChunks) {
        this.maxChunks = maxChunks;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }
}
