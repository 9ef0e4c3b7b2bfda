package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.config.properties.BatchingProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BatchTriggerPolicyTest {

    private static final Instant LAST_BATCH = Instant.parse("2024-05-01T10:00:00Z");

    private final BatchTriggerPolicy policy = new BatchTriggerPolicy(new BatchingProperties(5, 20, 5));

    @Test
    void shouldNotTriggerWithFourChunksAfterOneSecond() {
        assertThat(policy.shouldTrigger(4, LAST_BATCH, LAST_BATCH.plusSeconds(1))).isFalse();
    }

    @Test
    void shouldTriggerAtMinChunks() {
        assertThat(policy.shouldTrigger(5, LAST_BATCH, LAST_BATCH.plusMillis(10))).isTrue();
    }

    @Test
    void shouldTriggerAtMaxChunksEvenWhenMinIsHigher() {
        BatchTriggerPolicy maxOnly = new BatchTriggerPolicy(new BatchingProperties(100, 20, 60));

        assertThat(maxOnly.shouldTrigger(19, LAST_BATCH, LAST_BATCH)).isFalse();
        assertThat(maxOnly.shouldTrigger(20, LAST_BATCH, LAST_BATCH)).isTrue();
    }

    @Test
    void shouldTriggerWhenWindowElapsed() {
        assertThat(policy.shouldTrigger(1, LAST_BATCH, LAST_BATCH.plus(Duration.ofMillis(4999)))).isFalse();
        assertThat(policy.shouldTrigger(1, LAST_BATCH, LAST_BATCH.plusSeconds(5))).isTrue();
    }

    @Test
    void shouldNotTreatClockStepBackAsElapsed() {
        assertThat(policy.shouldTrigger(1, LAST_BATCH, LAST_BATCH.minusSeconds(30))).isFalse();
    }
}
