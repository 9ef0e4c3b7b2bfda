package com.phillippitts.streamscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the ingestion engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Accepted chunks and chunk decode failures per source format</li>
 *   <li>Batch outcomes (success, failure, skipped)</li>
 *   <li>Transcription latency per engine</li>
 *   <li>Archive outcomes (stored, skipped, failed)</li>
 * </ul>
 *
 * <p>The active-session gauge is registered by {@code ThreadPoolMetricsConfig}.
 * All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class IngestMetrics {

    static final String METRIC_PREFIX = "streamscribe";

    private final MeterRegistry registry;

    public IngestMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void chunkAccepted(String sourceFormat) {
        Counter.builder(METRIC_PREFIX + ".chunks.accepted")
                .description("Audio chunks accepted into a session buffer")
                .tag("format", sourceFormat)
                .register(registry)
                .increment();
    }

    public void chunkDecodeFailed() {
        Counter.builder(METRIC_PREFIX + ".chunks.decode.failed")
                .description("Audio chunks rejected because they could not be decoded")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success, failure or skipped
     */
    public void batch(String outcome) {
        Counter.builder(METRIC_PREFIX + ".batches")
                .description("Batch attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records transcription latency for a specific engine.
     *
     * @param engineName name of the engine (whisper, openai)
     * @param durationNanos duration in nanoseconds
     */
    public void transcriptionLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to transcribe one batch")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome stored, skipped or failed
     */
    public void archive(String outcome) {
        Counter.builder(METRIC_PREFIX + ".archive")
                .description("Session archive attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
