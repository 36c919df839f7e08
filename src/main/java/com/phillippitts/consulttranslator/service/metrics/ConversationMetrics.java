package com.phillippitts.consulttranslator.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for live conversations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Tokens processed, by kind (final, partial, dropped)</li>
 *   <li>Time spent routing one recognizer message</li>
 *   <li>Recognizer errors by code</li>
 *   <li>Saved conversations and active sessions</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ConversationMetrics {

    private static final String METRIC_PREFIX = "translator";

    private final MeterRegistry registry;

    public ConversationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one processed token.
     *
     * @param kind final, partial or dropped
     */
    public void incrementTokens(String kind) {
        Counter.builder(METRIC_PREFIX + ".tokens")
                .description("Number of recognizer tokens processed")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records how long routing one recognizer message took.
     */
    public void recordMessageLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".message.latency")
                .description("Time taken to route one recognizer message")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementRecognizerErrors(String errorCode) {
        Counter.builder(METRIC_PREFIX + ".recognizer.errors")
                .description("Number of error messages received from the recognizer")
                .tag("code", errorCode)
                .register(registry)
                .increment();
    }

    public void incrementRecordingsSaved() {
        Counter.builder(METRIC_PREFIX + ".recordings.saved")
                .description("Number of conversations saved to disk")
                .register(registry)
                .increment();
    }

    /**
     * Exposes the number of live sessions as a gauge.
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Number of live conversation sessions")
                .register(registry);
    }
}
