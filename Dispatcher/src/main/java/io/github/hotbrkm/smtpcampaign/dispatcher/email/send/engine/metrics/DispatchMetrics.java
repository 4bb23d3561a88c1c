package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public class DispatchMetrics {

    public static final String ATTEMPTS = "campaign.dispatch.attempts";
    public static final String OUTCOME = "campaign.dispatch.outcome";
    public static final String SEND_DURATION = "campaign.dispatch.send.duration";

    private final MeterRegistry registry;
    private final Timer sendDuration;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
        this.sendDuration = Timer.builder(SEND_DURATION)
                .description("Time to build and hand one message to the relay")
                .register(this.registry);
    }

    /**
     * Metrics kept in a private registry, for callers that do not export them.
     */
    public static DispatchMetrics standalone() {
        return new DispatchMetrics(new SimpleMeterRegistry());
    }

    /**
     * @param result {@code sent}, {@code retryable} or {@code fatal}
     */
    public void recordAttempt(String result, long elapsedNanos) {
        registry.counter(ATTEMPTS, "result", safe(result)).increment();
        sendDuration.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param result {@code sent} or {@code failed}
     */
    public void recordOutcome(String result) {
        registry.counter(OUTCOME, "result", safe(result)).increment();
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
