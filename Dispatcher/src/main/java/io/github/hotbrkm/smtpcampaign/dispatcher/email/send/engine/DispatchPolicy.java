package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.config.EmailConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt budget per recipient, flat pause before each retry and pause after each successful send.
 */
public record DispatchPolicy(int maxAttempts, Duration retryDelay, Duration pacingDelay) {

    public static final DispatchPolicy DEFAULT = new DispatchPolicy(
            EmailConfig.Send.DEFAULT_MAX_ATTEMPTS,
            Duration.ofMillis(EmailConfig.Send.DEFAULT_RETRY_DELAY_MS),
            Duration.ofMillis(EmailConfig.Send.DEFAULT_PACING_DELAY_MS));

    public DispatchPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        Objects.requireNonNull(pacingDelay, "pacingDelay must not be null");
        if (retryDelay.isNegative() || pacingDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public static DispatchPolicy from(EmailConfig.Send send) {
        return new DispatchPolicy(send.resolveMaxAttempts(),
                Duration.ofMillis(send.resolveRetryDelayMs()),
                Duration.ofMillis(send.resolvePacingDelayMs()));
    }
}
