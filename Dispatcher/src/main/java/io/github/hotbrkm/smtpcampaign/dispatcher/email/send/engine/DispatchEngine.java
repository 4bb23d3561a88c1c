package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.DeliveryException;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.MessageBuilder;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.OutboundMessage;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.metrics.DispatchMetrics;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.progress.ProgressSink;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result.DispatchOutcome;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result.RecipientOutcome;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSession;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Sends the campaign to each recipient in order over one open {@link TransportSession}.
 * <p>
 * Every recipient gets up to {@link DispatchPolicy#maxAttempts()} build-and-send attempts with a flat pause
 * between them. A recipient that exhausts its attempts is recorded as failed and the campaign moves on.
 * Only a {@link AttemptResult.FatalFailure} or an interrupt stops the run early.
 * <p>
 * Not thread-safe; one engine instance per campaign.
 */
@Slf4j
public class DispatchEngine {

    static final String COMPLETED_MESSAGE = "Email campaign completed!";

    private final MessageBuilder messageBuilder;
    private final TransportSession transportSession;
    private final ProgressSink progressSink;
    private final DispatchPolicy policy;
    private final Sleeper sleeper;
    private final DispatchMetrics metrics;

    public DispatchEngine(MessageBuilder messageBuilder, TransportSession transportSession, ProgressSink progressSink,
                          DispatchPolicy policy, Sleeper sleeper, DispatchMetrics metrics) {
        this.messageBuilder = Objects.requireNonNull(messageBuilder, "messageBuilder must not be null");
        this.transportSession = Objects.requireNonNull(transportSession, "transportSession must not be null");
        this.progressSink = Objects.requireNonNull(progressSink, "progressSink must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.metrics = metrics == null ? DispatchMetrics.standalone() : metrics;
    }

    /**
     * @param recipients validated recipients, in send order
     * @return one outcome per recipient, in the same order
     * @throws CampaignAbortedException when the thread is interrupted during a pause
     * @throws RuntimeException         any unexpected error raised while building or sending
     */
    public List<RecipientOutcome> run(List<RecipientAddress> recipients) {
        Objects.requireNonNull(recipients, "recipients must not be null");
        CampaignState state = new CampaignState(recipients);
        log.info("event=dispatch_started, recipients={}, maxAttempts={}", state.total(), policy.maxAttempts());

        while (state.hasNext()) {
            RecipientAddress recipient = state.current();
            DispatchOutcome outcome = dispatch(recipient);
            state.resolve(outcome);

            if (outcome instanceof DispatchOutcome.Sent) {
                metrics.recordOutcome("sent");
                progressSink.onInfo("Sent email to: " + recipient);
                progressSink.onProgress(state.progress());
                pause(policy.pacingDelay());
            } else {
                metrics.recordOutcome("failed");
                log.error("Max retries reached for {}", recipient);
                progressSink.onInfo("Failed to send email to " + recipient + " after maximum retries");
            }
        }

        log.info("event=dispatch_completed, recipients={}, sent={}, failed={}",
                state.total(), state.getSentCount(), state.getFailedCount());
        progressSink.onInfo(COMPLETED_MESSAGE);
        progressSink.onDone();
        return state.getOutcomes();
    }

    /**
     * Retry loop for one recipient.
     */
    private DispatchOutcome dispatch(RecipientAddress recipient) {
        int attempt = 0;
        while (true) {
            attempt++;
            AttemptResult result = attempt(recipient);

            if (result instanceof AttemptResult.Sent) {
                log.info("Email sent successfully to {} (attempt {})", recipient, attempt);
                return DispatchOutcome.sent(attempt);
            }
            if (result instanceof AttemptResult.FatalFailure fatal) {
                log.error("Unexpected error while sending to {}, aborting campaign", recipient, fatal.cause());
                throw fatal.cause();
            }

            AttemptResult.RetryableFailure failure = (AttemptResult.RetryableFailure) result;
            log.error("Failed to send email to {}: {}", recipient, failure.cause().getMessage());

            int remaining = policy.maxAttempts() - attempt;
            if (remaining <= 0) {
                return DispatchOutcome.failed(attempt);
            }

            log.debug("Retrying email to {}. Attempts remaining: {}", recipient, remaining);
            progressSink.onInfo("Retrying email to " + recipient + "... (" + remaining + " attempts remaining)");
            pause(policy.retryDelay());
        }
    }

    private AttemptResult attempt(RecipientAddress recipient) {
        long start = System.nanoTime();
        AttemptResult result;
        try {
            OutboundMessage message = messageBuilder.build(recipient);
            transportSession.send(message);
            result = new AttemptResult.Sent();
        } catch (DeliveryException e) {
            result = new AttemptResult.RetryableFailure(e);
        } catch (RuntimeException e) {
            result = new AttemptResult.FatalFailure(e);
        }
        metrics.recordAttempt(resultTag(result), System.nanoTime() - start);
        return result;
    }

    private static String resultTag(AttemptResult result) {
        if (result instanceof AttemptResult.Sent) {
            return "sent";
        }
        return result instanceof AttemptResult.RetryableFailure ? "retryable" : "fatal";
    }

    private void pause(Duration duration) {
        try {
            sleeper.pause(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CampaignAbortedException("Campaign interrupted while pausing", e);
        }
    }
}
