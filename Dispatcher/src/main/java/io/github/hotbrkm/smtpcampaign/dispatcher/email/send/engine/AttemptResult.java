package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.DeliveryException;

/**
 * Result of one build-and-send attempt for one recipient.
 */
sealed interface AttemptResult permits AttemptResult.Sent, AttemptResult.RetryableFailure, AttemptResult.FatalFailure {

    record Sent() implements AttemptResult {
    }

    /**
     * Counts against the attempt budget of the recipient.
     */
    record RetryableFailure(DeliveryException cause) implements AttemptResult {
    }

    /**
     * Ends the campaign.
     */
    record FatalFailure(RuntimeException cause) implements AttemptResult {
    }
}
