package io.github.hotbrkm.smtpcampaign.dispatcher.email;

/**
 * Failure of one build-or-send attempt for a single recipient. Consumed by the retry budget.
 */
public abstract class DeliveryException extends Exception {

    protected DeliveryException(String message) {
        super(message);
    }

    protected DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
