package io.github.hotbrkm.smtpcampaign.dispatcher.email;

/**
 * Base class of the errors that end a campaign before or during sending.
 * Per-recipient failures never surface as this type; they are reported as {@link DeliveryException}.
 */
public abstract class CampaignException extends RuntimeException {

    protected CampaignException(String message) {
        super(message);
    }

    protected CampaignException(String message, Throwable cause) {
        super(message, cause);
    }
}
