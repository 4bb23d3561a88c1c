package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.DeliveryException;

/**
 * The outbound message could not be assembled, typically because an attachment part could not be encoded.
 */
public class MessageBuildException extends DeliveryException {

    public MessageBuildException(String message) {
        super(message);
    }

    public MessageBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
