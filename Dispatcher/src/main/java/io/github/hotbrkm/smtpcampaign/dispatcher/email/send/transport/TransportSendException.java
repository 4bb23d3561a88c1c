package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.DeliveryException;
import lombok.Getter;

/**
 * The relay did not accept one message.
 */
@Getter
public class TransportSendException extends DeliveryException {

    private final String step;
    private final int statusCode;

    public TransportSendException(String step, int statusCode, String message) {
        super(step + " rejected (" + statusCode + "): " + message);
        this.step = step;
        this.statusCode = statusCode;
    }

    public TransportSendException(String step, int statusCode, String message, Throwable cause) {
        super(step + " rejected (" + statusCode + "): " + message, cause);
        this.step = step;
        this.statusCode = statusCode;
    }
}
