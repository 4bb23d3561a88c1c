package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.CampaignException;
import lombok.Getter;

/**
 * The relay session could not be established. Nothing has been sent.
 */
@Getter
public class TransportSetupException extends CampaignException {

    public enum Stage {
        CONNECT, GREETING, EHLO, STARTTLS, AUTH
    }

    private final Stage stage;
    private final int statusCode;

    public TransportSetupException(Stage stage, int statusCode, String message) {
        super(stage + " failed (" + statusCode + "): " + message);
        this.stage = stage;
        this.statusCode = statusCode;
    }

    public TransportSetupException(Stage stage, int statusCode, String message, Throwable cause) {
        super(stage + " failed (" + statusCode + "): " + message, cause);
        this.stage = stage;
        this.statusCode = statusCode;
    }
}
