package io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.CampaignException;

/**
 * The recipient table has no column whose header contains "email".
 */
public class SchemaException extends CampaignException {

    public SchemaException(String message) {
        super(message);
    }
}
