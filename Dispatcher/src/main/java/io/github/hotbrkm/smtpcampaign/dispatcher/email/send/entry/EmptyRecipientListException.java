package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.entry;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.CampaignException;

/**
 * The recipient table has an email column but no valid address in it.
 */
public class EmptyRecipientListException extends CampaignException {

    public EmptyRecipientListException(String message) {
        super(message);
    }
}
