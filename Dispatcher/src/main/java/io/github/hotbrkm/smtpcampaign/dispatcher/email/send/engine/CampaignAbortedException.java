package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.CampaignException;

/**
 * The dispatching thread was interrupted. Recipients not yet resolved are left unsent.
 */
public class CampaignAbortedException extends CampaignException {

    public CampaignAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
