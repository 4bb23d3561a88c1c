package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;

import java.util.Objects;

public record RecipientOutcome(RecipientAddress recipient, DispatchOutcome outcome) {

    public RecipientOutcome {
        Objects.requireNonNull(recipient, "recipient must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public boolean isSent() {
        return outcome instanceof DispatchOutcome.Sent;
    }
}
