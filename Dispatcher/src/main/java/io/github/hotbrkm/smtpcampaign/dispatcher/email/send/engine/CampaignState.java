package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result.DispatchOutcome;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result.RecipientOutcome;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Position and tallies of one campaign run. Owned by a single {@link DispatchEngine} run.
 */
@Getter
final class CampaignState {

    private final List<RecipientAddress> recipients;
    private final List<RecipientOutcome> outcomes;
    private int index;
    private int sentCount;
    private int failedCount;

    CampaignState(List<RecipientAddress> recipients) {
        this.recipients = List.copyOf(recipients);
        this.outcomes = new ArrayList<>(recipients.size());
    }

    boolean hasNext() {
        return index < recipients.size();
    }

    RecipientAddress current() {
        return recipients.get(index);
    }

    void resolve(DispatchOutcome outcome) {
        outcomes.add(new RecipientOutcome(current(), outcome));
        if (outcome instanceof DispatchOutcome.Sent) {
            sentCount++;
        } else {
            failedCount++;
        }
        index++;
    }

    int total() {
        return recipients.size();
    }

    double progress() {
        return recipients.isEmpty() ? 0.0 : (double) sentCount / recipients.size();
    }

    List<RecipientOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }
}
