package io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;

import java.util.List;

/**
 * Result of one extraction pass: valid recipients in input row order and the rows skipped as invalid.
 */
public record RecipientExtraction(String emailColumn, List<RecipientAddress> recipients, List<RejectedRow> rejectedRows) {

    public RecipientExtraction {
        recipients = List.copyOf(recipients);
        rejectedRows = List.copyOf(rejectedRows);
    }

    public boolean isEmpty() {
        return recipients.isEmpty();
    }

    /**
     * @param rowNumber 1-based data row number (the header row is not counted)
     * @param value     the trimmed cell value that failed validation
     */
    public record RejectedRow(int rowNumber, String value) {
    }
}
