package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.entry;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.AttachmentBlob;

import java.util.List;

/**
 * Inputs of one campaign.
 *
 * @param sender         From address; {@code null} uses the configured or authenticated identity
 * @param subject        subject line, not blank
 * @param htmlBody       HTML body, not blank
 * @param recipientTable CSV text with an email column
 * @param attachments    shared by every message, in order
 */
public record CampaignRequest(String sender, String subject, String htmlBody, String recipientTable,
                              List<AttachmentBlob> attachments) {

    public CampaignRequest {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject must not be blank");
        }
        if (htmlBody == null || htmlBody.isBlank()) {
            throw new IllegalArgumentException("Email body must not be blank");
        }
        if (recipientTable == null) {
            throw new IllegalArgumentException("Recipient table must be provided");
        }
        sender = sender == null || sender.isBlank() ? null : sender.trim();
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
