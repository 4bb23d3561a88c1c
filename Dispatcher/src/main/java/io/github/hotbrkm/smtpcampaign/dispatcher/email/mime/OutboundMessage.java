package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;

import java.util.List;
import java.util.Objects;

/**
 * One message for one recipient, together with its rendered MIME text.
 * Built right before it is handed to the transport and dropped afterwards.
 */
public record OutboundMessage(String sender, RecipientAddress recipient, String subject, String htmlBody,
                              List<AttachmentBlob> attachments, String mime) {

    public OutboundMessage {
        Objects.requireNonNull(sender, "sender must not be null");
        Objects.requireNonNull(recipient, "recipient must not be null");
        Objects.requireNonNull(mime, "mime must not be null");
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    @Override
    public String toString() {
        return "OutboundMessage[sender=" + sender + ", recipient=" + recipient + ", subject=" + subject
                + ", attachments=" + attachments.size() + "]";
    }
}
