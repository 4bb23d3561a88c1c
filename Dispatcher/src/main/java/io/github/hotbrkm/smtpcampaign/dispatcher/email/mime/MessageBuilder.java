package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.EmailAddressUtil;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the per-recipient message of a campaign from the shared campaign content.
 */
@Slf4j
public class MessageBuilder {

    private final String sender;
    private final String subject;
    private final String htmlBody;
    private final List<AttachmentBlob> attachments;

    /**
     * @throws IllegalArgumentException when the sender is not a valid address
     */
    public MessageBuilder(String sender, String subject, String htmlBody, List<AttachmentBlob> attachments) {
        if (!EmailAddressUtil.isValid(sender)) {
            throw new IllegalArgumentException("Invalid sender address: " + sender);
        }
        this.sender = sender;
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.htmlBody = Objects.requireNonNull(htmlBody, "htmlBody must not be null");
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * @param recipient the single recipient of the message
     * @return the message with its rendered MIME text
     * @throws MessageBuildException when an attachment part cannot be encoded or rendering fails
     */
    public OutboundMessage build(RecipientAddress recipient) throws MessageBuildException {
        Objects.requireNonNull(recipient, "recipient must not be null");
        log.debug("Creating email message for: {}", recipient);

        MimeMessageBuilder messageBuilder = new MimeMessageBuilder();
        try {
            messageBuilder.setFrom(null, sender);
            messageBuilder.setTo(null, recipient.value());
            messageBuilder.setSubject(subject);
            messageBuilder.setMessageId(MessageIdGenerator.next(sender));
            messageBuilder.addHtmlContent(htmlBody);
            for (AttachmentBlob attachment : attachments) {
                messageBuilder.addAttachment(attachment, resolveContentType(attachment));
            }
            messageBuilder.makeHeader();
            messageBuilder.makeBody();

            return new OutboundMessage(sender, recipient, subject, htmlBody, attachments, messageBuilder.render());
        } catch (MessageBuildException e) {
            throw e;
        } catch (Exception e) {
            throw new MessageBuildException("Failed to build message for " + recipient + ": " + e.getMessage(), e);
        }
    }

    /**
     * Picks the part type from the payload signature, then the extension.
     * An image extension over bytes that are not an image cannot be encoded as an image part.
     */
    static AttachmentContentType resolveContentType(AttachmentBlob attachment) throws MessageBuildException {
        if (attachment.isEmpty()) {
            throw new MessageBuildException("Error attaching file " + attachment.fileName() + ": attachment is empty");
        }

        Optional<AttachmentContentType> byContent = AttachmentContentType.fromContent(attachment.head(AttachmentContentType.SIGNATURE_LENGTH));
        Optional<AttachmentContentType> byName = AttachmentContentType.fromFileName(attachment.fileName());

        if (byName.isPresent() && byName.get().isImage() && byContent.filter(AttachmentContentType::isImage).isEmpty()) {
            throw new MessageBuildException("Error attaching file " + attachment.fileName()
                    + ": declared as " + byName.get().getMimeType() + " but the content is not an image");
        }

        return byContent.or(() -> byName).orElse(AttachmentContentType.OCTET_STREAM);
    }
}
