package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import jakarta.activation.DataHandler;
import jakarta.activation.DataSource;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import lombok.Getter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Properties;

/**
 * Assembles the message as multipart/mixed: the HTML part first, then the attachment parts in order.
 */
@Getter
class MimeMessageBuilder {

    private static final DateTimeFormatter RFC_2822_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);
    private static final String CHARSET = "UTF-8";
    private static final String ENC_BASE64 = "base64";
    private static final String HEADER_WORD_ENCODING = "B";

    private static final Session SESSION = Session.getInstance(new Properties());

    private final MimeMessage mimeMessage;
    private final MimeMultipart mixedContent;

    private String from;
    private String to;
    private String subject;
    private String messageId;

    MimeMessageBuilder() {
        mimeMessage = new MimeMessage(SESSION);
        mixedContent = new MimeMultipart("mixed");
    }

    public void setFrom(String name, String email) {
        from = formatAddress(name, email);
    }

    public void setTo(String name, String email) {
        to = formatAddress(name, email);
    }

    private String formatAddress(String name, String email) {
        String address = "<" + email.trim() + ">";
        if (name == null || name.isBlank()) {
            return address;
        }
        try {
            return "\"" + MimeUtility.fold(9, MimeUtility.encodeText(name.trim(), CHARSET, HEADER_WORD_ENCODING)) + "\" " + address;
        } catch (UnsupportedEncodingException ex) {
            return address;
        }
    }

    public void setSubject(String subject) throws UnsupportedEncodingException {
        String value = subject == null ? "" : subject.trim();
        this.subject = MimeUtility.fold(9, MimeUtility.encodeText(value, CHARSET, HEADER_WORD_ENCODING));
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    /**
     * Adds the HTML body part. Always the first part of the message.
     */
    public void addHtmlContent(String content) throws MessagingException {
        MimeBodyPart bodyPart = new MimeBodyPart();
        bodyPart.setText(content == null ? "" : content, CHARSET, "html");
        bodyPart.setHeader("Content-Transfer-Encoding", ENC_BASE64);
        mixedContent.addBodyPart(bodyPart);
    }

    /**
     * Adds an attachment part backed by the shared payload of the blob.
     */
    public void addAttachment(AttachmentBlob attachment, AttachmentContentType contentType) throws MessagingException, UnsupportedEncodingException {
        MimeBodyPart attachmentPart = new MimeBodyPart();
        attachmentPart.setDataHandler(new DataHandler(new AttachmentDataSource(attachment, contentType.getMimeType())));

        String encodedFileName = MimeUtility.encodeText(attachment.fileName().trim(), CHARSET, HEADER_WORD_ENCODING);
        attachmentPart.setDisposition(Part.ATTACHMENT);
        attachmentPart.setFileName(encodedFileName);
        attachmentPart.setHeader("Content-Transfer-Encoding", ENC_BASE64);

        mixedContent.addBodyPart(attachmentPart);
    }

    public void makeHeader() throws MessagingException {
        mimeMessage.setHeader("From", from);
        mimeMessage.setHeader("To", to);
        mimeMessage.setHeader("Subject", subject);
        mimeMessage.setHeader("Date", ZonedDateTime.now().format(RFC_2822_FORMATTER));
        mimeMessage.setHeader("MIME-Version", "1.0");
    }

    public void makeBody() throws MessagingException {
        mimeMessage.setContent(mixedContent);
        mimeMessage.saveChanges();
        // saveChanges() assigns its own Message-ID
        if (messageId != null) {
            mimeMessage.setHeader("Message-ID", messageId);
        }
    }

    /**
     * Returns the MIME header and body as a String.
     */
    public String render() throws MessagingException, IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        mimeMessage.writeTo(outputStream);
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    private record AttachmentDataSource(AttachmentBlob attachment, String contentType) implements DataSource {

        @Override
        public InputStream getInputStream() {
            return attachment.openStream();
        }

        @Override
        public OutputStream getOutputStream() throws IOException {
            throw new IOException("Attachment payloads are read-only");
        }

        @Override
        public String getContentType() {
            return contentType;
        }

        @Override
        public String getName() {
            return attachment.fileName();
        }
    }
}
