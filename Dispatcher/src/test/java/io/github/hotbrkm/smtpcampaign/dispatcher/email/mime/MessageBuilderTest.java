package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MessageBuilder test")
class MessageBuilderTest {

    private static final String SENDER = "sender@example.com";
    private static final String HTML = "<html><body><h1>Hello</h1><p>Campaign body</p></body></html>";
    private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 13};
    private static final byte[] PDF_BYTES = "%PDF-1.4\n%test document\n".getBytes(StandardCharsets.US_ASCII);

    @Nested
    @DisplayName("Message structure")
    class Structure {

        @Test
        @DisplayName("Without attachments the message is still multipart/mixed with one base64 HTML part")
        void buildShouldCreateMultipartWithOnlyHtmlPart() throws Exception {
            MessageBuilder builder = new MessageBuilder(SENDER, "Spring sale", HTML, List.of());

            OutboundMessage message = builder.build(RecipientAddress.of("a@x.com"));
            MimeMessage parsed = parse(message.mime());

            assertThat(parsed.isMimeType("multipart/mixed")).isTrue();
            Multipart multipart = (Multipart) parsed.getContent();
            assertThat(multipart.getCount()).isEqualTo(1);

            Part html = multipart.getBodyPart(0);
            assertThat(html.isMimeType("text/html")).isTrue();
            assertThat(html.getContentType()).containsIgnoringCase("charset=UTF-8");
            assertThat(((MimeBodyPart) html).getEncoding()).isEqualTo("base64");
            assertThat(html.getContent()).isEqualTo(HTML);
        }

        @Test
        @DisplayName("A sender that is not a plain address is refused, so no header can be injected")
        void constructorShouldRejectInvalidSender() {
            assertThatThrownBy(() -> new MessageBuilder("a@x.com>\r\nBcc: <evil@z.com", "Spring sale", HTML, List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid sender address");
            assertThatThrownBy(() -> new MessageBuilder("not-an-address", "Spring sale", HTML, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Headers carry sender, single recipient, subject, Message-ID and MIME version")
        void buildShouldSetHeaders() throws Exception {
            MessageBuilder builder = new MessageBuilder(SENDER, "Spring sale", HTML, List.of());

            OutboundMessage message = builder.build(RecipientAddress.of("a@x.com"));
            MimeMessage parsed = parse(message.mime());

            assertThat(((InternetAddress) parsed.getFrom()[0]).getAddress()).isEqualTo(SENDER);
            assertThat(parsed.getAllRecipients()).hasSize(1);
            assertThat(((InternetAddress) parsed.getAllRecipients()[0]).getAddress()).isEqualTo("a@x.com");
            assertThat(parsed.getSubject()).isEqualTo("Spring sale");
            assertThat(parsed.getMessageID()).startsWith("<").endsWith("@example.com>");
            assertThat(parsed.getHeader("MIME-Version", null)).isEqualTo("1.0");
            assertThat(parsed.getHeader("Date", null)).isNotBlank();
        }

        @Test
        @DisplayName("Non-ASCII subject is encoded and decodes back to the original")
        void buildShouldEncodeNonAsciiSubject() throws Exception {
            String subject = "봄 세일 안내 - 최대 50% 할인";
            MessageBuilder builder = new MessageBuilder(SENDER, subject, HTML, List.of());

            OutboundMessage message = builder.build(RecipientAddress.of("a@x.com"));

            assertThat(message.mime()).contains("=?UTF-8?B?");
            assertThat(parse(message.mime()).getSubject()).isEqualTo(subject);
        }

        @Test
        @DisplayName("With attachments the message is multipart/mixed, HTML first, then each attachment in order")
        void buildShouldAppendAttachmentsAfterHtml() throws Exception {
            AttachmentBlob logo = new AttachmentBlob("logo.png", PNG_BYTES);
            AttachmentBlob report = new AttachmentBlob("report.pdf", PDF_BYTES);
            MessageBuilder builder = new MessageBuilder(SENDER, "Report", HTML, List.of(logo, report));

            OutboundMessage message = builder.build(RecipientAddress.of("b@y.com"));
            MimeMessage parsed = parse(message.mime());

            assertThat(parsed.isMimeType("multipart/mixed")).isTrue();
            Multipart multipart = (Multipart) parsed.getContent();
            assertThat(multipart.getCount()).isEqualTo(3);

            Part html = multipart.getBodyPart(0);
            assertThat(html.isMimeType("text/html")).isTrue();
            assertThat(html.getContent()).isEqualTo(HTML);

            Part png = multipart.getBodyPart(1);
            assertThat(png.isMimeType("image/png")).isTrue();
            assertThat(png.getDisposition()).isEqualTo(Part.ATTACHMENT);
            assertThat(png.getFileName()).isEqualTo("logo.png");
            assertThat(readAll(png)).isEqualTo(PNG_BYTES);

            Part pdf = multipart.getBodyPart(2);
            assertThat(pdf.isMimeType("application/pdf")).isTrue();
            assertThat(pdf.getDisposition()).isEqualTo(Part.ATTACHMENT);
            assertThat(pdf.getFileName()).isEqualTo("report.pdf");
            assertThat(readAll(pdf)).isEqualTo(PDF_BYTES);
        }

        @Test
        @DisplayName("Non-ASCII attachment names are kept")
        void buildShouldKeepNonAsciiFileName() throws Exception {
            AttachmentBlob brochure = new AttachmentBlob("안내문.pdf", PDF_BYTES);
            MessageBuilder builder = new MessageBuilder(SENDER, "Brochure", HTML, List.of(brochure));

            MimeMessage parsed = parse(builder.build(RecipientAddress.of("a@x.com")).mime());
            Part part = ((Multipart) parsed.getContent()).getBodyPart(1);

            assertThat(MimeUtility.decodeText(part.getFileName())).isEqualTo("안내문.pdf");
        }

        @Test
        @DisplayName("The same attachments are shared by every recipient's message")
        void buildShouldShareAttachmentsAcrossRecipients() throws Exception {
            AttachmentBlob report = new AttachmentBlob("report.pdf", PDF_BYTES);
            MessageBuilder builder = new MessageBuilder(SENDER, "Report", HTML, List.of(report));

            OutboundMessage first = builder.build(RecipientAddress.of("a@x.com"));
            OutboundMessage second = builder.build(RecipientAddress.of("b@y.com"));

            assertThat(first.attachments().get(0)).isSameAs(second.attachments().get(0));
            assertThat(first.recipient().value()).isEqualTo("a@x.com");
            assertThat(second.recipient().value()).isEqualTo("b@y.com");
        }
    }

    @Nested
    @DisplayName("Attachment typing")
    class AttachmentTyping {

        @Test
        @DisplayName("Content signature decides the type over the extension")
        void resolveContentTypeShouldPreferSignature() throws Exception {
            assertThat(MessageBuilder.resolveContentType(new AttachmentBlob("scan.jpeg", PNG_BYTES)))
                    .isEqualTo(AttachmentContentType.PNG);
            assertThat(MessageBuilder.resolveContentType(new AttachmentBlob("export", PDF_BYTES)))
                    .isEqualTo(AttachmentContentType.PDF);
        }

        @Test
        @DisplayName("Unrecognized content falls back to the extension, then to octet-stream")
        void resolveContentTypeShouldFallBackToExtension() throws Exception {
            byte[] text = "plain words".getBytes(StandardCharsets.US_ASCII);

            assertThat(MessageBuilder.resolveContentType(new AttachmentBlob("notes.txt", text)))
                    .isEqualTo(AttachmentContentType.TEXT);
            assertThat(MessageBuilder.resolveContentType(new AttachmentBlob("blob.bin", text)))
                    .isEqualTo(AttachmentContentType.OCTET_STREAM);
        }

        @Test
        @DisplayName("An image extension over non-image bytes cannot be encoded")
        void resolveContentTypeShouldRejectFakeImage() {
            AttachmentBlob fake = new AttachmentBlob("photo.jpg", "not an image".getBytes(StandardCharsets.US_ASCII));

            assertThatThrownBy(() -> MessageBuilder.resolveContentType(fake))
                    .isInstanceOf(MessageBuildException.class)
                    .hasMessageContaining("Error attaching file photo.jpg");
        }

        @Test
        @DisplayName("An empty attachment fails the build with MessageBuildException")
        void buildShouldFailOnEmptyAttachment() {
            MessageBuilder builder = new MessageBuilder(SENDER, "Report", HTML,
                    List.of(new AttachmentBlob("empty.pdf", new byte[0])));

            assertThatThrownBy(() -> builder.build(RecipientAddress.of("a@x.com")))
                    .isInstanceOf(MessageBuildException.class)
                    .hasMessageContaining("empty.pdf");
        }
    }

    @Test
    @DisplayName("AttachmentBlob copies the payload on creation and on access")
    void attachmentBlobShouldNotExposeItsPayload() {
        byte[] source = PDF_BYTES.clone();
        AttachmentBlob blob = new AttachmentBlob("report.pdf", source);

        source[0] = 'X';
        blob.bytes()[1] = 'Y';

        assertThat(blob.bytes()).isEqualTo(PDF_BYTES);
        assertThat(blob.size()).isEqualTo(PDF_BYTES.length);
    }

    private static MimeMessage parse(String mime) throws Exception {
        return new MimeMessage(Session.getInstance(new Properties()),
                new ByteArrayInputStream(mime.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] readAll(Part part) throws Exception {
        try (InputStream inputStream = part.getInputStream()) {
            return inputStream.readAllBytes();
        }
    }
}
