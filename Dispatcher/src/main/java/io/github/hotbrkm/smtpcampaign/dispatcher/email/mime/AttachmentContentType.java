package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Content types an attachment part can carry.
 * <p>
 * The type is taken from the payload's leading bytes when they are recognized, otherwise from the
 * file extension, otherwise {@link #OCTET_STREAM}.
 */
@Getter
public enum AttachmentContentType {
    PNG("image/png", true, List.of("png"), new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}),
    JPEG("image/jpeg", true, List.of("jpg", "jpeg"), new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}),
    GIF("image/gif", true, List.of("gif"), "GIF8".getBytes(StandardCharsets.US_ASCII)),
    PDF("application/pdf", false, List.of("pdf"), "%PDF-".getBytes(StandardCharsets.US_ASCII)),
    ZIP("application/zip", false, List.of("zip"), new byte[]{'P', 'K', 0x03, 0x04}),
    TEXT("text/plain", false, List.of("txt"), null),
    CSV("text/csv", false, List.of("csv"), null),
    HTML("text/html", false, List.of("html", "htm"), null),
    OCTET_STREAM("application/octet-stream", false, List.of(), null);

    static final int SIGNATURE_LENGTH = 8;

    private final String mimeType;
    private final boolean image;
    private final List<String> extensions;
    private final byte[] signature;

    AttachmentContentType(String mimeType, boolean image, List<String> extensions, byte[] signature) {
        this.mimeType = mimeType;
        this.image = image;
        this.extensions = extensions;
        this.signature = signature;
    }

    public static Optional<AttachmentContentType> fromFileName(String fileName) {
        String extension = extensionOf(fileName);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.extensions.contains(extension))
                .findFirst();
    }

    public static Optional<AttachmentContentType> fromContent(byte[] head) {
        if (head == null || head.length == 0) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.signature != null && startsWith(head, type.signature))
                .findFirst();
    }

    /**
     * Lower-cased extension without the dot, or an empty string.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex == -1 || dotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dotIndex + 1).trim().toLowerCase(Locale.ROOT);
    }

    private static boolean startsWith(byte[] head, byte[] signature) {
        if (head.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (head[i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
