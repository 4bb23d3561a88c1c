package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.config.EmailConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads campaign attachments from disk.
 */
@Slf4j
public class AttachmentReader {

    private final EmailConfig.Send sendConfig;

    public AttachmentReader(EmailConfig.Send sendConfig) {
        this.sendConfig = Objects.requireNonNull(sendConfig, "sendConfig must not be null");
    }

    /**
     * <pre>
     * Reads each file into an attachment, keeping the given order.
     *   - The attachment is named after the file name (without directories).
     *   - Files whose extension is not in email.send.allowed-attachment-extensions are refused.
     * </pre>
     *
     * @param paths attachment files
     * @return attachments in the same order as the paths
     * @throws IOException when a file cannot be read
     */
    public List<AttachmentBlob> read(List<Path> paths) throws IOException {
        if (paths == null || paths.isEmpty()) {
            return List.of();
        }

        List<AttachmentBlob> attachments = new ArrayList<>(paths.size());
        for (Path path : paths) {
            attachments.add(read(path));
        }
        return attachments;
    }

    public AttachmentBlob read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        String fileName = path.getFileName().toString();
        String extension = AttachmentContentType.extensionOf(fileName);

        if (!sendConfig.isAllowedAttachmentExtension(extension)) {
            throw new IllegalArgumentException("Unsupported attachment type (" + fileName + "). Allowed: "
                    + sendConfig.getAllowedAttachmentExtensions());
        }

        byte[] content = Files.readAllBytes(path);
        log.debug("Loaded attachment {} ({} bytes)", fileName, content.length);
        return new AttachmentBlob(fileName, content);
    }

}
