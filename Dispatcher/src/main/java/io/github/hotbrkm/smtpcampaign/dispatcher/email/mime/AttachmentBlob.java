package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * One attachment of a campaign. The payload is copied once on creation and then shared read-only
 * by every message built for the campaign.
 */
public record AttachmentBlob(String fileName, byte[] bytes) {

    public AttachmentBlob {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
        bytes = bytes.clone();
    }

    /**
     * Returns a copy of the payload.
     */
    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * Opens a stream over the shared payload without copying it.
     */
    public InputStream openStream() {
        return new ByteArrayInputStream(bytes);
    }

    byte[] head(int length) {
        return Arrays.copyOf(bytes, Math.min(length, bytes.length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttachmentBlob other)) {
            return false;
        }
        return fileName.equals(other.fileName) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * fileName.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "AttachmentBlob[fileName=" + fileName + ", size=" + bytes.length + "]";
    }
}
