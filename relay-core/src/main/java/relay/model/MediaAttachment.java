package relay.model;

import java.util.Objects;

/**
 * Binary attachment carried by a message.
 *
 * <p>The byte array is owned by the attachment and must not be modified after
 * construction.
 */
public record MediaAttachment(byte[] content, MediaKind kind, String filename, String contentType) {

    public MediaAttachment {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(filename, "filename");
        if (contentType == null || contentType.isBlank()) {
            contentType = MediaKind.contentTypeFor(filename);
        }
    }

    /**
     * Builds an attachment whose kind is detected from the filename.
     */
    public static MediaAttachment of(String filename, byte[] content) {
        String contentType = MediaKind.contentTypeFor(filename);
        return new MediaAttachment(content, MediaKind.detect(filename, contentType), filename, contentType);
    }

    public int size() {
        return content.length;
    }

    /**
     * Returns a copy carrying new bytes and, optionally, a new filename and type.
     */
    public MediaAttachment withContent(byte[] newContent, String newFilename, String newContentType) {
        return new MediaAttachment(newContent, kind, newFilename, newContentType);
    }

    @Override
    public String toString() {
        return "MediaAttachment[kind=" + kind + ", filename=" + filename
                + ", contentType=" + contentType + ", size=" + content.length + "]";
    }
}
