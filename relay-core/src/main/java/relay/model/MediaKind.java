package relay.model;

import java.util.Locale;
import java.util.Map;

/**
 * Coarse media class of an attachment.
 */
public enum MediaKind {
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT;

    private static final Map<String, String> CONTENT_TYPES = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("avi", "video/avi"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("m4a", "audio/mp4"),
            Map.entry("pdf", "application/pdf"));

    /**
     * Returns the content type registered for the filename's extension, or
     * {@code application/octet-stream}.
     */
    public static String contentTypeFor(String filename) {
        String ext = extension(filename);
        return CONTENT_TYPES.getOrDefault(ext, "application/octet-stream");
    }

    /**
     * Detects the media class from an explicit content type, falling back to the
     * filename extension. Unknown types are {@link #DOCUMENT}.
     */
    public static MediaKind detect(String filename, String contentType) {
        String type = contentType;
        if (type == null || type.isBlank() || "application/octet-stream".equals(type)) {
            type = contentTypeFor(filename);
        }
        type = type.toLowerCase(Locale.ROOT);
        if (type.startsWith("image/")) {
            return IMAGE;
        }
        if (type.startsWith("video/")) {
            return VIDEO;
        }
        if (type.startsWith("audio/")) {
            return AUDIO;
        }
        return DOCUMENT;
    }

    private static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
