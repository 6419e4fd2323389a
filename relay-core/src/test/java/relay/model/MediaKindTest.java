package relay.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MediaKindTest {

    @Test
    void detectsFromContentTypeThenExtension() {
        assertEquals(MediaKind.IMAGE, MediaKind.detect("x.bin", "image/webp"));
        assertEquals(MediaKind.VIDEO, MediaKind.detect("clip.MOV", null));
        assertEquals(MediaKind.AUDIO, MediaKind.detect("voice.ogg", "application/octet-stream"));
        assertEquals(MediaKind.DOCUMENT, MediaKind.detect("notes.txt", null));
    }

    @Test
    void contentTypeFallsBackToOctetStream() {
        assertEquals("image/jpeg", MediaKind.contentTypeFor("a.JPEG"));
        assertEquals("application/octet-stream", MediaKind.contentTypeFor("archive.zip"));
    }
}
