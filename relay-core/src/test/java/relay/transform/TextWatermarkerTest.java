package relay.transform;

import org.junit.jupiter.api.Test;
import relay.model.WatermarkConfig;
import relay.model.WatermarkMode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextWatermarkerTest {

    @Test
    void appendsContentToCaption() {
        WatermarkConfig config = WatermarkConfig.builder().mode(WatermarkMode.TEXT).textContent("[relayed]").build();

        assertEquals("hello [relayed]", TextWatermarker.caption("hello", config));
    }

    @Test
    void prependsPrefixWhenPresent() {
        WatermarkConfig config = WatermarkConfig.builder()
                .mode(WatermarkMode.TEXT)
                .textPrefix("From deals:")
                .textContent("via relay")
                .build();

        assertEquals("From deals: hello via relay", TextWatermarker.caption("hello", config));
    }

    @Test
    void longCaptionKeepsWatermarkWithinDiscordLimit() {
        WatermarkConfig config = WatermarkConfig.builder().mode(WatermarkMode.TEXT).textContent("[relayed]").build();

        String caption = TextWatermarker.caption("x".repeat(2500), config);

        assertEquals(TextWatermarker.DISCORD_CONTENT_LIMIT, caption.length());
        assertTrue(caption.endsWith("x\u2026 [relayed]"), caption.substring(1980));
    }

    @Test
    void shortCaptionIsNotShortened() {
        WatermarkConfig config = WatermarkConfig.builder().mode(WatermarkMode.TEXT).textContent("[relayed]").build();

        String text = "y".repeat(TextWatermarker.DISCORD_CONTENT_LIMIT - " [relayed]".length());

        assertEquals(text + " [relayed]", TextWatermarker.caption(text, config));
    }

    @Test
    void truncateDoesNotSplitSurrogatePairs() {
        String text = "ab\uD83D\uDE00cd";

        assertEquals("ab\u2026", TextWatermarker.truncate(text, 4));
        assertEquals("ab\uD83D\uDE00\u2026", TextWatermarker.truncate(text, 5));
        assertEquals(text, TextWatermarker.truncate(text, 6));
    }

    @Test
    void watermarkLongerThanLimitIsItselfCapped() {
        WatermarkConfig config = WatermarkConfig.builder().mode(WatermarkMode.TEXT).textContent("0123456789AB").build();

        assertEquals("012345678\u2026", TextWatermarker.caption("hello", config, 10));
    }
}
