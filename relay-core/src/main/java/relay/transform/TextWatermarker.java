package relay.transform;

import relay.model.WatermarkConfig;

import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Point;
import java.awt.RenderingHints;

/**
 * Text watermarks: appended to captions, and drawn onto images with an outline.
 */
public final class TextWatermarker {
    /** Discord rejects webhook {@code content} longer than this. */
    public static final int DISCORD_CONTENT_LIMIT = 2000;

    private static final char ELLIPSIS = '\u2026';
    private static final int[][] OUTLINE_DIRECTIONS = {
            {-1, -1}, {0, -1}, {1, -1},
            {-1, 0}, {1, 0},
            {-1, 1}, {0, 1}, {1, 1}
    };

    private TextWatermarker() {
    }

    /**
     * Returns {@code [prefix + " "] + text + [" " + content]}; for example {@code "hello"} with
     * content {@code "[relayed]"} becomes {@code "hello [relayed]"}. Capped at
     * {@link #DISCORD_CONTENT_LIMIT}.
     */
    public static String caption(String text, WatermarkConfig config) {
        return caption(text, config, DISCORD_CONTENT_LIMIT);
    }

    /**
     * Like {@link #caption(String, WatermarkConfig)}, but when the result would exceed
     * {@code maxLength} the source text is shortened instead of the watermark.
     */
    public static String caption(String text, WatermarkConfig config, int maxLength) {
        String head = "";
        String prefix = config.textPrefix();
        if (prefix != null && !prefix.isBlank()) {
            head = prefix.strip() + ' ';
        }
        String tail = "";
        String content = config.textContent().strip();
        if (!content.isEmpty()) {
            tail = ' ' + content;
        }
        int room = maxLength - head.length() - tail.length();
        if (room <= 0) {
            return truncate(head + tail.strip(), maxLength);
        }
        return head + truncate(text, room) + tail;
    }

    /**
     * Shortens {@code text} to at most {@code maxLength} chars, ending it with an ellipsis when
     * anything was cut. Never splits a surrogate pair.
     */
    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 0) {
            return "";
        }
        int cut = maxLength - 1;
        if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + ELLIPSIS;
    }

    /**
     * Draws the configured text onto a canvas. The outline is eight copies of the text offset by
     * {@code outlineWidth} in each neighboring direction, drawn before the fill pass.
     */
    public static void draw(Graphics2D g, int canvasWidth, int canvasHeight, WatermarkConfig config) {
        String text = config.textContent().strip();
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, config.fontSize()));
        FontMetrics metrics = g.getFontMetrics();
        int textWidth = metrics.stringWidth(text);
        int textHeight = metrics.getAscent() + metrics.getDescent();

        Point origin = PositionCalculator.position(canvasWidth, canvasHeight, textWidth, textHeight,
                config.textPosition(), config.textCustomX(), config.textCustomY());
        int baseline = origin.y + metrics.getAscent();

        int outline = config.outlineWidth();
        if (outline > 0) {
            g.setColor(WatermarkColors.parse(config.outlineColor()));
            for (int[] d : OUTLINE_DIRECTIONS) {
                g.drawString(text, origin.x + d[0] * outline, baseline + d[1] * outline);
            }
        }
        g.setColor(WatermarkColors.parse(config.fillColor()));
        g.drawString(text, origin.x, baseline);
    }
}
