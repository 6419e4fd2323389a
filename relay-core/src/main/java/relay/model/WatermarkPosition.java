package relay.model;

import java.util.Locale;

/**
 * Anchor for a text or overlay watermark on the canvas.
 */
public enum WatermarkPosition {
    TOP_LEFT("top_left"),
    TOP_RIGHT("top_right"),
    BOTTOM_LEFT("bottom_left"),
    BOTTOM_RIGHT("bottom_right"),
    CENTER("center"),
    CUSTOM("custom");

    private final String code;

    WatermarkPosition(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException if the code is unknown
     */
    public static WatermarkPosition fromCode(String code) {
        if (code == null) {
            return BOTTOM_RIGHT;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (WatermarkPosition position : values()) {
            if (position.code.equals(normalized)) {
                return position;
            }
        }
        throw new IllegalArgumentException("Unknown watermark position: " + code);
    }
}
