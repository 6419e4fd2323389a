package relay.model;

import java.util.Locale;

/**
 * Which watermark layers a destination applies. Stored by {@link #code()}.
 */
public enum WatermarkMode {
    NONE("none"),
    TEXT("text"),
    IMAGE_OVERLAY("image_overlay"),
    BOTH("both");

    private final String code;

    WatermarkMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean includesText() {
        return this == TEXT || this == BOTH;
    }

    public boolean includesOverlay() {
        return this == IMAGE_OVERLAY || this == BOTH;
    }

    /**
     * Resolves a stored code. {@code "png"} is accepted as a legacy alias of
     * {@link #IMAGE_OVERLAY}.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static WatermarkMode fromCode(String code) {
        if (code == null) {
            return NONE;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        if ("png".equals(normalized)) {
            return IMAGE_OVERLAY;
        }
        for (WatermarkMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown watermark mode: " + code);
    }
}
