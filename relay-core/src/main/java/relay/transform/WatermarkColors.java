package relay.transform;

import java.awt.Color;

/**
 * Parses watermark colors written as {@code #RRGGBB} or {@code #RRGGBBAA}.
 */
public final class WatermarkColors {

    private WatermarkColors() {
    }

    public static boolean isValid(String value) {
        if (value == null || (value.length() != 7 && value.length() != 9) || value.charAt(0) != '#') {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalArgumentException if the value is not a valid color
     */
    public static Color parse(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid color: " + value);
        }
        int r = Integer.parseInt(value.substring(1, 3), 16);
        int g = Integer.parseInt(value.substring(3, 5), 16);
        int b = Integer.parseInt(value.substring(5, 7), 16);
        int a = value.length() == 9 ? Integer.parseInt(value.substring(7, 9), 16) : 255;
        return new Color(r, g, b, a);
    }
}
