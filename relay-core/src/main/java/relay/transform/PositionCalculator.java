package relay.transform;

import relay.model.WatermarkPosition;

import java.awt.Point;
import java.util.Objects;

/**
 * Top-left coordinates of a watermark asset on a canvas.
 *
 * <p>Corner positions sit {@link #MARGIN} pixels from the edges. Every non-custom result is
 * clamped to {@code [0, canvas - asset]} so the asset stays on the canvas even when it is
 * larger than {@code canvas - 2 * MARGIN}. Custom offsets are returned verbatim.
 */
public final class PositionCalculator {
    public static final int MARGIN = 20;

    private PositionCalculator() {
    }

    public static Point position(int canvasWidth, int canvasHeight, int assetWidth, int assetHeight,
                                 WatermarkPosition position, int customX, int customY) {
        Objects.requireNonNull(position, "position");
        if (canvasWidth < 0 || canvasHeight < 0 || assetWidth < 0 || assetHeight < 0) {
            throw new IllegalArgumentException("dimensions must be >= 0");
        }
        int x;
        int y;
        switch (position) {
            case TOP_LEFT -> {
                x = MARGIN;
                y = MARGIN;
            }
            case TOP_RIGHT -> {
                x = canvasWidth - assetWidth - MARGIN;
                y = MARGIN;
            }
            case BOTTOM_LEFT -> {
                x = MARGIN;
                y = canvasHeight - assetHeight - MARGIN;
            }
            case BOTTOM_RIGHT -> {
                x = canvasWidth - assetWidth - MARGIN;
                y = canvasHeight - assetHeight - MARGIN;
            }
            case CENTER -> {
                x = (canvasWidth - assetWidth) / 2;
                y = (canvasHeight - assetHeight) / 2;
            }
            case CUSTOM -> {
                return new Point(customX, customY);
            }
            default -> throw new IllegalArgumentException("Unknown position " + position);
        }
        return new Point(clamp(x, canvasWidth - assetWidth), clamp(y, canvasHeight - assetHeight));
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, Math.max(0, max)));
    }
}
