package relay.transform;

import org.junit.jupiter.api.Test;
import relay.model.WatermarkPosition;

import java.awt.Point;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PositionCalculatorTest {

    @Test
    void cornersKeepMargin() {
        assertEquals(new Point(20, 20), PositionCalculator.position(800, 600, 100, 50, WatermarkPosition.TOP_LEFT, 0, 0));
        assertEquals(new Point(680, 20), PositionCalculator.position(800, 600, 100, 50, WatermarkPosition.TOP_RIGHT, 0, 0));
        assertEquals(new Point(20, 530), PositionCalculator.position(800, 600, 100, 50, WatermarkPosition.BOTTOM_LEFT, 0, 0));
        assertEquals(new Point(680, 530), PositionCalculator.position(800, 600, 100, 50, WatermarkPosition.BOTTOM_RIGHT, 0, 0));
        assertEquals(new Point(350, 275), PositionCalculator.position(800, 600, 100, 50, WatermarkPosition.CENTER, 0, 0));
    }

    @Test
    void customOffsetIsReturnedVerbatim() {
        assertEquals(new Point(-5, 900),
                PositionCalculator.position(800, 600, 100, 50, WatermarkPosition.CUSTOM, -5, 900));
    }

    @Test
    void assetStaysInsideCanvasForEveryNonCustomPosition() {
        int[][] sizes = {{800, 600, 100, 50}, {100, 100, 90, 90}, {50, 40, 60, 10}, {30, 30, 30, 30}, {1, 1, 0, 0}};
        for (int[] s : sizes) {
            for (WatermarkPosition position : WatermarkPosition.values()) {
                if (position == WatermarkPosition.CUSTOM) {
                    continue;
                }
                Point p = PositionCalculator.position(s[0], s[1], s[2], s[3], position, 0, 0);
                String label = position + " " + s[0] + "x" + s[1] + " asset " + s[2] + "x" + s[3];
                assertTrue(p.x >= 0 && p.y >= 0, label + " -> " + p);
                if (s[2] <= s[0]) {
                    assertTrue(p.x + s[2] <= s[0], label + " -> " + p);
                }
                if (s[3] <= s[1]) {
                    assertTrue(p.y + s[3] <= s[1], label + " -> " + p);
                }
            }
        }
    }
}
