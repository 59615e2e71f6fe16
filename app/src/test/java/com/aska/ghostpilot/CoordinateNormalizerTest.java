package com.aska.ghostpilot;

import org.junit.jupiter.api.Test;

import java.awt.Point;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoordinateNormalizerTest {

    private final CoordinateNormalizer phone = new CoordinateNormalizer(1080, 2400);

    @Test
    void largeScreenTreatsInRangeValuesAsNormalized() {
        assertTrue(phone.isNormalized(500, 500));
        assertTrue(phone.isNormalized(0, 1000));
        assertEquals(new Point(540, 1200), phone.toPixel(500, 500));
    }

    @Test
    void landscapeScreen() {
        CoordinateNormalizer landscape = new CoordinateNormalizer(1920, 1080);
        assertTrue(landscape.isNormalized(500, 500));
        assertEquals(new Point(960, 540), landscape.resolve(500, 500, CoordinateSystem.AUTO));
        assertEquals(new Point(1500, 500), landscape.resolve(1500, 500, CoordinateSystem.AUTO));
    }

    @Test
    void valuesOutsideRangeArePixels() {
        assertFalse(phone.isNormalized(1500, 300));
        assertFalse(phone.isNormalized(-1, 5));
        assertEquals(new Point(1500, 300), phone.resolve(1500, 300, CoordinateSystem.AUTO));
    }

    @Test
    void smallScreenUsesNinetyPercentRule() {
        CoordinateNormalizer small = new CoordinateNormalizer(720, 1000);
        assertTrue(small.isNormalized(500, 500));
        // 648 = 720 * 0.9, 900 = 1000 * 0.9
        assertFalse(small.isNormalized(700, 950));
        assertTrue(small.isNormalized(700, 100));
    }

    @Test
    void edgeOfRangeMapsToScreenEdge() {
        assertEquals(new Point(1080, 2400), phone.toPixel(1000, 1000));
        assertEquals(new Point(0, 0), phone.toPixel(0, 0));
    }

    @Test
    void explicitCoordinateSystems() {
        assertEquals(new Point(500, 500), phone.resolve(500, 500, CoordinateSystem.PIXEL));
        CoordinateNormalizer small = new CoordinateNormalizer(720, 1000);
        assertEquals(new Point(504, 950), small.resolve(700, 950, CoordinateSystem.NORMALIZED));
        assertEquals(new Point(1200, 10), small.resolve(1200, 10, CoordinateSystem.NORMALIZED));
        assertEquals(new Point(540, 1200), phone.resolve(500, 500, null));
    }

    @Test
    void invalidSizeFallsBackToDefaults() {
        CoordinateNormalizer normalizer = new CoordinateNormalizer(0, -5);
        assertEquals(Config.DEFAULT_SCREEN_WIDTH, normalizer.getScreenWidth());
        assertEquals(Config.DEFAULT_SCREEN_HEIGHT, normalizer.getScreenHeight());
    }

    @Test
    void coordinateSystemNames() {
        assertEquals(CoordinateSystem.NORMALIZED, CoordinateSystem.fromString("relative"));
        assertEquals(CoordinateSystem.PIXEL, CoordinateSystem.fromString("Absolute"));
        assertEquals(CoordinateSystem.AUTO, CoordinateSystem.fromString(null));
        assertEquals(CoordinateSystem.AUTO, CoordinateSystem.fromString("whatever"));
    }
}
