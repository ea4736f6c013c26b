package com.stormcell.service.analysis;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.ImagePoint;
import org.junit.Test;

import static org.junit.Assert.*;

public class PolarLocatorTest {

    private static final double KM_PER_PIXEL = 200.0 / 235.0;

    private final PolarLocator locator = new PolarLocator(new StormAnalysisProperties());

    @Test
    public void testDistanceIsScaledEuclideanRange() {
        assertEquals(100 * KM_PER_PIXEL, locator.distance(new ImagePoint(300, 200)), 1e-9);
        assertEquals(50 * KM_PER_PIXEL, locator.distance(new ImagePoint(330, 340)), 1e-9);
        assertEquals(0.0, locator.distance(new ImagePoint(300, 300)), 0.0);
    }

    @Test
    public void testCardinalDirections() {
        assertEquals(0.0, locator.bearing(new ImagePoint(300, 200)), 0.0);
        assertEquals(90.0, locator.bearing(new ImagePoint(400, 300)), 0.0);
        assertEquals(180.0, locator.bearing(new ImagePoint(300, 400)), 0.0);
        assertEquals(270.0, locator.bearing(new ImagePoint(200, 300)), 0.0);
    }

    @Test
    public void testDiagonalQuadrants() {
        assertEquals(45.0, locator.bearing(new ImagePoint(400, 200)), 1e-9);
        assertEquals(135.0, locator.bearing(new ImagePoint(400, 400)), 1e-9);
        assertEquals(225.0, locator.bearing(new ImagePoint(200, 400)), 1e-9);
        assertEquals(315.0, locator.bearing(new ImagePoint(200, 200)), 1e-9);
    }

    @Test
    public void testBearingMatchesCompassConventionEverywhere() {
        for (int x = 0; x <= 600; x += 7) {
            for (int y = 0; y <= 600; y += 11) {
                double dx = x - 300.0;
                double dy = 300.0 - y;
                if (dx == 0 && dy == 0) {
                    continue;
                }
                double expected = (Math.toDegrees(Math.atan2(dx, dy)) + 360.0) % 360.0;
                double bearing = locator.bearing(new ImagePoint(x, y));
                assertTrue("bearing out of range at " + x + "," + y, bearing >= 0.0 && bearing < 360.0);
                assertEquals("bearing at " + x + "," + y, expected, bearing, 1e-6);
            }
        }
    }

    @Test
    public void testCentroidOnOriginReportsNorth() {
        assertEquals(0.0, locator.bearing(new ImagePoint(300, 300)), 0.0);
    }

    @Test
    public void testCustomOrigin() {
        StormAnalysisProperties properties = new StormAnalysisProperties();
        properties.getRadar().setCenterX(50.0);
        properties.getRadar().setCenterY(50.0);
        properties.getRadar().setDistanceRatio(2.0);
        PolarLocator custom = new PolarLocator(properties);

        ImagePoint centroid = new ImagePoint(53, 54);
        assertEquals(10.0, custom.distance(centroid), 1e-9);
        assertEquals(180.0 - Math.toDegrees(Math.atan2(3, 4)), custom.bearing(centroid), 1e-9);
    }
}
