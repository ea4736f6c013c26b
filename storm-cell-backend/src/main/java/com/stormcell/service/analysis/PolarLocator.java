package com.stormcell.service.analysis;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.ImagePoint;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Component;

/**
 * Places a centroid relative to the radar origin: scaled range and compass
 * bearing (0 = north, i.e. up in the image, increasing clockwise).
 */
@Component
public class PolarLocator {

    private final Coordinate origin;
    private final double distanceRatio;

    public PolarLocator(StormAnalysisProperties properties) {
        this.origin = properties.getRadar().centerCoordinate();
        this.distanceRatio = properties.getRadar().getDistanceRatio();
    }

    public double distance(ImagePoint centroid) {
        return centroid.toCoordinate().distance(origin) * distanceRatio;
    }

    /**
     * Compass bearing of the centroid seen from the origin, in [0, 360).
     * A centroid on the origin has no direction and reports 0.
     */
    public double bearing(ImagePoint centroid) {
        double bearing = quadrantBearing(centroid);
        return bearing >= 360.0 ? bearing - 360.0 : bearing;
    }

    private double quadrantBearing(ImagePoint centroid) {
        double x = centroid.getX() - origin.x;
        double y = origin.y - centroid.getY(); // image y grows downward
        double len = Math.sqrt(x * x + y * y);

        if (x > 0 && y > 0) {
            return 90.0 - Math.toDegrees(Math.asin(y / len));
        } else if (x < 0 && y > 0) {
            return 270.0 + Math.toDegrees(Math.asin(y / len));
        } else if (x < 0 && y < 0) {
            return 270.0 - Math.toDegrees(Math.asin(-y / len));
        } else if (x > 0 && y < 0) {
            return 90.0 + Math.toDegrees(Math.asin(-y / len));
        } else if (x == 0 && y > 0) {
            return 0.0;
        } else if (x == 0 && y < 0) {
            return 180.0;
        } else if (x > 0) {
            return 90.0;
        } else if (x < 0) {
            return 270.0;
        }
        return 0.0;
    }
}
