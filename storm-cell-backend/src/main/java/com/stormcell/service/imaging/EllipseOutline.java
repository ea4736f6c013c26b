package com.stormcell.service.imaging;

import com.stormcell.model.ImagePoint;
import com.stormcell.model.ShapeFit;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Rotated ellipse through a cell's fitted axes, sampled at one-degree steps.
 */
public final class EllipseOutline {

    private static final int SAMPLES = 360;

    private final List<Coordinate> outline;

    public EllipseOutline(ImagePoint center, ShapeFit fit) {
        this(center, Math.round(fit.getMajorAxisLength()), Math.round(fit.getMinorAxisLength()),
                fit.getOrientation());
    }

    public EllipseOutline(ImagePoint center, double majorAxis, double minorAxis, double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        outline = new ArrayList<>(SAMPLES);
        for (int i = 0; i < SAMPLES; i++) {
            double theta = Math.toRadians(i);
            double x = majorAxis * Math.cos(theta) * cos - minorAxis * Math.sin(theta) * sin + center.getX();
            double y = majorAxis * Math.cos(theta) * sin + minorAxis * Math.sin(theta) * cos + center.getY();
            outline.add(new Coordinate(x, y));
        }
    }

    public List<Coordinate> getOutline() {
        return outline;
    }

    public Polygon toPolygon(GeometryFactory geometryFactory) {
        Coordinate[] coords = new Coordinate[outline.size() + 1];
        for (int i = 0; i < outline.size(); i++) {
            coords[i] = new Coordinate(outline.get(i));
        }
        coords[outline.size()] = new Coordinate(outline.get(0)); // close ring
        LinearRing ring = geometryFactory.createLinearRing(coords);
        return geometryFactory.createPolygon(ring, null);
    }

    public String toGeoJson(GeometryFactory geometryFactory) {
        GeoJsonWriter writer = new GeoJsonWriter();
        writer.setEncodeCRS(false);
        return writer.write(toPolygon(geometryFactory));
    }
}
