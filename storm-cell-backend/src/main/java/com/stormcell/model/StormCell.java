package com.stormcell.model;

import java.util.Collections;
import java.util.List;

/**
 * A connected storm cell derived from classified radar pixels.
 * Instances are immutable; the rank id is attached with {@link #withId(int)}
 * once all cells of a run are known.
 */
public final class StormCell {

    private final int id;
    private final ImagePoint centroid;
    private final double distance; // km from radar origin
    private final double bearing; // compass degrees, 0 = north, clockwise
    private final int maxIntensity;
    private final ShapeType shapeType;
    private final List<Pixel> members;

    public StormCell(int id, ImagePoint centroid, double distance, double bearing,
                     int maxIntensity, ShapeType shapeType, List<Pixel> members) {
        this.id = id;
        this.centroid = centroid;
        this.distance = distance;
        this.bearing = bearing;
        this.maxIntensity = maxIntensity;
        this.shapeType = shapeType;
        this.members = Collections.unmodifiableList(members);
    }

    public StormCell withId(int newId) {
        return new StormCell(newId, centroid, distance, bearing, maxIntensity, shapeType, members);
    }

    public int getId() {
        return id;
    }

    public ImagePoint getCentroid() {
        return centroid;
    }

    public double getDistance() {
        return distance;
    }

    public double getBearing() {
        return bearing;
    }

    public CompassPoint getCompass() {
        return CompassPoint.fromBearing(bearing);
    }

    public int getMaxIntensity() {
        return maxIntensity;
    }

    public ShapeType getShapeType() {
        return shapeType;
    }

    public List<Pixel> getMembers() {
        return members;
    }

    public int getSize() {
        return members.size();
    }

    @Override
    public String toString() {
        return "StormCell{" +
                "id=" + id +
                ", centroid=" + centroid +
                ", distance=" + distance +
                ", bearing=" + bearing +
                ", maxIntensity=" + maxIntensity +
                ", shapeType=" + shapeType +
                ", size=" + members.size() +
                '}';
    }
}
