package com.stormcell.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.locationtech.jts.geom.Coordinate;

import java.util.Objects;

/**
 * Integer position in image space (y grows downward).
 */
public final class ImagePoint {

    private final int x;
    private final int y;

    @JsonCreator
    public ImagePoint(@JsonProperty("x") int x, @JsonProperty("y") int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public double distance(ImagePoint other) {
        return toCoordinate().distance(other.toCoordinate());
    }

    public Coordinate toCoordinate() {
        return new Coordinate(x, y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImagePoint)) {
            return false;
        }
        ImagePoint that = (ImagePoint) o;
        return x == that.x && y == that.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
