package com.stormcell.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A classified radar image sample: image coordinates, the sampled ARGB color
 * and the reflectivity tier the palette assigned to it (0 if unclassified).
 */
public final class Pixel {

    private final int x;
    private final int y;
    private final int color; // packed ARGB
    private final int intensity; // dBZ tier

    @JsonCreator
    public Pixel(@JsonProperty(value = "x", required = true) int x,
                 @JsonProperty(value = "y", required = true) int y,
                 @JsonProperty(value = "color", required = true) int color,
                 @JsonProperty(value = "intensity", required = true) int intensity) {
        this.x = x;
        this.y = y;
        this.color = color;
        this.intensity = intensity;
    }

    public Pixel(int x, int y, int intensity) {
        this(x, y, 0xFFFFFFFF, intensity);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getColor() {
        return color;
    }

    public int getIntensity() {
        return intensity;
    }

    public boolean isAdjacentTo(Pixel other, int threshold) {
        // long math, an int difference of far-apart coordinates can wrap
        return Math.abs((long) x - other.x) <= threshold && Math.abs((long) y - other.y) <= threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pixel)) {
            return false;
        }
        Pixel pixel = (Pixel) o;
        return x == pixel.x && y == pixel.y && color == pixel.color && intensity == pixel.intensity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, color, intensity);
    }

    @Override
    public String toString() {
        return "Pixel{" +
                "x=" + x +
                ", y=" + y +
                ", color=" + Integer.toHexString(color) +
                ", intensity=" + intensity +
                '}';
    }
}
