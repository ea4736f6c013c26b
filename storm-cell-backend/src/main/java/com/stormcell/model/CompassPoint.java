package com.stormcell.model;

/**
 * Eight-point compass labels. Bins are 45 degrees wide, centered on each label,
 * boundaries inclusive and resolved in declaration order.
 */
public enum CompassPoint {
    N, NE, E, SE, S, SW, W, NW;

    public static CompassPoint fromBearing(double bearing) {
        if ((bearing >= 0.0 && bearing <= 22.5) || (bearing >= 337.5 && bearing <= 360.0)) {
            return N;
        }
        if (bearing >= 22.5 && bearing <= 67.5) {
            return NE;
        }
        if (bearing >= 67.5 && bearing <= 112.5) {
            return E;
        }
        if (bearing >= 112.5 && bearing <= 157.5) {
            return SE;
        }
        if (bearing >= 157.5 && bearing <= 202.5) {
            return S;
        }
        if (bearing >= 202.5 && bearing <= 247.5) {
            return SW;
        }
        if (bearing >= 247.5 && bearing <= 292.5) {
            return W;
        }
        if (bearing >= 292.5 && bearing <= 337.5) {
            return NW;
        }
        throw new IllegalArgumentException("Bearing out of range: " + bearing);
    }
}
