package com.stormcell.model;

/**
 * Principal-axis fit of a cell's strong pixels. Computed per cell during shape
 * analysis and handed to the renderer; not part of the persistent cell state.
 */
public final class ShapeFit {

    private final ImagePoint majorAxisEnd;
    private final double majorAxisLength;
    private final double minorAxisLength;
    private final double orientation; // radians, math convention in image axes
    private final double eccentricity;
    private final int strongPixelCount;
    private final boolean drawable;

    public ShapeFit(ImagePoint majorAxisEnd, double majorAxisLength, double minorAxisLength,
                    double orientation, double eccentricity, int strongPixelCount, boolean drawable) {
        this.majorAxisEnd = majorAxisEnd;
        this.majorAxisLength = majorAxisLength;
        this.minorAxisLength = minorAxisLength;
        this.orientation = orientation;
        this.eccentricity = eccentricity;
        this.strongPixelCount = strongPixelCount;
        this.drawable = drawable;
    }

    public ImagePoint getMajorAxisEnd() {
        return majorAxisEnd;
    }

    public double getMajorAxisLength() {
        return majorAxisLength;
    }

    public double getMinorAxisLength() {
        return minorAxisLength;
    }

    public double getOrientation() {
        return orientation;
    }

    public double getEccentricity() {
        return eccentricity;
    }

    public int getStrongPixelCount() {
        return strongPixelCount;
    }

    /**
     * @return true if enough strong pixels back the fit for an ellipse to be drawn
     */
    public boolean isDrawable() {
        return drawable;
    }

    @Override
    public String toString() {
        return "ShapeFit{" +
                "majorAxisEnd=" + majorAxisEnd +
                ", majorAxisLength=" + majorAxisLength +
                ", minorAxisLength=" + minorAxisLength +
                ", orientation=" + orientation +
                ", eccentricity=" + eccentricity +
                ", strongPixelCount=" + strongPixelCount +
                ", drawable=" + drawable +
                '}';
    }
}
