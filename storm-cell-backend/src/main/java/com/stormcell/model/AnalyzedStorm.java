package com.stormcell.model;

/**
 * A ranked storm cell together with the shape fit it was classified from and,
 * for drawable fits, the fitted ellipse outline as GeoJSON in image coordinates.
 */
public class AnalyzedStorm {

    private final StormCell cell;
    private final ShapeFit fit;
    private String ellipseGeoJson;

    public AnalyzedStorm(StormCell cell, ShapeFit fit) {
        this.cell = cell;
        this.fit = fit;
    }

    public StormCell getCell() {
        return cell;
    }

    public ShapeFit getFit() {
        return fit;
    }

    public String getEllipseGeoJson() {
        return ellipseGeoJson;
    }

    public void setEllipseGeoJson(String ellipseGeoJson) {
        this.ellipseGeoJson = ellipseGeoJson;
    }
}
