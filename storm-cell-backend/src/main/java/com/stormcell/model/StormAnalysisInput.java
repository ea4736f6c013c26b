package com.stormcell.model;

import java.util.List;

public class StormAnalysisInput {

    private List<Pixel> pixels;

    public StormAnalysisInput() {
        // Default constructor
    }

    public StormAnalysisInput(List<Pixel> pixels) {
        this.pixels = pixels;
    }

    public List<Pixel> getPixels() {
        return pixels;
    }

    public void setPixels(List<Pixel> pixels) {
        this.pixels = pixels;
    }
}
