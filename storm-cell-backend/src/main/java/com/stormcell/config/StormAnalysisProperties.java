package com.stormcell.config;

import org.locationtech.jts.geom.Coordinate;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for storm cell extraction. Defaults reproduce the fixed constants
 * of the Guangzhou 200 km PPI product, so an unbound instance is usable as-is.
 */
@ConfigurationProperties(prefix = "storm")
public class StormAnalysisProperties {

    private String stationName = "GuangZhou";
    private final Cluster cluster = new Cluster();
    private final Shape shape = new Shape();
    private final Radar radar = new Radar();
    private final Palette palette = new Palette();
    private final Render render = new Render();
    private final Source source = new Source();
    private final Batch batch = new Batch();

    public String getStationName() {
        return stationName;
    }

    public void setStationName(String stationName) {
        this.stationName = stationName;
    }

    public Cluster getCluster() {
        return cluster;
    }

    public Shape getShape() {
        return shape;
    }

    public Radar getRadar() {
        return radar;
    }

    public Palette getPalette() {
        return palette;
    }

    public Render getRender() {
        return render;
    }

    public Source getSource() {
        return source;
    }

    public Batch getBatch() {
        return batch;
    }

    public static class Cluster {
        private int adjacentThreshold = 2; // Chebyshev radius in pixels
        private int minSize = 40; // a cluster must be strictly larger
        private int minIntensity = 45; // dBZ, inclusive

        public int getAdjacentThreshold() {
            return adjacentThreshold;
        }

        public void setAdjacentThreshold(int adjacentThreshold) {
            this.adjacentThreshold = adjacentThreshold;
        }

        public int getMinSize() {
            return minSize;
        }

        public void setMinSize(int minSize) {
            this.minSize = minSize;
        }

        public int getMinIntensity() {
            return minIntensity;
        }

        public void setMinIntensity(int minIntensity) {
            this.minIntensity = minIntensity;
        }
    }

    public static class Shape {
        private int strongIntensity = 45; // dBZ floor for axis fitting
        private int majorPixelThreshold = 50;
        private double typeThreshold = 0.88;

        public int getStrongIntensity() {
            return strongIntensity;
        }

        public void setStrongIntensity(int strongIntensity) {
            this.strongIntensity = strongIntensity;
        }

        public int getMajorPixelThreshold() {
            return majorPixelThreshold;
        }

        public void setMajorPixelThreshold(int majorPixelThreshold) {
            this.majorPixelThreshold = majorPixelThreshold;
        }

        public double getTypeThreshold() {
            return typeThreshold;
        }

        public void setTypeThreshold(double typeThreshold) {
            this.typeThreshold = typeThreshold;
        }
    }

    public static class Radar {
        private double centerX = 300.0;
        private double centerY = 300.0;
        private int areaWidth = 599;
        private int areaHeight = 599;
        // 200 km range ring sits 235 px from the center
        private double distanceRatio = 200.0 / (300.0 - 65.0);

        public Coordinate centerCoordinate() {
            return new Coordinate(centerX, centerY);
        }

        public double getCenterX() {
            return centerX;
        }

        public void setCenterX(double centerX) {
            this.centerX = centerX;
        }

        public double getCenterY() {
            return centerY;
        }

        public void setCenterY(double centerY) {
            this.centerY = centerY;
        }

        public int getAreaWidth() {
            return areaWidth;
        }

        public void setAreaWidth(int areaWidth) {
            this.areaWidth = areaWidth;
        }

        public int getAreaHeight() {
            return areaHeight;
        }

        public void setAreaHeight(int areaHeight) {
            this.areaHeight = areaHeight;
        }

        public double getDistanceRatio() {
            return distanceRatio;
        }

        public void setDistanceRatio(double distanceRatio) {
            this.distanceRatio = distanceRatio;
        }
    }

    public static class Palette {
        private String location = "classpath:reflectivity-palette.json";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Render {
        private boolean labels = true; // needs fonts, off on bare headless hosts

        public boolean isLabels() {
            return labels;
        }

        public void setLabels(boolean labels) {
            this.labels = labels;
        }
    }

    public static class Source {
        private String urlHead = "http://tqyb.com.cn/data/radar/gz/19/";
        private String urlMiddle = "/Z9200_";
        private String urlEnd = "Z_PPI_02_19.png";
        private int stepMinutes = 6;
        private int lagMinutes = 12; // frames are published with a delay

        public String getUrlHead() {
            return urlHead;
        }

        public void setUrlHead(String urlHead) {
            this.urlHead = urlHead;
        }

        public String getUrlMiddle() {
            return urlMiddle;
        }

        public void setUrlMiddle(String urlMiddle) {
            this.urlMiddle = urlMiddle;
        }

        public String getUrlEnd() {
            return urlEnd;
        }

        public void setUrlEnd(String urlEnd) {
            this.urlEnd = urlEnd;
        }

        public int getStepMinutes() {
            return stepMinutes;
        }

        public void setStepMinutes(int stepMinutes) {
            if (stepMinutes <= 0) {
                throw new IllegalArgumentException("storm.source.step-minutes must be positive: " + stepMinutes);
            }
            this.stepMinutes = stepMinutes;
        }

        public int getLagMinutes() {
            return lagMinutes;
        }

        public void setLagMinutes(int lagMinutes) {
            this.lagMinutes = lagMinutes;
        }
    }

    public static class Batch {
        private String inputImage;
        private String baseImage;
        private String outputImage = "result.png";

        public String getInputImage() {
            return inputImage;
        }

        public void setInputImage(String inputImage) {
            this.inputImage = inputImage;
        }

        public String getBaseImage() {
            return baseImage;
        }

        public void setBaseImage(String baseImage) {
            this.baseImage = baseImage;
        }

        public String getOutputImage() {
            return outputImage;
        }

        public void setOutputImage(String outputImage) {
            this.outputImage = outputImage;
        }
    }
}
