package com.stormcell.service.analysis;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.ImagePoint;
import com.stormcell.model.Pixel;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Intensity-weighted centroid of a cluster. Only pixels at or above the
 * cluster intensity floor carry weight, and the weight is the dBZ tier itself.
 */
@Component
public class CentroidCalculator {

    private final int minIntensity;

    public CentroidCalculator(StormAnalysisProperties properties) {
        this.minIntensity = properties.getCluster().getMinIntensity();
    }

    /**
     * @return the rounded weighted centroid, or (0, 0) if no pixel carries weight
     */
    public ImagePoint centroid(Collection<Pixel> cluster) {
        double xSum = 0;
        double ySum = 0;
        double weightSum = 0;

        for (Pixel pixel : cluster) {
            if (pixel.getIntensity() >= minIntensity) {
                double weight = pixel.getIntensity();
                weightSum += weight;
                xSum += pixel.getX() * weight;
                ySum += pixel.getY() * weight;
            }
        }

        if (weightSum == 0) {
            return new ImagePoint(0, 0);
        }
        return new ImagePoint((int) Math.round(xSum / weightSum), (int) Math.round(ySum / weightSum));
    }
}
