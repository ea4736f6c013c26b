package com.stormcell.service.analysis;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.ImagePoint;
import com.stormcell.model.Pixel;
import com.stormcell.model.ShapeFit;
import com.stormcell.model.ShapeType;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Fits a major and minor axis to the strong pixels of a cell and classifies
 * the cell by the eccentricity of that axis pair.
 * <p>
 * The major axis runs from the centroid to the farthest strong pixel. The
 * minor half-length is the widest perpendicular deviation of any strong pixel
 * from the major-axis line.
 */
@Component
public class ShapeAnalyzer {

    private final StormAnalysisProperties.Shape settings;

    public ShapeAnalyzer(StormAnalysisProperties properties) {
        this.settings = properties.getShape();
    }

    public ShapeFit fit(Collection<Pixel> members, ImagePoint centroid) {
        int strongCount = 0;
        double majorLength = 0.0;
        ImagePoint farthest = new ImagePoint(0, 0);

        for (Pixel pixel : members) {
            if (isStrong(pixel)) {
                strongCount++;
                ImagePoint point = new ImagePoint(pixel.getX(), pixel.getY());
                double dist = point.distance(centroid);
                if (dist > majorLength) {
                    majorLength = dist;
                    farthest = point;
                }
            }
        }

        double minorLength = 0.0;
        double orientation = 0.0;
        if (majorLength > 0) {
            orientation = Math.atan2(farthest.getY() - centroid.getY(), farthest.getX() - centroid.getX());
            for (Pixel pixel : members) {
                if (isStrong(pixel)) {
                    minorLength = Math.max(minorLength, distanceFromLine(pixel, centroid, farthest));
                }
            }
        }

        double eccentricity = eccentricity(majorLength, minorLength);
        boolean drawable = strongCount >= settings.getMajorPixelThreshold();
        return new ShapeFit(farthest, majorLength, minorLength, orientation, eccentricity, strongCount, drawable);
    }

    public ShapeType classify(ShapeFit fit) {
        return classify(fit.getEccentricity());
    }

    public ShapeType classify(double eccentricity) {
        if (eccentricity >= settings.getTypeThreshold() && eccentricity < 1.0) {
            return ShapeType.MULTI_CELL;
        }
        return ShapeType.SINGLE_CELL;
    }

    /**
     * sqrt(1 - (minor / major)^2); 0 for a zero-length major axis or a minor
     * axis that exceeds the major one.
     */
    static double eccentricity(double majorAxis, double minorAxis) {
        if (majorAxis <= 0) {
            return 0.0;
        }
        double ratio = minorAxis / majorAxis;
        if (ratio > 1.0) {
            return 0.0;
        }
        return Math.sqrt(1.0 - ratio * ratio);
    }

    /**
     * Perpendicular distance of the pixel from the line through start and end;
     * 0 if the two points coincide.
     */
    static double distanceFromLine(Pixel pixel, ImagePoint start, ImagePoint end) {
        double x0 = start.getX();
        double y0 = start.getY();
        double x1 = end.getX();
        double y1 = end.getY();
        double lineLength = Math.hypot(x1 - x0, y1 - y0);
        if (lineLength == 0) {
            return 0.0;
        }
        double cross = (y1 - y0) * pixel.getX() - (x1 - x0) * pixel.getY() + x1 * y0 - y1 * x0;
        return Math.abs(cross) / lineLength;
    }

    private boolean isStrong(Pixel pixel) {
        return pixel.getIntensity() >= settings.getStrongIntensity();
    }
}
