package com.stormcell.service.imaging;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.Pixel;
import com.stormcell.service.StormAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Samples the radar area of a PPI image and keeps every pixel whose color
 * falls into a palette band.
 */
@Component
public class PixelClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(PixelClassifier.class);

    private final ReflectivityPalette palette;
    private final int areaWidth;
    private final int areaHeight;

    public PixelClassifier(ReflectivityPalette palette, StormAnalysisProperties properties) {
        this.palette = palette;
        this.areaWidth = properties.getRadar().getAreaWidth();
        this.areaHeight = properties.getRadar().getAreaHeight();
    }

    public List<Pixel> classify(BufferedImage image) {
        if (areaWidth > image.getWidth() || areaHeight > image.getHeight()) {
            throw new StormAnalysisException(String.format(
                    "Radar area %dx%d exceeds image dimensions %dx%d",
                    areaWidth, areaHeight, image.getWidth(), image.getHeight()));
        }

        List<Pixel> classified = new ArrayList<>();
        for (int x = 0; x < areaWidth; x++) {
            for (int y = 0; y < areaHeight; y++) {
                int argb = image.getRGB(x, y);
                OptionalInt intensity = palette.intensityOf(argb);
                if (intensity.isPresent()) {
                    classified.add(new Pixel(x, y, argb, intensity.getAsInt()));
                }
            }
        }
        LOG.debug("Classified {} echo pixels in a {}x{} radar area", classified.size(), areaWidth, areaHeight);
        return classified;
    }

    public static BufferedImage decode(byte[] data) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                throw new StormAnalysisException("Unsupported or corrupt image data");
            }
            return image;
        } catch (IOException e) {
            throw new StormAnalysisException("Failed to decode radar image", e);
        }
    }
}
