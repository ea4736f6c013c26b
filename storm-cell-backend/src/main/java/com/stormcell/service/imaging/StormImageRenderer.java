package com.stormcell.service.imaging;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.AnalyzedStorm;
import com.stormcell.model.ImagePoint;
import com.stormcell.model.Pixel;
import com.stormcell.model.StormCell;
import com.stormcell.service.StormAnalysisException;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Paints analyzed storms onto a radar base image: member pixels, centroid,
 * fitted ellipse, a line back to the radar and the cell id.
 */
@Component
public class StormImageRenderer {

    static final int CENTROID_COLOR = 0xFF00FF00;
    static final int CONNECTION_LINE_COLOR = 0xFF6983FF;
    static final int ELLIPSE_COLOR = 0xFF765FFF;
    private static final Color LABEL_COLOR = Color.WHITE;
    private static final int LABEL_OFFSET = 15;

    private final ImagePoint radarCenter;
    private final boolean drawLabels;

    public StormImageRenderer(StormAnalysisProperties properties) {
        Coordinate center = properties.getRadar().centerCoordinate();
        this.radarCenter = new ImagePoint((int) Math.round(center.x), (int) Math.round(center.y));
        this.drawLabels = properties.getRender().isLabels();
    }

    /**
     * Renders onto a copy of the base image; the base image itself is left untouched.
     */
    public BufferedImage render(BufferedImage base, List<AnalyzedStorm> storms) {
        BufferedImage img = copy(base);
        for (AnalyzedStorm storm : storms) {
            StormCell cell = storm.getCell();
            ImagePoint centroid = cell.getCentroid();

            for (Pixel pixel : cell.getMembers()) {
                putPixel(img, pixel.getX(), pixel.getY(), pixel.getColor());
            }
            drawLine(img, radarCenter, centroid, CONNECTION_LINE_COLOR);

            if (storm.getFit().isDrawable()) {
                for (Coordinate c : new EllipseOutline(centroid, storm.getFit()).getOutline()) {
                    putPixel(img, (int) c.x, (int) c.y, ELLIPSE_COLOR);
                }
            }
            // marker goes on top of the line ending in it
            putPixel(img, centroid.getX(), centroid.getY(), CENTROID_COLOR);

            if (drawLabels) {
                drawLabel(img, "#" + cell.getId(), centroid.getX() + LABEL_OFFSET, centroid.getY() - LABEL_OFFSET);
            }
        }
        return img;
    }

    /**
     * Copies the legend strip right of the square radar area from the radar
     * image onto the base image.
     */
    public void copyLegend(BufferedImage radar, BufferedImage base) {
        if (radar.getWidth() != base.getWidth() || radar.getHeight() != base.getHeight()) {
            throw new IllegalArgumentException(String.format("Image dimensions do not match: %dx%d vs %dx%d",
                    radar.getWidth(), radar.getHeight(), base.getWidth(), base.getHeight()));
        }
        for (int x = radar.getHeight(); x < radar.getWidth(); x++) {
            for (int y = 0; y < radar.getHeight(); y++) {
                base.setRGB(x, y, radar.getRGB(x, y));
            }
        }
    }

    public byte[] encodePng(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new StormAnalysisException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new StormAnalysisException("Failed to encode result image", e);
        }
        return out.toByteArray();
    }

    static void drawLine(BufferedImage img, ImagePoint start, ImagePoint end, int argb) {
        int dx = Math.abs(end.getX() - start.getX());
        int dy = Math.abs(end.getY() - start.getY());
        int sx = start.getX() < end.getX() ? 1 : -1;
        int sy = start.getY() < end.getY() ? 1 : -1;
        int err = dx - dy;

        int x = start.getX();
        int y = start.getY();
        while (true) {
            putPixel(img, x, y, argb);
            if (x == end.getX() && y == end.getY()) {
                break;
            }
            int e2 = 2 * err;
            if (e2 > -dy) {
                err -= dy;
                x += sx;
            }
            if (e2 < dx) {
                err += dx;
                y += sy;
            }
        }
    }

    private static void putPixel(BufferedImage img, int x, int y, int argb) {
        if (x >= 0 && y >= 0 && x < img.getWidth() && y < img.getHeight()) {
            img.setRGB(x, y, argb);
        }
    }

    private static void drawLabel(BufferedImage img, String text, int x, int y) {
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(LABEL_COLOR);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 18));
            // drawString anchors at the baseline, the label box hangs below (x, y)
            g.drawString(text, x, y + g.getFontMetrics().getAscent());
        } finally {
            g.dispose();
        }
    }

    private static BufferedImage copy(BufferedImage source) {
        BufferedImage target = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = target.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
