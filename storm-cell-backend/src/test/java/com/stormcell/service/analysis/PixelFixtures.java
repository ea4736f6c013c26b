package com.stormcell.service.analysis;

import com.stormcell.model.Pixel;

import java.util.ArrayList;
import java.util.List;

public class PixelFixtures {

    /**
     * Rectangular block of pixels, columns outer, rows inner.
     */
    public static List<Pixel> block(int x0, int y0, int width, int height, int intensity) {
        List<Pixel> pixels = new ArrayList<>();
        for (int x = x0; x < x0 + width; x++) {
            for (int y = y0; y < y0 + height; y++) {
                pixels.add(new Pixel(x, y, intensity));
            }
        }
        return pixels;
    }

    public static List<Pixel> row(int x0, int y, int length, int intensity) {
        return block(x0, y, length, 1, intensity);
    }
}
