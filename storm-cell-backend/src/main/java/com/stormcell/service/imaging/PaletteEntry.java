package com.stormcell.service.imaging;

/**
 * One palette color band: a reference RGBA color, the per-channel tolerance
 * around it and the dBZ tier it stands for.
 */
public final class PaletteEntry {

    private final int[] rgba;
    private final int tolerance;
    private final int intensity;

    public PaletteEntry(int red, int green, int blue, int alpha, int tolerance, int intensity) {
        this.rgba = new int[] { red, green, blue, alpha };
        this.tolerance = tolerance;
        this.intensity = intensity;
    }

    public int getIntensity() {
        return intensity;
    }

    public int getTolerance() {
        return tolerance;
    }

    public int getArgb() {
        return (rgba[3] << 24) | (rgba[0] << 16) | (rgba[1] << 8) | rgba[2];
    }

    /**
     * Channel-wise range test, saturating at 0 and 255, alpha included.
     */
    public boolean matches(int argb) {
        int[] channels = {
                (argb >> 16) & 0xFF,
                (argb >> 8) & 0xFF,
                argb & 0xFF,
                (argb >>> 24) & 0xFF
        };
        for (int i = 0; i < channels.length; i++) {
            int low = Math.max(0, rgba[i] - tolerance);
            int high = Math.min(255, rgba[i] + tolerance);
            if (channels[i] < low || channels[i] > high) {
                return false;
            }
        }
        return true;
    }
}
