package com.stormcell.service.source;

import java.awt.image.BufferedImage;

/**
 * Supplier of the most recent radar PPI frame.
 */
public interface RadarImageSource {

    /**
     * @return the location of the newest frame expected to be published
     */
    String latestFrameUrl();

    /**
     * Downloads and decodes the newest frame.
     *
     * @return the decoded radar image
     * @throws com.stormcell.service.StormAnalysisException if the frame cannot be fetched or decoded
     */
    BufferedImage fetchLatest();
}
