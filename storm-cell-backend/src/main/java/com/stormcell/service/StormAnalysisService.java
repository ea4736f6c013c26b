package com.stormcell.service;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.AnalyzedStorm;
import com.stormcell.model.Pixel;
import com.stormcell.model.StormAnalysisResult;
import com.stormcell.service.analysis.StormAssembler;
import com.stormcell.service.imaging.EllipseOutline;
import com.stormcell.service.imaging.PixelClassifier;
import com.stormcell.service.imaging.StormImageRenderer;
import com.stormcell.service.source.RadarImageSource;
import org.locationtech.jts.geom.GeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Service
public class StormAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(StormAnalysisService.class);

    private final StormAssembler assembler;
    private final PixelClassifier classifier;
    private final StormImageRenderer renderer;
    private final StormReportFormatter reportFormatter;
    private final RadarImageSource imageSource;
    private final StormAnalysisProperties properties;
    private final Clock clock;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public StormAnalysisService(StormAssembler assembler,
                                PixelClassifier classifier,
                                StormImageRenderer renderer,
                                StormReportFormatter reportFormatter,
                                RadarImageSource imageSource,
                                StormAnalysisProperties properties,
                                Clock clock) {
        this.assembler = assembler;
        this.classifier = classifier;
        this.renderer = renderer;
        this.reportFormatter = reportFormatter;
        this.imageSource = imageSource;
        this.properties = properties;
        this.clock = clock;
    }

    public StormAnalysisResult analyzePixels(Collection<Pixel> pixels) {
        if (pixels == null) {
            throw new IllegalArgumentException("Pixels are required");
        }
        List<AnalyzedStorm> storms = assembler.assemble(pixels);
        for (AnalyzedStorm storm : storms) {
            if (storm.getFit().isDrawable()) {
                EllipseOutline outline = new EllipseOutline(storm.getCell().getCentroid(), storm.getFit());
                storm.setEllipseGeoJson(outline.toGeoJson(geometryFactory));
            }
        }

        StormAnalysisResult result = new StormAnalysisResult();
        result.setStationName(properties.getStationName());
        result.setProcessedAt(LocalDateTime.now(clock));
        result.setStorms(storms);
        return result;
    }

    public StormAnalysisResult analyzeImage(BufferedImage radarImage) {
        return analyzePixels(classifier.classify(radarImage));
    }

    public StormAnalysisResult analyzeLatest() {
        return analyzeImage(imageSource.fetchLatest());
    }

    /**
     * Paints an analysis result onto the radar image, or onto the base image
     * with the radar legend copied over when one is given.
     */
    public BufferedImage renderImage(BufferedImage radarImage, BufferedImage baseImage, StormAnalysisResult result) {
        BufferedImage canvas = radarImage;
        if (baseImage != null) {
            renderer.copyLegend(radarImage, baseImage);
            canvas = baseImage;
        }
        LOG.debug("Rendering {} storms", result.getStormCount());
        return renderer.render(canvas, result.getStorms());
    }

    public byte[] renderPng(BufferedImage radarImage) {
        StormAnalysisResult result = analyzeImage(radarImage);
        return renderer.encodePng(renderImage(radarImage, null, result));
    }

    public String report(StormAnalysisResult result) {
        return reportFormatter.format(result);
    }
}
