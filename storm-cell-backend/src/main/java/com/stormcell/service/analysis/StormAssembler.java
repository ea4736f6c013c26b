package com.stormcell.service.analysis;

import com.stormcell.model.AnalyzedStorm;
import com.stormcell.model.ImagePoint;
import com.stormcell.model.Pixel;
import com.stormcell.model.ShapeFit;
import com.stormcell.model.StormCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a set of classified pixels into ranked storm cells: cluster, locate,
 * fit, then sort by distance from the radar and number the cells 1..N.
 */
@Service
public class StormAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(StormAssembler.class);

    private final PixelClusterer clusterer;
    private final CentroidCalculator centroidCalculator;
    private final PolarLocator polarLocator;
    private final ShapeAnalyzer shapeAnalyzer;

    public StormAssembler(PixelClusterer clusterer,
                          CentroidCalculator centroidCalculator,
                          PolarLocator polarLocator,
                          ShapeAnalyzer shapeAnalyzer) {
        this.clusterer = clusterer;
        this.centroidCalculator = centroidCalculator;
        this.polarLocator = polarLocator;
        this.shapeAnalyzer = shapeAnalyzer;
    }

    public List<StormCell> assembleCells(Collection<Pixel> pixels) {
        return assemble(pixels).stream()
                .map(AnalyzedStorm::getCell)
                .collect(Collectors.toList());
    }

    /**
     * @return storms ordered by ascending distance, equal distances keeping
     * cluster discovery order, with ids assigned in that order
     */
    public List<AnalyzedStorm> assemble(Collection<Pixel> pixels) {
        List<AnalyzedStorm> drafts = new ArrayList<>();
        for (List<Pixel> cluster : clusterer.cluster(pixels)) {
            drafts.add(analyze(cluster));
        }

        drafts.sort(Comparator.comparingDouble(storm -> storm.getCell().getDistance()));

        List<AnalyzedStorm> ranked = new ArrayList<>(drafts.size());
        for (int rank = 0; rank < drafts.size(); rank++) {
            AnalyzedStorm draft = drafts.get(rank);
            ranked.add(new AnalyzedStorm(draft.getCell().withId(rank + 1), draft.getFit()));
        }

        LOG.info("Assembled {} storm cells from {} classified pixels", ranked.size(), pixels.size());
        return ranked;
    }

    private AnalyzedStorm analyze(List<Pixel> cluster) {
        ImagePoint centroid = centroidCalculator.centroid(cluster);
        double distance = polarLocator.distance(centroid);
        double bearing = polarLocator.bearing(centroid);
        ShapeFit fit = shapeAnalyzer.fit(cluster, centroid);

        StormCell cell = new StormCell(0, centroid, distance, bearing,
                PixelClusterer.maxIntensity(cluster), shapeAnalyzer.classify(fit), cluster);
        LOG.debug("Cell at {}: {} px, {} km, bearing {}, {}", centroid, cluster.size(),
                distance, bearing, fit);
        return new AnalyzedStorm(cell, fit);
    }
}
