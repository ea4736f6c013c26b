package com.stormcell.service.analysis;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.AnalyzedStorm;
import com.stormcell.model.ImagePoint;
import com.stormcell.model.Pixel;
import com.stormcell.model.ShapeType;
import com.stormcell.model.StormCell;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.stormcell.service.analysis.PixelFixtures.block;
import static org.junit.Assert.*;

public class StormAssemblerTest {

    private static StormAssembler createAssembler(StormAnalysisProperties properties) {
        return new StormAssembler(
                new PixelClusterer(properties),
                new CentroidCalculator(properties),
                new PolarLocator(properties),
                new ShapeAnalyzer(properties));
    }

    private static StormAssembler createAssembler(int minSize) {
        StormAnalysisProperties properties = new StormAnalysisProperties();
        properties.getCluster().setMinSize(minSize);
        return createAssembler(properties);
    }

    @Test
    public void testSmallGroupSurvivesAndIsolatedPixelIsDropped() {
        List<Pixel> pixels = Arrays.asList(
                new Pixel(10, 10, 50),
                new Pixel(10, 11, 50),
                new Pixel(11, 10, 50),
                new Pixel(11, 11, 50),
                new Pixel(100, 100, 50));

        List<StormCell> cells = createAssembler(3).assembleCells(pixels);

        assertEquals(1, cells.size());
        StormCell cell = cells.get(0);
        assertEquals(1, cell.getId());
        assertEquals(4, cell.getSize());
        assertTrue(cell.getCentroid().getX() == 10 || cell.getCentroid().getX() == 11);
        assertTrue(cell.getCentroid().getY() == 10 || cell.getCentroid().getY() == 11);
        assertEquals(50, cell.getMaxIntensity());
        assertEquals(ShapeType.SINGLE_CELL, cell.getShapeType());
    }

    @Test
    public void testIdsFollowAscendingDistance() {
        List<Pixel> pixels = new ArrayList<>();
        pixels.addAll(block(499, 299, 3, 3, 50)); // 200 px east
        pixels.addAll(block(299, 319, 3, 3, 55)); // 20 px south
        pixels.addAll(block(249, 299, 3, 3, 60)); // 50 px west

        List<StormCell> cells = createAssembler(3).assembleCells(pixels);

        assertEquals(3, cells.size());
        assertEquals(new ImagePoint(300, 320), cells.get(0).getCentroid());
        assertEquals(new ImagePoint(250, 300), cells.get(1).getCentroid());
        assertEquals(new ImagePoint(500, 300), cells.get(2).getCentroid());
        for (int i = 0; i < cells.size(); i++) {
            assertEquals(i + 1, cells.get(i).getId());
            if (i > 0) {
                assertTrue(cells.get(i).getDistance() > cells.get(i - 1).getDistance());
            }
        }
        assertEquals(180.0, cells.get(0).getBearing(), 0.0);
        assertEquals(270.0, cells.get(1).getBearing(), 0.0);
        assertEquals(90.0, cells.get(2).getBearing(), 0.0);
        assertEquals(60, cells.get(1).getMaxIntensity());
    }

    @Test
    public void testEqualDistancesKeepDiscoveryOrder() {
        List<Pixel> pixels = new ArrayList<>();
        pixels.addAll(block(199, 299, 3, 3, 50)); // west
        pixels.addAll(block(399, 299, 3, 3, 50)); // east

        List<StormCell> cells = createAssembler(3).assembleCells(pixels);

        assertEquals(2, cells.size());
        assertEquals(cells.get(0).getDistance(), cells.get(1).getDistance(), 0.0);
        assertEquals(new ImagePoint(200, 300), cells.get(0).getCentroid());
        assertEquals(1, cells.get(0).getId());
        assertEquals(new ImagePoint(400, 300), cells.get(1).getCentroid());
        assertEquals(2, cells.get(1).getId());
    }

    @Test
    public void testReassemblyIsDeterministic() {
        List<Pixel> pixels = new ArrayList<>();
        pixels.addAll(block(380, 120, 12, 6, 55));
        pixels.addAll(block(100, 420, 8, 8, 50));
        pixels.addAll(block(310, 280, 7, 7, 65));
        StormAssembler assembler = createAssembler(new StormAnalysisProperties());

        List<StormCell> first = assembler.assembleCells(pixels);
        List<StormCell> second = assembler.assembleCells(pixels);

        assertEquals(3, first.size());
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getId(), second.get(i).getId());
            assertEquals(first.get(i).getCentroid(), second.get(i).getCentroid());
            assertEquals(first.get(i).getDistance(), second.get(i).getDistance(), 0.0);
        }
    }

    @Test
    public void testAssembleKeepsShapeFitAlongsideCell() {
        List<Pixel> pixels = block(400, 295, 40, 3, 50);

        List<AnalyzedStorm> storms = createAssembler(new StormAnalysisProperties()).assemble(pixels);

        assertEquals(1, storms.size());
        AnalyzedStorm storm = storms.get(0);
        assertEquals(120, storm.getFit().getStrongPixelCount());
        assertTrue(storm.getFit().isDrawable());
        assertEquals(ShapeType.MULTI_CELL, storm.getCell().getShapeType());
    }

    @Test
    public void testEmptyInputYieldsNoStorms() {
        assertTrue(createAssembler(new StormAnalysisProperties()).assembleCells(Collections.emptyList()).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullPixelRejected() {
        createAssembler(new StormAnalysisProperties()).assembleCells(Arrays.asList((Pixel) null));
    }
}
