package com.stormcell.service.analysis;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.Pixel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups classified pixels into connected components. Two pixels are adjacent
 * when both coordinate deltas are within the adjacency threshold, which bridges
 * the small gaps color banding leaves in the source image.
 */
@Component
public class PixelClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(PixelClusterer.class);

    private final StormAnalysisProperties.Cluster settings;

    public PixelClusterer(StormAnalysisProperties properties) {
        this.settings = properties.getCluster();
    }

    /**
     * Returns the components that pass the size and intensity filter, in the
     * order their seed pixels appear in the input.
     */
    public List<List<Pixel>> cluster(Collection<Pixel> pixels) {
        List<List<Pixel>> accepted = new ArrayList<>();
        for (List<Pixel> component : partition(pixels)) {
            int maxIntensity = maxIntensity(component);
            if (accepts(component.size(), maxIntensity)) {
                accepted.add(component);
            } else {
                LOG.debug("Discarding component of {} pixels, max intensity {}", component.size(), maxIntensity);
            }
        }
        return accepted;
    }

    /**
     * Splits the input into maximal connected components. Every distinct input
     * pixel ends up in exactly one component.
     */
    public List<List<Pixel>> partition(Collection<Pixel> pixels) {
        if (pixels == null) {
            throw new IllegalArgumentException("Pixel collection must not be null");
        }
        List<Pixel> candidates = new ArrayList<>(pixels);
        if (candidates.contains(null)) {
            throw new IllegalArgumentException("Pixel collection must not contain null elements");
        }
        Set<Pixel> visited = new HashSet<>();
        List<List<Pixel>> components = new ArrayList<>();

        for (Pixel seed : candidates) {
            if (!visited.contains(seed)) {
                components.add(growComponent(seed, candidates, visited));
            }
        }
        return components;
    }

    boolean accepts(int size, int maxIntensity) {
        return size > settings.getMinSize() && maxIntensity >= settings.getMinIntensity();
    }

    static int maxIntensity(Collection<Pixel> pixels) {
        int max = 0;
        for (Pixel pixel : pixels) {
            max = Math.max(max, pixel.getIntensity());
        }
        return max;
    }

    private List<Pixel> growComponent(Pixel seed, List<Pixel> candidates, Set<Pixel> visited) {
        List<Pixel> component = new ArrayList<>();
        Deque<Pixel> stack = new ArrayDeque<>();
        visited.add(seed);
        component.add(seed);
        stack.push(seed);

        while (!stack.isEmpty()) {
            Pixel current = stack.pop();
            for (Pixel neighbor : candidates) {
                if (current.isAdjacentTo(neighbor, settings.getAdjacentThreshold()) && visited.add(neighbor)) {
                    component.add(neighbor);
                    stack.push(neighbor);
                }
            }
        }
        return component;
    }
}
