package com.stormcell.service.imaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stormcell.config.StormAnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Ordered color-to-tier lookup for the radar legend. Entries are tried in
 * order and the first match wins.
 */
@Component
public class ReflectivityPalette {

    private static final Logger LOG = LoggerFactory.getLogger(ReflectivityPalette.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int DEFAULT_TOLERANCE = 10;

    private final List<PaletteEntry> entries;

    @Autowired
    public ReflectivityPalette(StormAnalysisProperties properties, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(properties.getPalette().getLocation());
        try (InputStream in = resource.getInputStream()) {
            this.entries = parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read reflectivity palette from " + resource, e);
        }
        LOG.info("Loaded {} reflectivity tiers from {}", entries.size(), resource.getDescription());
    }

    public ReflectivityPalette(List<PaletteEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static ReflectivityPalette fromJson(InputStream in) throws IOException {
        return new ReflectivityPalette(parse(in));
    }

    public List<PaletteEntry> getEntries() {
        return entries;
    }

    /**
     * @return the tier of the first matching entry, empty if no entry matches
     */
    public OptionalInt intensityOf(int argb) {
        for (PaletteEntry entry : entries) {
            if (entry.matches(argb)) {
                return OptionalInt.of(entry.getIntensity());
            }
        }
        return OptionalInt.empty();
    }

    private static List<PaletteEntry> parse(InputStream in) throws IOException {
        JsonNode root = OBJECT_MAPPER.readTree(in);
        int defaultTolerance = root.path("tolerance").asInt(DEFAULT_TOLERANCE);
        List<PaletteEntry> parsed = new ArrayList<>();
        for (JsonNode node : root.path("tiers")) {
            JsonNode color = node.path("color");
            if (!color.isArray() || color.size() < 3) {
                throw new IOException("Palette tier needs an [r, g, b(, a)] color: " + node);
            }
            parsed.add(new PaletteEntry(
                    color.get(0).asInt(),
                    color.get(1).asInt(),
                    color.get(2).asInt(),
                    color.size() > 3 ? color.get(3).asInt() : 255,
                    node.path("tolerance").asInt(defaultTolerance),
                    node.path("intensity").asInt()));
        }
        return Collections.unmodifiableList(parsed);
    }
}
