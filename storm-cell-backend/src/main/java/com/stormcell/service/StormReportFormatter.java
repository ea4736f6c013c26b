package com.stormcell.service;

import com.stormcell.model.AnalyzedStorm;
import com.stormcell.model.StormAnalysisResult;
import com.stormcell.model.StormCell;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Fixed-width text table of the storms of one run.
 */
@Component
public class StormReportFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String ROW_FORMAT = "%-8s %-15s %-10s %-20s %-10s%n";

    public String format(StormAnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Observe Station: ").append(result.getStationName()).append(System.lineSeparator());
        sb.append("Process Time: ")
                .append(result.getProcessedAt() != null ? TIME_FORMAT.format(result.getProcessedAt()) : "-")
                .append(System.lineSeparator());
        sb.append("Storm number in active: ").append(result.getStormCount()).append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, ROW_FORMAT,
                "ID", "Distance (km)", "Compass", "Max Intensity (dBZ)", "Type"));

        if (result.getStorms() != null) {
            for (AnalyzedStorm storm : result.getStorms()) {
                StormCell cell = storm.getCell();
                sb.append(String.format(Locale.ROOT, ROW_FORMAT,
                        cell.getId(),
                        String.format(Locale.ROOT, "%.2f", cell.getDistance()),
                        cell.getCompass(),
                        cell.getMaxIntensity(),
                        cell.getShapeType().getLabel()));
            }
        }
        return sb.toString();
    }
}
