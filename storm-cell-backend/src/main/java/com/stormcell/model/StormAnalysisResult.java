package com.stormcell.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of one analysis run: the ranked storms plus station and timing
 * metadata for reporting.
 */
public class StormAnalysisResult {

    private String stationName;
    private LocalDateTime processedAt;

    /**
     * Storms ordered by ascending distance; ids run 1..N in this order.
     */
    private List<AnalyzedStorm> storms;

    public StormAnalysisResult() {
        // Default constructor
    }

    public String getStationName() {
        return stationName;
    }

    public void setStationName(String stationName) {
        this.stationName = stationName;
    }

    public LocalDateTime getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(LocalDateTime processedAt) {
        this.processedAt = processedAt;
    }

    public List<AnalyzedStorm> getStorms() {
        return storms;
    }

    public void setStorms(List<AnalyzedStorm> storms) {
        this.storms = storms;
    }

    public int getStormCount() {
        return storms == null ? 0 : storms.size();
    }

    @Override
    public String toString() {
        return "StormAnalysisResult{" +
                "stationName='" + stationName + '\'' +
                ", processedAt=" + processedAt +
                ", stormCount=" + getStormCount() +
                '}';
    }
}
