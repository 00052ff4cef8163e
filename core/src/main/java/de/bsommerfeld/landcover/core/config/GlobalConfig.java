package de.bsommerfeld.landcover.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.landcover.core.domain.Legend;
import de.bsommerfeld.landcover.core.domain.LegendEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the application configuration, persisted as {@code config.json}.
 * Every section is initialized with defaults so a missing or partial file is
 * always usable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("aggregation")
    private AggregationConfig aggregation = new AggregationConfig();

    @JsonProperty("assessment")
    private AssessmentConfig assessment = new AssessmentConfig();

    @JsonProperty("backend")
    private BackendConfig backend = new BackendConfig();

    // Empty means the Dynamic World legend
    @JsonProperty("legend")
    private List<LegendEntry> legend = new ArrayList<>();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public AggregationConfig getAggregation() {
        return aggregation;
    }

    public AssessmentConfig getAssessment() {
        return assessment;
    }

    public BackendConfig getBackend() {
        return backend;
    }

    @JsonIgnore
    public List<LegendEntry> getLegendEntries() {
        return legend;
    }

    @JsonIgnore
    public void setLegendEntries(List<LegendEntry> legend) {
        this.legend = legend == null ? new ArrayList<>() : new ArrayList<>(legend);
    }

    /** The configured legend, falling back to Dynamic World when none is set. */
    @JsonIgnore
    public Legend getLegend() {
        return legend.isEmpty() ? Legend.dynamicWorld() : new Legend(legend);
    }
}
