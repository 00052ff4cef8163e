package de.bsommerfeld.landcover.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.landcover.core.domain.MetadataMode;
import de.bsommerfeld.landcover.core.domain.PeriodFrequency;
import de.bsommerfeld.landcover.core.domain.ReducerKind;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregationConfig {

    // mean | median | mode | max | min
    @JsonProperty("reducer")
    private String reducer = "median";

    // D | W | M | Q | Y
    @JsonProperty("frequency")
    private String frequency = "M";

    @JsonProperty("metadata-mode")
    private MetadataMode metadataMode = MetadataMode.AGGREGATION_PERIOD;

    @JsonProperty("label-band")
    private String labelBand = "label";

    public String getReducer() {
        return reducer;
    }

    public void setReducer(String reducer) {
        this.reducer = reducer;
    }

    /** @throws de.bsommerfeld.landcover.core.error.UnknownReducerException for bad names */
    @JsonIgnore
    public ReducerKind getReducerKind() {
        return ReducerKind.fromName(reducer);
    }

    public String getFrequency() {
        return frequency;
    }

    public void setFrequency(String frequency) {
        this.frequency = frequency;
    }

    @JsonIgnore
    public PeriodFrequency getPeriodFrequency() {
        return PeriodFrequency.fromCode(frequency);
    }

    public MetadataMode getMetadataMode() {
        return metadataMode;
    }

    public void setMetadataMode(MetadataMode metadataMode) {
        this.metadataMode = metadataMode;
    }

    public String getLabelBand() {
        return labelBand;
    }

    public void setLabelBand(String labelBand) {
        this.labelBand = labelBand;
    }
}
