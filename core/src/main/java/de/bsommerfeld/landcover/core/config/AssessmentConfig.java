package de.bsommerfeld.landcover.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AssessmentConfig {

    // sample points drawn per reference class
    @JsonProperty("num-points")
    private int numPoints = 2000;

    @JsonProperty("scale")
    private double scale = 10.0;

    @JsonProperty("seed")
    private long seed = 42;

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 120;

    public int getNumPoints() {
        return numPoints;
    }

    public void setNumPoints(int numPoints) {
        this.numPoints = numPoints;
    }

    public double getScale() {
        return scale;
    }

    public void setScale(double scale) {
        this.scale = scale;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @JsonIgnore
    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
