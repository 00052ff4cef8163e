package de.bsommerfeld.landcover.core.domain;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * One location drawn by stratified sampling, with the band values read there.
 */
public record SamplePoint(int x, int y, Map<String, Double> values) {

    public SamplePoint {
        values = ImmutableMap.copyOf(values);
    }

    /**
     * @throws IllegalArgumentException if the point carries no such band
     */
    public double value(String band) {
        Double value = values.get(band);
        if (value == null) {
            throw new IllegalArgumentException("Sample at (" + x + "," + y + ") has no value for '" + band + "'");
        }
        return value;
    }
}
