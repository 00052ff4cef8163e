package de.bsommerfeld.landcover.assessment;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-normalized confusion matrix keyed by class name: entry
 * {@code (reference, predicted)} is the share of reference samples of that
 * class that were predicted as {@code predicted}. The diagonal is per-class
 * accuracy.
 *
 * <p>
 * A reference class without samples has an undefined row: every entry is NaN.
 * Check {@link #isRowDefined(String)} before rendering.
 */
public final class NormalizedConfusionMatrix {

    private final ImmutableList<String> labels;
    private final double[][] values;

    NormalizedConfusionMatrix(List<String> labels, double[][] values) {
        this.labels = ImmutableList.copyOf(labels);
        this.values = values;
    }

    public List<String> labels() {
        return labels;
    }

    public double value(String reference, String predicted) {
        return values[indexOf(reference)][indexOf(predicted)];
    }

    public boolean isRowDefined(String reference) {
        return !Double.isNaN(values[indexOf(reference)][0]);
    }

    /** Reference classes whose row is undefined, in legend order. */
    public List<String> undefinedRows() {
        return labels.stream().filter(l -> !isRowDefined(l)).collect(ImmutableList.toImmutableList());
    }

    public Map<String, Double> row(String reference) {
        double[] row = values[indexOf(reference)];
        Map<String, Double> result = new LinkedHashMap<>();
        for (int c = 0; c < labels.size(); c++) {
            result.put(labels.get(c), row[c]);
        }
        return Collections.unmodifiableMap(result);
    }

    /** reference label, then predicted label, to share. */
    public Map<String, Map<String, Double>> asMap() {
        Map<String, Map<String, Double>> result = new LinkedHashMap<>();
        for (String label : labels) {
            result.put(label, row(label));
        }
        return Collections.unmodifiableMap(result);
    }

    private int indexOf(String label) {
        int index = labels.indexOf(label);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown class label '" + label + "', known: " + labels);
        }
        return index;
    }

    @Override
    public String toString() {
        return "NormalizedConfusionMatrix" + asMap();
    }
}
