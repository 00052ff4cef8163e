package de.bsommerfeld.landcover.pipeline;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.landcover.aggregation.IntervalReduction;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.LabelConfidence;

import java.util.List;
import java.util.Map;

/**
 * Materialized outputs of one pipeline run. Both whole-series products are
 * kept side by side so they can be compared downstream.
 *
 * @param intervals          the calendar partition of the requested range
 * @param reduction          per-interval aggregates with skip diagnostics
 * @param modeLabel          temporal mode of the label band over the range
 * @param maxMedianLabel     arg-max of median class probabilities over the
 *                           range
 * @param intervalModeLabels mode label per non-empty interval, chronological
 */
public record LandCoverProducts(
        List<Interval> intervals,
        IntervalReduction reduction,
        LabelConfidence modeLabel,
        LabelConfidence maxMedianLabel,
        Map<Interval, LabelConfidence> intervalModeLabels) {

    public LandCoverProducts {
        intervals = ImmutableList.copyOf(intervals);
        intervalModeLabels = ImmutableMap.copyOf(intervalModeLabels);
    }
}
