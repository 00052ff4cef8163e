package de.bsommerfeld.landcover.aggregation;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.landcover.core.domain.RasterSeries;

import java.util.List;

/**
 * Output of {@link TemporalReducer}: the reduced series plus one outcome per
 * requested interval, in request order. A series shorter than the interval
 * list is a normal result; {@link #skipped()} explains the gaps.
 *
 * @param series   one raster per non-empty interval
 * @param outcomes success or failure for every interval
 */
public record IntervalReduction(RasterSeries series, List<IntervalOutcome> outcomes) {

    public IntervalReduction {
        outcomes = ImmutableList.copyOf(outcomes);
    }

    public List<IntervalOutcome> skipped() {
        return outcomes.stream().filter(o -> !o.isSuccess()).collect(ImmutableList.toImmutableList());
    }

    public int skippedCount() {
        return (int) outcomes.stream().filter(o -> !o.isSuccess()).count();
    }
}
