package de.bsommerfeld.landcover.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.domain.Band;
import de.bsommerfeld.landcover.core.domain.ConfidenceImage;
import de.bsommerfeld.landcover.core.domain.LabelConfidence;
import de.bsommerfeld.landcover.core.domain.LabelImage;
import de.bsommerfeld.landcover.core.domain.Legend;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.RasterSeries;
import de.bsommerfeld.landcover.core.domain.ReducerKind;
import de.bsommerfeld.landcover.core.graph.Deferred;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Arg-max of per-class median probabilities.
 *
 * <p>
 * Each probability band (one per class, in legend order) is reduced to its
 * per-pixel median over the series. The label is the position of the largest
 * median, ties going to the lowest position; the confidence is that median as
 * a percentage, rounded and clamped to {@code [0, 100]}. Probabilities are
 * expected in {@code [0, 1]}.
 *
 * <p>
 * A band whose median is undefined at a pixel (never observed) does not take
 * part in that pixel's arg-max. A pixel undefined for every band is masked.
 *
 * <p>
 * This aggregates continuous scores before deciding, while
 * {@link ModeLabelAggregator} votes on decisions; the two may disagree.
 */
@Singleton
public class ProbabilityArgmaxAggregator {

    private final RasterBackend backend;
    private final Legend legend;

    @Inject
    public ProbabilityArgmaxAggregator(RasterBackend backend, Legend legend) {
        this.backend = backend;
        this.legend = legend;
    }

    /** Uses the legend's probability bands as the class order. */
    public Deferred<LabelConfidence> maxMedianLabel(RasterSeries series) {
        return maxMedianLabel(series, legend.probabilityBands());
    }

    public Deferred<LabelConfidence> maxMedianLabel(RasterSeries series, List<String> probabilityBands) {
        return maxMedianLabel(Deferred.completed("series", series), probabilityBands);
    }

    public Deferred<LabelConfidence> maxMedianLabel(Deferred<RasterSeries> series) {
        return maxMedianLabel(series, legend.probabilityBands());
    }

    public Deferred<LabelConfidence> maxMedianLabel(Deferred<RasterSeries> series, List<String> probabilityBands) {
        if (probabilityBands.isEmpty()) {
            throw new IllegalArgumentException("At least one probability band is required");
        }
        List<String> bands = ImmutableList.copyOf(probabilityBands);
        return series
                .map("median(" + bands.size() + " bands)", s -> medianComposite(s, bands))
                .map("argmax", ProbabilityArgmaxAggregator::argmax);
    }

    private Raster medianComposite(RasterSeries series, List<String> bands) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute medians over an empty series");
        }
        return backend.reduce(series.select(bands), ReducerKind.MEDIAN);
    }

    /** Bands of {@code medians} are read positionally as class 0, 1, ... */
    static LabelConfidence argmax(Raster medians) {
        List<Band> classes = medians.bands();
        int pixels = medians.pixelCount();
        int[] labels = new int[pixels];
        int[] confidence = new int[pixels];
        boolean[] valid = new boolean[pixels];

        for (int i = 0; i < pixels; i++) {
            int best = -1;
            double bestValue = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < classes.size(); k++) {
                Band band = classes.get(k);
                // strict comparison keeps the lowest index on ties
                if (band.isValid(i) && band.value(i) > bestValue) {
                    best = k;
                    bestValue = band.value(i);
                }
            }
            if (best >= 0) {
                labels[i] = best;
                confidence[i] = Ints.constrainToRange(Ints.saturatedCast(Math.round(100.0 * bestValue)), 0, 100);
                valid[i] = true;
            }
        }
        return new LabelConfidence(
                LabelImage.of(medians.width(), medians.height(), labels, valid),
                ConfidenceImage.of(medians.width(), medians.height(), confidence, valid));
    }
}
