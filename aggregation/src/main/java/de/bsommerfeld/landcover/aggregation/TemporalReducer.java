package de.bsommerfeld.landcover.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.MetadataMode;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.RasterSeries;
import de.bsommerfeld.landcover.core.domain.ReducerKind;
import de.bsommerfeld.landcover.core.error.BandMismatchException;
import de.bsommerfeld.landcover.core.error.EmptyIntervalException;
import de.bsommerfeld.landcover.core.graph.Deferred;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a raster series to one aggregate raster per time interval.
 *
 * <p>
 * For each interval the rasters acquired within it are handed to the backend
 * with the chosen statistic. Intervals without rasters are skipped: the
 * failure is logged and recorded as an {@link IntervalOutcome}, and the
 * remaining intervals are still processed. Every other error propagates.
 *
 * <p>
 * All methods only build a {@link Deferred} node; the backend is first called
 * when that node is resolved.
 */
@Singleton
public class TemporalReducer {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalReducer.class);

    private final RasterBackend backend;

    @Inject
    public TemporalReducer(RasterBackend backend) {
        this.backend = backend;
    }

    /** Median per interval, tagged with the aggregation period, bands not renamed. */
    public Deferred<IntervalReduction> reduce(RasterSeries series, List<Interval> intervals) {
        return reduce(series, intervals, ReducerKind.MEDIAN, null, MetadataMode.AGGREGATION_PERIOD);
    }

    public Deferred<IntervalReduction> reduce(RasterSeries series, List<Interval> intervals, ReducerKind method,
            List<String> renameTo, MetadataMode metadataMode) {
        return reduce(Deferred.completed("series", series), intervals, method, renameTo, metadataMode);
    }

    /**
     * @param methodName one of mean, median, mode, max, min
     * @throws de.bsommerfeld.landcover.core.error.UnknownReducerException
     *         immediately, for any other name
     */
    public Deferred<IntervalReduction> reduce(Deferred<RasterSeries> series, List<Interval> intervals,
            String methodName, List<String> renameTo, MetadataMode metadataMode) {
        return reduce(series, intervals, ReducerKind.fromName(methodName), renameTo, metadataMode);
    }

    /**
     * @param renameTo     new output band names, or {@code null} to keep the
     *                     backend's {@code <band>_<reducer>} names; a count that
     *                     differs from the band count fails resolution with
     *                     {@link BandMismatchException}
     * @param metadataMode how each output records its interval
     */
    public Deferred<IntervalReduction> reduce(Deferred<RasterSeries> series, List<Interval> intervals,
            ReducerKind method, List<String> renameTo, MetadataMode metadataMode) {
        List<Interval> plan = ImmutableList.copyOf(intervals);
        List<String> names = renameTo == null ? null : ImmutableList.copyOf(renameTo);
        String step = "reduce(" + method.label() + ", " + plan.size() + " intervals)";
        return series.map(step, source -> reduceAll(source, plan, method, names, metadataMode));
    }

    private IntervalReduction reduceAll(RasterSeries source, List<Interval> intervals, ReducerKind method,
            List<String> renameTo, MetadataMode metadataMode) {
        if (renameTo != null && !source.isEmpty()) {
            List<String> bands = backend.bandNames(source.get(0));
            if (bands.size() != renameTo.size()) {
                throw new BandMismatchException("Rename list " + renameTo + " has " + renameTo.size()
                        + " names but the series has " + bands.size() + " bands " + bands);
            }
        }

        List<IntervalOutcome> outcomes = new ArrayList<>(intervals.size());
        List<Raster> reduced = new ArrayList<>(intervals.size());
        for (Interval interval : intervals) {
            try {
                Raster raster = reduceInterval(source, interval, method, renameTo, metadataMode);
                reduced.add(raster);
                outcomes.add(IntervalOutcome.success(interval, raster));
            } catch (EmptyIntervalException e) {
                LOG.warn("Skipping interval {}: {}", interval, e.getMessage());
                outcomes.add(IntervalOutcome.failure(interval, e));
            }
        }

        LOG.info("Reduced {} of {} intervals with {}", reduced.size(), intervals.size(), method.label());
        return new IntervalReduction(RasterSeries.inOrder(reduced), outcomes);
    }

    private Raster reduceInterval(RasterSeries source, Interval interval, ReducerKind method,
            List<String> renameTo, MetadataMode metadataMode) {
        RasterSeries subset = source.filterDate(interval);
        if (subset.isEmpty()) {
            throw new EmptyIntervalException(interval);
        }
        Raster raster = backend.reduce(subset, method);
        if (renameTo != null) {
            raster = raster.renameBands(renameTo);
        }
        return SeriesOperations.addMetadata(raster, interval, metadataMode);
    }
}
