package de.bsommerfeld.landcover.aggregation;

import de.bsommerfeld.landcover.core.domain.Band;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.MetadataMode;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.RasterSeries;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Band and metadata housekeeping on rasters and series.
 */
public final class SeriesOperations {

    public static final String TIME_DELTA = "time_delta";

    private static final Set<ChronoUnit> DELTA_UNITS =
            EnumSet.of(ChronoUnit.DAYS, ChronoUnit.WEEKS, ChronoUnit.MONTHS, ChronoUnit.YEARS);

    private SeriesOperations() {
    }

    /** Tags {@code raster} with the interval's start and end (UTC midnight). */
    public static Raster addMetadata(Raster raster, Interval interval) {
        return addMetadata(raster, interval, MetadataMode.AGGREGATION_PERIOD);
    }

    public static Raster addMetadata(Raster raster, Interval interval, MetadataMode mode) {
        return switch (mode) {
            case AGGREGATION_PERIOD -> raster.withMetadata(
                    raster.metadata().withTimes(interval.startInstant(), interval.endInstant()));
            case MIDPOINT -> raster.withMetadata(raster.metadata().withTimes(interval.midpoint(), null));
        };
    }

    /** Drops bands from every raster; unknown names are ignored. */
    public static RasterSeries removeBands(RasterSeries series, String... names) {
        return removeBands(series, Arrays.asList(names));
    }

    public static RasterSeries removeBands(RasterSeries series, List<String> names) {
        return series.removeBands(names);
    }

    /**
     * Adds a constant {@value #TIME_DELTA} band and property to every raster:
     * the {@code unit}s elapsed from {@code baseline} to the raster's
     * acquisition day, negative before the baseline. A partial unit counts as
     * the fraction of that calendar unit's days, so 15 February 2021 is 1.5
     * months after 1 January 2021.
     *
     * @throws IllegalArgumentException if {@code unit} is not one of days,
     *                                  weeks, months or years, or a raster
     *                                  carries no timestamp
     */
    public static RasterSeries addTimeDeltaBand(RasterSeries series, LocalDate baseline, ChronoUnit unit) {
        if (!DELTA_UNITS.contains(unit)) {
            throw new IllegalArgumentException("Unsupported time delta unit " + unit + ", expected one of " + DELTA_UNITS);
        }
        return series.map(raster -> {
            LocalDate day = raster.acquisitionDate().orElseThrow(
                    () -> new IllegalArgumentException("Raster has no acquisition time: " + raster));
            double delta = elapsed(baseline, day, unit);
            double[] constant = new double[raster.pixelCount()];
            Arrays.fill(constant, delta);
            return raster.withBand(Band.of(TIME_DELTA, constant))
                    .withMetadata(raster.metadata().withProperty(TIME_DELTA, delta));
        });
    }

    static double elapsed(LocalDate baseline, LocalDate day, ChronoUnit unit) {
        long whole = unit.between(baseline, day);
        LocalDate anchor = baseline.plus(whole, unit);
        long remainder = ChronoUnit.DAYS.between(anchor, day);
        if (remainder == 0) {
            return whole;
        }
        LocalDate next = anchor.plus(remainder > 0 ? 1 : -1, unit);
        long unitLength = Math.abs(ChronoUnit.DAYS.between(anchor, next));
        return whole + (double) remainder / unitLength;
    }
}
