package de.bsommerfeld.landcover.core.domain;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.landcover.core.error.BandMismatchException;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Temporally ordered, immutable sequence of rasters sharing one band schema and
 * grid. Rasters are sorted by {@code timeStart} on construction (stable, so
 * equal timestamps keep their input order; untimed rasters sort first).
 */
public final class RasterSeries implements Iterable<Raster> {

    private static final RasterSeries EMPTY = new RasterSeries(ImmutableList.of());

    private static final Comparator<Raster> BY_TIME = Comparator.comparing(
            (Raster r) -> r.metadata().timeStart(), Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private final ImmutableList<Raster> rasters;

    private RasterSeries(ImmutableList<Raster> rasters) {
        this.rasters = rasters;
    }

    public static RasterSeries empty() {
        return EMPTY;
    }

    public static RasterSeries of(Raster... rasters) {
        return of(Arrays.asList(rasters));
    }

    /**
     * @throws BandMismatchException if the rasters do not share band names and
     *                               grid dimensions
     */
    public static RasterSeries of(Collection<Raster> rasters) {
        if (rasters.isEmpty()) {
            return EMPTY;
        }
        checkSchema(rasters);
        return new RasterSeries(ImmutableList.sortedCopyOf(BY_TIME, rasters));
    }

    /**
     * Keeps the given order instead of sorting by time. Used for per-interval
     * outputs, whose position must follow the interval list.
     *
     * @throws BandMismatchException if the rasters do not share band names and
     *                               grid dimensions
     */
    public static RasterSeries inOrder(Collection<Raster> rasters) {
        if (rasters.isEmpty()) {
            return EMPTY;
        }
        checkSchema(rasters);
        return new RasterSeries(ImmutableList.copyOf(rasters));
    }

    private static void checkSchema(Collection<Raster> rasters) {
        Raster first = rasters.iterator().next();
        for (Raster raster : rasters) {
            if (!first.hasSameSchema(raster)) {
                throw new BandMismatchException("Raster schema " + raster.bandNames() + " " + raster.width() + "x"
                        + raster.height() + " differs from series schema " + first.bandNames() + " "
                        + first.width() + "x" + first.height());
            }
        }
    }

    public int size() {
        return rasters.size();
    }

    public boolean isEmpty() {
        return rasters.isEmpty();
    }

    public Raster get(int index) {
        return rasters.get(index);
    }

    public ImmutableList<Raster> rasters() {
        return rasters;
    }

    public Stream<Raster> stream() {
        return rasters.stream();
    }

    /** Band names of the shared schema; empty for an empty series. */
    public List<String> bandNames() {
        return rasters.isEmpty() ? ImmutableList.of() : rasters.get(0).bandNames();
    }

    /**
     * Rasters acquired within {@code interval}, compared by UTC calendar day.
     * Untimed rasters never match.
     */
    public RasterSeries filterDate(Interval interval) {
        return new RasterSeries(rasters.stream()
                .filter(r -> r.acquisitionDate().map(interval::contains).orElse(false))
                .collect(ImmutableList.toImmutableList()));
    }

    public RasterSeries select(List<String> bandNames) {
        return map(r -> r.select(bandNames));
    }

    public RasterSeries removeBands(Collection<String> bandNames) {
        return map(r -> r.removeBands(bandNames));
    }

    /** Applies {@code fn} to every raster, keeping the order, and re-validates the schema. */
    public RasterSeries map(UnaryOperator<Raster> fn) {
        return inOrder(rasters.stream().map(fn).collect(ImmutableList.toImmutableList()));
    }

    @Override
    public Iterator<Raster> iterator() {
        return rasters.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RasterSeries other && rasters.equals(other.rasters));
    }

    @Override
    public int hashCode() {
        return rasters.hashCode();
    }

    @Override
    public String toString() {
        return "RasterSeries[" + rasters.size() + " rasters, bands=" + bandNames() + "]";
    }
}
