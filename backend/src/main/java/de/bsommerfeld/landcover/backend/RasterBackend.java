package de.bsommerfeld.landcover.backend;

import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.RasterSeries;
import de.bsommerfeld.landcover.core.domain.ReducerKind;
import de.bsommerfeld.landcover.core.domain.Region;
import de.bsommerfeld.landcover.core.domain.SamplePoint;

import java.util.List;

/**
 * Contract of the raster storage and compute engine. Aggregation and
 * assessment never touch storage directly; they describe work and hand the
 * heavy per-pixel reductions and sampling to an implementation of this
 * interface.
 *
 * <p>
 * Implementations must be thread-safe. Failures should surface as
 * {@link de.bsommerfeld.landcover.core.error.BackendUnavailableException};
 * callers do not retry.
 */
public interface RasterBackend {

    /**
     * Returns the rasters intersecting {@code region} whose acquisition day lies
     * within {@code range}, in temporal order.
     */
    RasterSeries query(Region region, Interval range);

    /**
     * Reduces a non-empty series to one raster, band by band and pixel by pixel,
     * using only valid observations. A pixel without valid observations stays
     * masked. Output bands are named {@code <band>_<reducer>}, e.g.
     * {@code label_mode}.
     *
     * @throws IllegalArgumentException if {@code series} is empty
     */
    Raster reduce(RasterSeries series, ReducerKind kind);

    /**
     * Draws up to {@code numPoints} random pixels per distinct value of
     * {@code classBand} inside {@code region}. Pixels masked in any band are
     * never drawn. The same seed yields the same sample.
     *
     * @param scale ground distance between candidate pixels, in the units of
     *              the backend's native pixel size
     */
    List<SamplePoint> stratifiedSample(Raster raster, String classBand, Region region,
            int numPoints, double scale, long seed);

    List<String> bandNames(Raster raster);

    /** Copy of the validity mask of {@code band}, row-major. */
    boolean[] validityMask(Raster raster, String band);
}
