package de.bsommerfeld.landcover.backend;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.core.config.BackendConfig;
import de.bsommerfeld.landcover.core.domain.Band;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.RasterSeries;
import de.bsommerfeld.landcover.core.domain.ReducerKind;
import de.bsommerfeld.landcover.core.domain.Region;
import de.bsommerfeld.landcover.core.domain.SamplePoint;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-process {@link RasterBackend} over rasters held in memory. Evaluates
 * everything eagerly on the calling thread; suited to tests and to series
 * small enough to fit the heap.
 *
 * <p>
 * Rasters are added with {@link #ingest}. All rasters share one pixel grid
 * anchored at the origin, so spatial queries reduce to rectangle overlap.
 */
@Singleton
public class InMemoryRasterBackend implements RasterBackend {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRasterBackend.class);

    private final List<Raster> catalog = new CopyOnWriteArrayList<>();
    private final double nativeScale;

    @Inject
    public InMemoryRasterBackend(BackendConfig config) {
        this(config.getNativeScale());
    }

    public InMemoryRasterBackend(double nativeScale) {
        if (nativeScale <= 0) {
            throw new IllegalArgumentException("Native scale must be positive: " + nativeScale);
        }
        this.nativeScale = nativeScale;
    }

    public void ingest(Raster... rasters) {
        ingest(Arrays.asList(rasters));
    }

    public void ingest(Collection<Raster> rasters) {
        catalog.addAll(rasters);
        LOG.debug("Ingested {} rasters, catalog size {}", rasters.size(), catalog.size());
    }

    public int catalogSize() {
        return catalog.size();
    }

    @Override
    public RasterSeries query(Region region, Interval range) {
        List<Raster> matches = new ArrayList<>();
        for (Raster raster : catalog) {
            boolean inTime = raster.acquisitionDate().map(range::contains).orElse(false);
            if (inTime && region.intersects(raster.width(), raster.height())) {
                matches.add(raster);
            }
        }
        LOG.debug("Query {} within {} matched {} of {} rasters", region, range, matches.size(), catalog.size());
        return RasterSeries.of(matches);
    }

    @Override
    public Raster reduce(RasterSeries series, ReducerKind kind) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot reduce an empty series");
        }
        Raster first = series.get(0);
        int pixels = first.pixelCount();
        Raster.Builder out = Raster.builder(first.width(), first.height());

        for (String bandName : first.bandNames()) {
            double[] reduced = new double[pixels];
            boolean[] valid = new boolean[pixels];
            double[] observations = new double[series.size()];

            for (int i = 0; i < pixels; i++) {
                int n = 0;
                for (Raster raster : series) {
                    Band band = raster.band(bandName);
                    if (band.isValid(i)) {
                        observations[n++] = band.value(i);
                    }
                }
                if (n > 0) {
                    reduced[i] = kind.apply(Arrays.copyOf(observations, n));
                    valid[i] = true;
                }
            }
            out.band(bandName + "_" + kind.label(), reduced, valid);
        }
        return out.build();
    }

    @Override
    public List<SamplePoint> stratifiedSample(Raster raster, String classBand, Region region,
            int numPoints, double scale, long seed) {
        if (numPoints <= 0) {
            throw new IllegalArgumentException("numPoints must be positive: " + numPoints);
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be positive: " + scale);
        }
        Band classes = raster.band(classBand);
        int stride = Math.max(1, (int) Math.round(scale / nativeScale));

        // ascending class order fixes the draw sequence for a given seed
        Map<Integer, List<Integer>> strata = new TreeMap<>();
        int yEnd = Math.min(region.maxY(), raster.height());
        int xEnd = Math.min(region.maxX(), raster.width());
        for (int y = Math.max(0, region.minY()); y < yEnd; y += stride) {
            for (int x = Math.max(0, region.minX()); x < xEnd; x += stride) {
                int index = raster.index(x, y);
                if (isValidEverywhere(raster, index)) {
                    strata.computeIfAbsent((int) classes.value(index), k -> new ArrayList<>()).add(index);
                }
            }
        }

        Random random = new Random(seed);
        ImmutableList.Builder<SamplePoint> samples = ImmutableList.builder();
        for (List<Integer> candidates : strata.values()) {
            Collections.shuffle(candidates, random);
            for (int index : candidates.subList(0, Math.min(numPoints, candidates.size()))) {
                samples.add(toSample(raster, index));
            }
        }
        ImmutableList<SamplePoint> result = samples.build();
        LOG.debug("Sampled {} points from {} strata (stride {})", result.size(), strata.size(), stride);
        return result;
    }

    @Override
    public List<String> bandNames(Raster raster) {
        return raster.bandNames();
    }

    @Override
    public boolean[] validityMask(Raster raster, String band) {
        return raster.band(band).mask();
    }

    private static boolean isValidEverywhere(Raster raster, int index) {
        for (Band band : raster.bands()) {
            if (!band.isValid(index)) {
                return false;
            }
        }
        return true;
    }

    private static SamplePoint toSample(Raster raster, int index) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Band band : raster.bands()) {
            values.put(band.name(), band.value(index));
        }
        return new SamplePoint(index % raster.width(), index / raster.width(), values);
    }
}
