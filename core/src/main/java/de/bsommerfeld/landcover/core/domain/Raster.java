package de.bsommerfeld.landcover.core.domain;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.bsommerfeld.landcover.core.error.BandMismatchException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable multi-band grid with per-band validity masks and temporal metadata.
 * Pixels are addressed row-major: {@code index = y * width + x}.
 *
 * <p>
 * Every transformation returns a new instance; band arrays are never shared
 * mutably between rasters.
 */
public final class Raster {

    private final int width;
    private final int height;
    private final ImmutableMap<String, Band> bands;
    private final RasterMetadata metadata;

    private Raster(int width, int height, ImmutableMap<String, Band> bands, RasterMetadata metadata) {
        this.width = width;
        this.height = height;
        this.bands = bands;
        this.metadata = metadata;
    }

    public static Builder builder(int width, int height) {
        return new Builder(width, height);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public int index(int x, int y) {
        return y * width + x;
    }

    public ImmutableList<String> bandNames() {
        return bands.keySet().asList();
    }

    public ImmutableList<Band> bands() {
        return bands.values().asList();
    }

    public boolean hasBand(String name) {
        return bands.containsKey(name);
    }

    /**
     * @throws BandMismatchException if the raster has no such band
     */
    public Band band(String name) {
        Band band = bands.get(name);
        if (band == null) {
            throw new BandMismatchException("Raster has no band '" + name + "', available: " + bandNames());
        }
        return band;
    }

    public RasterMetadata metadata() {
        return metadata;
    }

    public Optional<LocalDate> acquisitionDate() {
        return metadata.acquisitionDate();
    }

    /** Same grid dimensions and the same band names in the same order. */
    public boolean hasSameSchema(Raster other) {
        return width == other.width && height == other.height && bandNames().equals(other.bandNames());
    }

    public Raster withMetadata(RasterMetadata newMetadata) {
        return new Raster(width, height, bands, Objects.requireNonNull(newMetadata, "metadata"));
    }

    /** Adds a band, or replaces the band of the same name in place. */
    public Raster withBand(Band band) {
        checkSize(band, width * height);
        Map<String, Band> copy = new LinkedHashMap<>(bands);
        copy.put(band.name(), band);
        return new Raster(width, height, ImmutableMap.copyOf(copy), metadata);
    }

    /** Keeps only the named bands, in the order given. */
    public Raster select(List<String> names) {
        ImmutableMap.Builder<String, Band> selected = ImmutableMap.builder();
        for (String name : names) {
            selected.put(name, band(name));
        }
        return new Raster(width, height, selected.build(), metadata);
    }

    /** Drops the named bands; names the raster does not carry are ignored. */
    public Raster removeBands(Collection<String> names) {
        ImmutableMap.Builder<String, Band> kept = ImmutableMap.builder();
        bands.forEach((name, band) -> {
            if (!names.contains(name)) {
                kept.put(name, band);
            }
        });
        return new Raster(width, height, kept.build(), metadata);
    }

    /**
     * Renames bands positionally.
     *
     * @throws BandMismatchException if {@code newNames} does not have exactly one
     *                               entry per band, or repeats a name
     */
    public Raster renameBands(List<String> newNames) {
        if (newNames.size() != bands.size()) {
            throw new BandMismatchException("Cannot rename " + bands.size() + " bands " + bandNames()
                    + " to " + newNames.size() + " names " + newNames);
        }
        if (ImmutableSet.copyOf(newNames).size() != newNames.size()) {
            throw new BandMismatchException("Duplicate band names in rename list " + newNames);
        }
        ImmutableMap.Builder<String, Band> renamed = ImmutableMap.builder();
        int i = 0;
        for (Band band : bands.values()) {
            String name = newNames.get(i++);
            renamed.put(name, band.renamed(name));
        }
        return new Raster(width, height, renamed.buildOrThrow(), metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Raster other)) {
            return false;
        }
        return width == other.width && height == other.height
                && bands.equals(other.bands) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, bands, metadata);
    }

    @Override
    public String toString() {
        return "Raster[" + width + "x" + height + ", bands=" + bandNames() + ", time=" + metadata.timeStart() + "]";
    }

    private static void checkSize(Band band, int expected) {
        if (band.size() != expected) {
            throw new IllegalArgumentException("Band '" + band.name() + "' has " + band.size()
                    + " cells, grid needs " + expected);
        }
    }

    public static final class Builder {

        private final int width;
        private final int height;
        private final Map<String, Band> bands = new LinkedHashMap<>();
        private RasterMetadata metadata = RasterMetadata.EMPTY;

        private Builder(int width, int height) {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
            }
            this.width = width;
            this.height = height;
        }

        public Builder acquiredAt(Instant time) {
            metadata = metadata.withTimes(time, null);
            return this;
        }

        public Builder acquiredOn(LocalDate day) {
            return acquiredAt(day.atStartOfDay(ZoneOffset.UTC).toInstant());
        }

        public Builder period(Instant start, Instant end) {
            metadata = metadata.withTimes(start, end);
            return this;
        }

        public Builder property(String key, Object value) {
            metadata = metadata.withProperty(key, value);
            return this;
        }

        public Builder metadata(RasterMetadata metadata) {
            this.metadata = Objects.requireNonNull(metadata, "metadata");
            return this;
        }

        public Builder band(String name, double... values) {
            return band(Band.of(name, values));
        }

        public Builder band(String name, double[] values, boolean[] valid) {
            return band(Band.of(name, values, valid));
        }

        public Builder band(Band band) {
            checkSize(band, width * height);
            if (bands.putIfAbsent(band.name(), band) != null) {
                throw new IllegalArgumentException("Duplicate band '" + band.name() + "'");
            }
            return this;
        }

        public Raster build() {
            return new Raster(width, height, ImmutableMap.copyOf(bands), metadata);
        }
    }
}
