package de.bsommerfeld.landcover.core.domain;

import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

/**
 * Temporal tags and free-form properties attached to a raster.
 *
 * @param timeStart  acquisition time, or start of the aggregation period;
 *                   {@code null} for rasters without a time axis
 * @param timeEnd    end of the aggregation period, {@code null} for single
 *                   acquisitions
 * @param properties additional named values (e.g. {@code time_delta})
 */
public record RasterMetadata(Instant timeStart, Instant timeEnd, Map<String, Object> properties) {

    public static final RasterMetadata EMPTY = new RasterMetadata(null, null, ImmutableMap.of());

    public RasterMetadata {
        properties = properties == null ? ImmutableMap.of() : ImmutableMap.copyOf(properties);
    }

    public static RasterMetadata at(Instant timeStart) {
        return new RasterMetadata(timeStart, null, ImmutableMap.of());
    }

    public static RasterMetadata period(Instant timeStart, Instant timeEnd) {
        return new RasterMetadata(timeStart, timeEnd, ImmutableMap.of());
    }

    /** UTC calendar day of {@link #timeStart()}, if present. */
    public Optional<LocalDate> acquisitionDate() {
        return Optional.ofNullable(timeStart).map(t -> LocalDate.ofInstant(t, ZoneOffset.UTC));
    }

    public RasterMetadata withTimes(Instant start, Instant end) {
        return new RasterMetadata(start, end, properties);
    }

    public RasterMetadata withProperty(String key, Object value) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        properties.forEach((k, v) -> {
            if (!k.equals(key)) {
                builder.put(k, v);
            }
        });
        builder.put(key, value);
        return new RasterMetadata(timeStart, timeEnd, builder.build());
    }
}
