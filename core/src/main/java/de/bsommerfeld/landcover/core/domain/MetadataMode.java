package de.bsommerfeld.landcover.core.domain;

/**
 * How a reduced raster records the interval it was aggregated over.
 */
public enum MetadataMode {

    /** {@code timeStart} = interval start, {@code timeEnd} = interval end. */
    AGGREGATION_PERIOD,

    /** {@code timeStart} = temporal midpoint of the interval, no end. */
    MIDPOINT
}
