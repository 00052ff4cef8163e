package de.bsommerfeld.landcover.core.error;

import de.bsommerfeld.landcover.core.domain.Interval;

/**
 * Signals that no raster of a series falls within an interval. Temporal
 * reduction catches this and skips the interval; it never reaches callers.
 */
public class EmptyIntervalException extends LandCoverException {

    private final Interval interval;

    public EmptyIntervalException(Interval interval) {
        super("No rasters acquired within " + interval);
        this.interval = interval;
    }

    public Interval getInterval() {
        return interval;
    }
}
