package de.bsommerfeld.landcover.aggregation;

import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.error.LandCoverException;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of reducing one interval: either the reduced raster or the failure
 * that caused the interval to be skipped.
 */
public final class IntervalOutcome {

    private final Interval interval;
    private final Raster raster;
    private final LandCoverException failure;

    private IntervalOutcome(Interval interval, Raster raster, LandCoverException failure) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.raster = raster;
        this.failure = failure;
    }

    public static IntervalOutcome success(Interval interval, Raster raster) {
        return new IntervalOutcome(interval, Objects.requireNonNull(raster, "raster"), null);
    }

    public static IntervalOutcome failure(Interval interval, LandCoverException failure) {
        return new IntervalOutcome(interval, null, Objects.requireNonNull(failure, "failure"));
    }

    public Interval interval() {
        return interval;
    }

    public boolean isSuccess() {
        return raster != null;
    }

    public Optional<Raster> raster() {
        return Optional.ofNullable(raster);
    }

    public Optional<LandCoverException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "IntervalOutcome[" + interval + " -> " + raster + "]"
                : "IntervalOutcome[" + interval + " skipped: " + failure.getMessage() + "]";
    }
}
