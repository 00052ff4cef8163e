package de.bsommerfeld.landcover.core.domain;

import de.bsommerfeld.landcover.core.error.InvalidRangeException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Closed window of calendar days used to group a raster series. Both bounds are
 * inclusive at day granularity; a single-day interval ({@code start == end})
 * selects exact-date matches.
 *
 * @param start first day of the window
 * @param end   last day of the window, never before {@code start}
 */
public record Interval(LocalDate start, LocalDate end) {

    public Interval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidRangeException("Interval start " + start + " is after end " + end);
        }
    }

    public static Interval of(LocalDate start, LocalDate end) {
        return new Interval(start, end);
    }

    public static Interval ofDay(LocalDate day) {
        return new Interval(day, day);
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }

    /** Whether {@code date} lies within {@code [start, end]}. */
    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /** Number of days between start and end; zero for a single-day interval. */
    public long daySpan() {
        return ChronoUnit.DAYS.between(start, end);
    }

    public Instant startInstant() {
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant endInstant() {
        return end.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Temporal midpoint: start plus half the day-span. Odd spans land on noon
     * UTC.
     */
    public Instant midpoint() {
        return startInstant().plus(Duration.ofDays(daySpan()).dividedBy(2));
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
