package de.bsommerfeld.landcover.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.PeriodFrequency;
import de.bsommerfeld.landcover.core.error.InvalidRangeException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Splits a date range into consecutive calendar periods.
 *
 * <p>
 * The first interval starts on the first day of the period containing
 * {@code start}; every interval ends on the last day of its period, except the
 * final one, which is truncated to {@code end}. The result is chronological,
 * gap-free and non-overlapping, and covers {@code [start, end]}.
 */
@Singleton
public class IntervalGenerator {

    /**
     * @throws InvalidRangeException if {@code start} is after {@code end} or any
     *                               argument is missing
     */
    public List<Interval> generate(LocalDate start, LocalDate end, PeriodFrequency freq) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Range bounds must not be null");
        }
        if (freq == null) {
            throw new InvalidRangeException("Period frequency must not be null");
        }
        if (start.isAfter(end)) {
            throw new InvalidRangeException("Range start " + start + " is after end " + end);
        }

        ImmutableList.Builder<Interval> intervals = ImmutableList.builder();
        LocalDate cursor = freq.periodStart(start);
        while (!cursor.isAfter(end)) {
            LocalDate periodEnd = freq.periodEnd(cursor);
            intervals.add(new Interval(cursor, periodEnd.isAfter(end) ? end : periodEnd));
            cursor = periodEnd.plusDays(1);
        }
        return intervals.build();
    }

    /** Time-of-day is discarded. */
    public List<Interval> generate(LocalDateTime start, LocalDateTime end, PeriodFrequency freq) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Range bounds must not be null");
        }
        return generate(start.toLocalDate(), end.toLocalDate(), freq);
    }

    /**
     * Parses ISO dates ({@code 2021-03-01}) or date-times
     * ({@code 2021-03-01T12:30}) and a frequency code such as {@code M}.
     *
     * @throws InvalidRangeException on unparsable input or an unknown frequency
     */
    public List<Interval> generate(String start, String end, String freq) {
        return generate(parseDay(start), parseDay(end), PeriodFrequency.fromCode(freq));
    }

    private static LocalDate parseDay(String text) {
        if (text == null) {
            throw new InvalidRangeException("Range bounds must not be null");
        }
        String trimmed = text.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException notADate) {
            try {
                return LocalDateTime.parse(trimmed).toLocalDate();
            } catch (DateTimeParseException e) {
                throw new InvalidRangeException("Unparsable date: '" + text + "'", e);
            }
        }
    }
}
