package de.bsommerfeld.landcover.core.domain;

import de.bsommerfeld.landcover.core.error.InvalidRangeException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Calendar frequency at which a date range is partitioned. Each constant knows
 * where the period containing a given day begins and ends.
 */
public enum PeriodFrequency {

    DAILY("D") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day;
        }

        @Override
        public LocalDate periodEnd(LocalDate day) {
            return day;
        }
    },
    /** ISO weeks, Monday through Sunday. */
    WEEKLY("W") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate periodEnd(LocalDate day) {
            return day.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
        }
    },
    MONTHLY("M") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day.withDayOfMonth(1);
        }

        @Override
        public LocalDate periodEnd(LocalDate day) {
            return day.with(TemporalAdjusters.lastDayOfMonth());
        }
    },
    QUARTERLY("Q") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day.with(IsoFields.DAY_OF_QUARTER, 1);
        }

        @Override
        public LocalDate periodEnd(LocalDate day) {
            return periodStart(day).plusMonths(3).minusDays(1);
        }
    },
    YEARLY("Y") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day.withDayOfYear(1);
        }

        @Override
        public LocalDate periodEnd(LocalDate day) {
            return day.with(TemporalAdjusters.lastDayOfYear());
        }
    };

    private final String code;

    PeriodFrequency(String code) {
        this.code = code;
    }

    public abstract LocalDate periodStart(LocalDate day);

    public abstract LocalDate periodEnd(LocalDate day);

    public String code() {
        return code;
    }

    /**
     * Resolves a frequency from its short code ({@code D}, {@code W}, {@code M},
     * {@code Q}, {@code Y}, with {@code A} accepted for yearly) or its constant
     * name, case-insensitively.
     *
     * @throws InvalidRangeException if nothing matches
     */
    public static PeriodFrequency fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidRangeException("Period frequency must not be empty");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("A")) {
            return YEARLY;
        }
        for (PeriodFrequency frequency : values()) {
            if (frequency.code.equals(normalized) || frequency.name().equals(normalized)) {
                return frequency;
            }
        }
        throw new InvalidRangeException("Unrecognized period frequency: '" + code + "'");
    }
}
