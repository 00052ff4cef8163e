package de.bsommerfeld.landcover.core.domain;

import de.bsommerfeld.landcover.core.error.InvalidRangeException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class IntervalTest {

    @Test
    void constructor_shouldRejectStartAfterEnd() {
        assertThrows(InvalidRangeException.class,
                () -> new Interval(LocalDate.of(2021, 2, 1), LocalDate.of(2021, 1, 31)));
    }

    @Test
    void contains_shouldIncludeBothBounds() {
        Interval january = Interval.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 31));

        assertTrue(january.contains(LocalDate.of(2021, 1, 1)));
        assertTrue(january.contains(LocalDate.of(2021, 1, 31)));
        assertFalse(january.contains(LocalDate.of(2020, 12, 31)));
        assertFalse(january.contains(LocalDate.of(2021, 2, 1)));
    }

    @Test
    void ofDay_shouldMatchOnlyThatDay() {
        Interval day = Interval.ofDay(LocalDate.of(2021, 3, 15));

        assertTrue(day.isSingleDay());
        assertEquals(0, day.daySpan());
        assertTrue(day.contains(LocalDate.of(2021, 3, 15)));
        assertFalse(day.contains(LocalDate.of(2021, 3, 16)));
    }

    @Test
    void midpoint_shouldAddHalfTheDaySpan() {
        Interval january = Interval.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 31));
        assertEquals(Instant.parse("2021-01-16T00:00:00Z"), january.midpoint());

        Interval twoDays = Interval.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 2));
        assertEquals(Instant.parse("2021-01-01T12:00:00Z"), twoDays.midpoint());
    }

    @Test
    void instants_shouldBeUtcMidnight() {
        Interval interval = Interval.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 31));

        assertEquals(Instant.parse("2021-01-01T00:00:00Z"), interval.startInstant());
        assertEquals(Instant.parse("2021-01-31T00:00:00Z"), interval.endInstant());
    }
}
