package de.bsommerfeld.landcover.core.domain;

import de.bsommerfeld.landcover.core.error.InvalidRangeException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class PeriodFrequencyTest {

    @Test
    void fromCode_shouldResolveShortCodesAndNames() {
        assertEquals(PeriodFrequency.DAILY, PeriodFrequency.fromCode("D"));
        assertEquals(PeriodFrequency.WEEKLY, PeriodFrequency.fromCode("w"));
        assertEquals(PeriodFrequency.MONTHLY, PeriodFrequency.fromCode(" M "));
        assertEquals(PeriodFrequency.QUARTERLY, PeriodFrequency.fromCode("quarterly"));
        assertEquals(PeriodFrequency.YEARLY, PeriodFrequency.fromCode("A"));
        assertEquals(PeriodFrequency.YEARLY, PeriodFrequency.fromCode("Y"));
    }

    @Test
    void fromCode_shouldRejectUnknownCodes() {
        assertThrows(InvalidRangeException.class, () -> PeriodFrequency.fromCode("X"));
        assertThrows(InvalidRangeException.class, () -> PeriodFrequency.fromCode(""));
        assertThrows(InvalidRangeException.class, () -> PeriodFrequency.fromCode(null));
    }

    @Test
    void weekly_shouldSpanMondayToSunday() {
        // 2021-03-03 is a Wednesday
        LocalDate wednesday = LocalDate.of(2021, 3, 3);

        assertEquals(LocalDate.of(2021, 3, 1), PeriodFrequency.WEEKLY.periodStart(wednesday));
        assertEquals(LocalDate.of(2021, 3, 7), PeriodFrequency.WEEKLY.periodEnd(wednesday));
    }

    @Test
    void monthly_shouldHandleLeapFebruary() {
        LocalDate day = LocalDate.of(2020, 2, 10);

        assertEquals(LocalDate.of(2020, 2, 1), PeriodFrequency.MONTHLY.periodStart(day));
        assertEquals(LocalDate.of(2020, 2, 29), PeriodFrequency.MONTHLY.periodEnd(day));
    }

    @Test
    void quarterly_shouldAlignToCalendarQuarters() {
        LocalDate day = LocalDate.of(2021, 5, 20);

        assertEquals(LocalDate.of(2021, 4, 1), PeriodFrequency.QUARTERLY.periodStart(day));
        assertEquals(LocalDate.of(2021, 6, 30), PeriodFrequency.QUARTERLY.periodEnd(day));
    }

    @Test
    void yearly_shouldSpanCalendarYear() {
        LocalDate day = LocalDate.of(2021, 7, 4);

        assertEquals(LocalDate.of(2021, 1, 1), PeriodFrequency.YEARLY.periodStart(day));
        assertEquals(LocalDate.of(2021, 12, 31), PeriodFrequency.YEARLY.periodEnd(day));
    }
}
