package de.bsommerfeld.landcover.core.domain;

import de.bsommerfeld.landcover.core.error.BandMismatchException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RasterSeriesTest {

    private static Raster on(LocalDate day, double value) {
        return Raster.builder(1, 1).acquiredOn(day).band("label", value).build();
    }

    @Test
    void of_shouldSortByAcquisitionTime() {
        RasterSeries series = RasterSeries.of(
                on(LocalDate.of(2021, 3, 1), 3),
                on(LocalDate.of(2021, 1, 1), 1),
                on(LocalDate.of(2021, 2, 1), 2));

        assertEquals(1.0, series.get(0).band("label").value(0));
        assertEquals(2.0, series.get(1).band("label").value(0));
        assertEquals(3.0, series.get(2).band("label").value(0));
    }

    @Test
    void of_shouldKeepInputOrderForEqualTimestamps() {
        LocalDate day = LocalDate.of(2021, 1, 1);
        RasterSeries series = RasterSeries.of(on(day, 7), on(day, 5));

        assertEquals(7.0, series.get(0).band("label").value(0));
        assertEquals(5.0, series.get(1).band("label").value(0));
    }

    @Test
    void inOrder_shouldKeepGivenOrder() {
        RasterSeries series = RasterSeries.inOrder(List.of(
                on(LocalDate.of(2021, 3, 1), 3),
                on(LocalDate.of(2021, 1, 1), 1)));

        assertEquals(3.0, series.get(0).band("label").value(0));
        assertEquals(1.0, series.get(1).band("label").value(0));
    }

    @Test
    void map_shouldNotReorderRasters() {
        RasterSeries series = RasterSeries.inOrder(List.of(
                on(LocalDate.of(2021, 3, 1), 3),
                on(LocalDate.of(2021, 1, 1), 1)));

        RasterSeries mapped = series.map(r -> r.renameBands(List.of("class")));

        assertEquals(3.0, mapped.get(0).band("class").value(0));
    }

    @Test
    void of_shouldRejectMixedSchemas() {
        Raster other = Raster.builder(1, 1).acquiredOn(LocalDate.of(2021, 1, 1)).band("water", 0.5).build();
        assertThrows(BandMismatchException.class,
                () -> RasterSeries.of(on(LocalDate.of(2021, 1, 1), 0), other));
    }

    @Test
    void filterDate_shouldIncludeBoundaryDays() {
        RasterSeries series = RasterSeries.of(
                on(LocalDate.of(2020, 12, 31), 0),
                on(LocalDate.of(2021, 1, 1), 1),
                on(LocalDate.of(2021, 1, 31), 2),
                on(LocalDate.of(2021, 2, 1), 3));

        RasterSeries january = series.filterDate(
                Interval.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 31)));

        assertEquals(2, january.size());
    }

    @Test
    void filterDate_shouldMatchExactDateForSingleDayInterval() {
        RasterSeries series = RasterSeries.of(
                on(LocalDate.of(2021, 1, 1), 1),
                on(LocalDate.of(2021, 1, 2), 2));

        RasterSeries day = series.filterDate(Interval.ofDay(LocalDate.of(2021, 1, 2)));

        assertEquals(1, day.size());
        assertEquals(2.0, day.get(0).band("label").value(0));
    }

    @Test
    void filterDate_shouldSkipUntimedRasters() {
        Raster untimed = Raster.builder(1, 1).band("label", 1).build();
        RasterSeries series = RasterSeries.of(untimed);

        assertTrue(series.filterDate(Interval.ofDay(LocalDate.of(2021, 1, 1))).isEmpty());
    }

    @Test
    void empty_shouldHaveNoBands() {
        assertTrue(RasterSeries.empty().isEmpty());
        assertEquals(List.of(), RasterSeries.empty().bandNames());
    }
}
