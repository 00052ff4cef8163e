package de.bsommerfeld.landcover.core.domain;

import de.bsommerfeld.landcover.core.error.UnknownReducerException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReducerKindTest {

    @Test
    void mode_shouldPickMostFrequentValue() {
        assertEquals(3.0, ReducerKind.MODE.apply(new double[] { 3, 1, 3, 2 }));
    }

    @Test
    void mode_shouldResolveTiesToLowestValue() {
        assertEquals(0.0, ReducerKind.MODE.apply(new double[] { 1, 0 }));
        assertEquals(2.0, ReducerKind.MODE.apply(new double[] { 5, 2, 5, 2, 7 }));
    }

    @Test
    void median_shouldAverageMiddlePairForEvenCounts() {
        assertEquals(2.5, ReducerKind.MEDIAN.apply(new double[] { 4, 1, 3, 2 }), 1e-9);
        assertEquals(3.0, ReducerKind.MEDIAN.apply(new double[] { 5, 3, 1 }), 1e-9);
    }

    @Test
    void median_shouldNotReorderInput() {
        double[] values = { 3, 1, 2 };
        ReducerKind.MEDIAN.apply(values);
        assertArrayEquals(new double[] { 3, 1, 2 }, values);
    }

    @Test
    void meanMaxMin_shouldComputeBasicStatistics() {
        double[] values = { 1, 2, 6 };
        assertEquals(3.0, ReducerKind.MEAN.apply(values), 1e-9);
        assertEquals(6.0, ReducerKind.MAX.apply(values));
        assertEquals(1.0, ReducerKind.MIN.apply(values));
    }

    @Test
    void fromName_shouldBeCaseInsensitive() {
        assertEquals(ReducerKind.MEDIAN, ReducerKind.fromName("median"));
        assertEquals(ReducerKind.MODE, ReducerKind.fromName("MODE"));
        assertEquals("max", ReducerKind.MAX.label());
    }

    @Test
    void fromName_shouldRejectUnsupportedStatistic() {
        UnknownReducerException e = assertThrows(UnknownReducerException.class,
                () -> ReducerKind.fromName("percentile"));
        assertTrue(e.getMessage().contains("percentile"));
        assertThrows(UnknownReducerException.class, () -> ReducerKind.fromName(null));
    }
}
