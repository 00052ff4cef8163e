package de.bsommerfeld.landcover.core.config;

import de.bsommerfeld.landcover.core.domain.Legend;
import de.bsommerfeld.landcover.core.domain.LegendEntry;
import de.bsommerfeld.landcover.core.domain.MetadataMode;
import de.bsommerfeld.landcover.core.domain.PeriodFrequency;
import de.bsommerfeld.landcover.core.domain.ReducerKind;
import de.bsommerfeld.landcover.core.error.UnknownReducerException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void globalConfig_shouldInitializeWithDefaults() {
        var config = new GlobalConfig();

        assertNotNull(config.getAggregation());
        assertNotNull(config.getAssessment());
        assertNotNull(config.getBackend());
        assertFalse(config.isDebugMode());
        assertEquals(Legend.dynamicWorld(), config.getLegend());
    }

    @Test
    void aggregationConfig_shouldDefaultToMonthlyMedian() {
        var config = new AggregationConfig();

        assertEquals(ReducerKind.MEDIAN, config.getReducerKind());
        assertEquals(PeriodFrequency.MONTHLY, config.getPeriodFrequency());
        assertEquals(MetadataMode.AGGREGATION_PERIOD, config.getMetadataMode());
        assertEquals("label", config.getLabelBand());
    }

    @Test
    void aggregationConfig_shouldRejectUnknownReducerOnAccess() {
        var config = new AggregationConfig();
        config.setReducer("percentile");
        assertThrows(UnknownReducerException.class, config::getReducerKind);
    }

    @Test
    void assessmentConfig_shouldHaveReasonableDefaults() {
        var config = new AssessmentConfig();

        assertEquals(2000, config.getNumPoints());
        assertEquals(10.0, config.getScale(), 0.001);
        assertEquals(42, config.getSeed());
        assertEquals(Duration.ofMinutes(2), config.getTimeout());
    }

    @Test
    void backendConfig_shouldHaveReasonableDefaults() {
        var config = new BackendConfig();

        assertEquals(10.0, config.getNativeScale(), 0.001);
        assertEquals(2, config.getWorkerThreads());
    }

    @Test
    void globalConfig_shouldBuildCustomLegend() {
        var config = new GlobalConfig();
        config.setLegendEntries(List.of(
                new LegendEntry("forest", "p_forest", "#00ff00"),
                new LegendEntry("field", "p_field", "#ffff00")));

        assertEquals(List.of("p_forest", "p_field"), config.getLegend().probabilityBands());
    }
}
