package de.bsommerfeld.landcover.pipeline;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.landcover.assessment.AccuracyReport;
import de.bsommerfeld.landcover.backend.InMemoryRasterBackend;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.config.GlobalConfig;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.LabelConfidence;
import de.bsommerfeld.landcover.core.domain.LabelImage;
import de.bsommerfeld.landcover.core.domain.Legend;
import de.bsommerfeld.landcover.core.domain.LegendEntry;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.Region;
import de.bsommerfeld.landcover.core.event.ApplicationEventBus;
import de.bsommerfeld.landcover.core.event.ProcessingEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the full component graph through Guice and runs it over three months
 * of single-pixel acquisitions with label votes [0,0], [1,1] and [0,1].
 */
class LandCoverPipelineTest {

    private static final Region PIXEL = new Region(0, 0, 1, 1);
    private static final LocalDate START = LocalDate.of(2021, 1, 1);
    private static final LocalDate END = LocalDate.of(2021, 4, 30);

    private Injector injector;
    private LandCoverPipeline pipeline;
    private InMemoryRasterBackend backend;
    private final List<Object> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        GlobalConfig config = new GlobalConfig();
        config.setLegendEntries(List.of(
                new LegendEntry("open", "p_open", "#c0c0c0"),
                new LegendEntry("forest", "p_forest", "#006400")));
        config.getAssessment().setNumPoints(10);

        injector = Guice.createInjector(new LandCoverModule(config));
        pipeline = injector.getInstance(LandCoverPipeline.class);
        backend = (InMemoryRasterBackend) injector.getInstance(RasterBackend.class);
        injector.getInstance(ApplicationEventBus.class).register(this);
    }

    @AfterEach
    void tearDown() {
        pipeline.shutdown();
    }

    @Subscribe
    public void onEvent(Object event) {
        events.add(event);
    }

    private static Raster acquisition(LocalDate day, int label) {
        double open = label == 0 ? 0.8 : 0.3;
        return Raster.builder(1, 1).acquiredOn(day)
                .band("label", label)
                .band("p_open", open)
                .band("p_forest", 1.0 - open)
                .build();
    }

    private void ingestThreeMonths() {
        int[][] votes = { { 0, 0 }, { 1, 1 }, { 0, 1 } };
        for (int month = 0; month < votes.length; month++) {
            backend.ingest(
                    acquisition(LocalDate.of(2021, month + 1, 5), votes[month][0]),
                    acquisition(LocalDate.of(2021, month + 1, 20), votes[month][1]));
        }
    }

    // -- Wiring --

    @Test
    void injector_shouldShareSingletons() {
        assertSame(backend, injector.getInstance(InMemoryRasterBackend.class));
        assertSame(pipeline, injector.getInstance(LandCoverPipeline.class));
        assertEquals(2, injector.getInstance(Legend.class).size());
    }

    @Test
    void module_shouldLoadConfigurationFromFile(@TempDir Path tempDir) {
        Path file = tempDir.resolve("config.json");

        Injector fromFile = Guice.createInjector(new LandCoverModule(file));

        assertTrue(Files.exists(file));
        assertEquals(Legend.dynamicWorld(), fromFile.getInstance(Legend.class));
    }

    // -- Run --

    @Test
    void run_shouldProducePerIntervalModeLabels() {
        ingestThreeMonths();

        LandCoverProducts products = pipeline.run(PIXEL, START, END);

        List<LabelConfidence> perInterval = new ArrayList<>(products.intervalModeLabels().values());
        assertEquals(3, perInterval.size());
        int[] expectedLabels = { 0, 1, 0 };
        int[] expectedConfidence = { 100, 100, 50 };
        for (int i = 0; i < 3; i++) {
            assertEquals(expectedLabels[i], perInterval.get(i).label().label(0, 0));
            assertEquals(expectedConfidence[i], perInterval.get(i).confidence().confidence(0, 0));
        }
    }

    @Test
    void run_shouldSkipIntervalWithoutAcquisitions() {
        ingestThreeMonths();

        LandCoverProducts products = pipeline.run(PIXEL, START, END);

        assertEquals(4, products.intervals().size());
        assertEquals(3, products.reduction().series().size());
        assertEquals(1, products.reduction().skippedCount());
        assertFalse(products.intervalModeLabels().containsKey(products.intervals().get(3)));

        ProcessingEvents.IntervalSkippedEvent skipped = events.stream()
                .filter(ProcessingEvents.IntervalSkippedEvent.class::isInstance)
                .map(ProcessingEvents.IntervalSkippedEvent.class::cast)
                .findFirst().orElseThrow();
        assertEquals(Interval.of(LocalDate.of(2021, 4, 1), END), skipped.interval());
        assertTrue(events.contains(new ProcessingEvents.ProductsReadyEvent(3, 1)));
    }

    @Test
    void run_shouldBuildBothWholeRangeProducts() {
        ingestThreeMonths();

        LandCoverProducts products = pipeline.run(PIXEL, START, END);

        // three votes each: tie goes to class 0
        assertEquals(0, products.modeLabel().label().label(0, 0));
        assertEquals(50, products.modeLabel().confidence().confidence(0, 0));
        // medians: open 0.55, forest 0.45
        assertEquals(0, products.maxMedianLabel().label().label(0, 0));
        assertEquals(55, products.maxMedianLabel().confidence().confidence(0, 0));
    }

    @Test
    void plan_shouldNotQueryUntilResolved() {
        LandCoverPipeline.Plan plan = pipeline.plan(PIXEL, START, END);

        ingestThreeMonths();

        assertEquals(6, plan.source().resolve().size());
        assertEquals(3, plan.reduction().resolve().series().size());
    }

    // -- Assessment --

    @Test
    void assess_shouldReportBothProducts() {
        ingestThreeMonths();
        LandCoverProducts products = pipeline.run(PIXEL, START, END);
        LabelImage reference = LabelImage.of(1, 1, new int[] { 0 }, new boolean[] { true });

        Map<String, AccuracyReport> reports = pipeline.assess(products, reference, PIXEL);

        assertEquals(List.of(LandCoverPipeline.MODE_PRODUCT, LandCoverPipeline.MAX_MEDIAN_PRODUCT),
                new ArrayList<>(reports.keySet()));
        assertEquals(1.0, reports.get(LandCoverPipeline.MODE_PRODUCT).overallAccuracy(), 1e-9);
        assertEquals(1, reports.get(LandCoverPipeline.MAX_MEDIAN_PRODUCT).sampleCount());
        assertEquals(2, events.stream()
                .filter(ProcessingEvents.AssessmentCompletedEvent.class::isInstance).count());
        assertEquals(2, injector.getInstance(ApplicationEventBus.class)
                .postedCount(ProcessingEvents.AssessmentCompletedEvent.class));
    }
}
