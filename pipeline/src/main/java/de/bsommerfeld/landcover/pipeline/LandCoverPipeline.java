package de.bsommerfeld.landcover.pipeline;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.aggregation.IntervalGenerator;
import de.bsommerfeld.landcover.aggregation.IntervalOutcome;
import de.bsommerfeld.landcover.aggregation.IntervalReduction;
import de.bsommerfeld.landcover.aggregation.ModeLabelAggregator;
import de.bsommerfeld.landcover.aggregation.ProbabilityArgmaxAggregator;
import de.bsommerfeld.landcover.aggregation.TemporalReducer;
import de.bsommerfeld.landcover.assessment.AccuracyAssessor;
import de.bsommerfeld.landcover.assessment.AccuracyReport;
import de.bsommerfeld.landcover.backend.BackendGateway;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.config.AggregationConfig;
import de.bsommerfeld.landcover.core.domain.Interval;
import de.bsommerfeld.landcover.core.domain.LabelConfidence;
import de.bsommerfeld.landcover.core.domain.LabelImage;
import de.bsommerfeld.landcover.core.domain.RasterSeries;
import de.bsommerfeld.landcover.core.domain.Region;
import de.bsommerfeld.landcover.core.event.ApplicationEventBus;
import de.bsommerfeld.landcover.core.event.ProcessingEvents;
import de.bsommerfeld.landcover.core.graph.Deferred;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-to-end land-cover production: query a range, partition it, reduce per
 * interval, derive both label products, and assess them against reference
 * data.
 *
 * <p>
 * {@link #plan} only assembles the transformation graph. {@link #run}
 * resolves it; the source query is evaluated once and shared by every branch.
 */
@Singleton
public class LandCoverPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(LandCoverPipeline.class);

    public static final String MODE_PRODUCT = "mode";
    public static final String MAX_MEDIAN_PRODUCT = "max-median";

    private final RasterBackend backend;
    private final BackendGateway gateway;
    private final IntervalGenerator intervalGenerator;
    private final TemporalReducer temporalReducer;
    private final ModeLabelAggregator modeAggregator;
    private final ProbabilityArgmaxAggregator argmaxAggregator;
    private final AccuracyAssessor assessor;
    private final AggregationConfig config;
    private final ApplicationEventBus eventBus;

    @Inject
    public LandCoverPipeline(RasterBackend backend, BackendGateway gateway, IntervalGenerator intervalGenerator,
            TemporalReducer temporalReducer, ModeLabelAggregator modeAggregator,
            ProbabilityArgmaxAggregator argmaxAggregator, AccuracyAssessor assessor, AggregationConfig config,
            ApplicationEventBus eventBus) {
        this.backend = backend;
        this.gateway = gateway;
        this.intervalGenerator = intervalGenerator;
        this.temporalReducer = temporalReducer;
        this.modeAggregator = modeAggregator;
        this.argmaxAggregator = argmaxAggregator;
        this.assessor = assessor;
        this.config = config;
        this.eventBus = eventBus;
    }

    /**
     * Unresolved graph for one region and date range.
     *
     * @param windows source series restricted to each interval
     */
    public record Plan(
            List<Interval> intervals,
            Deferred<RasterSeries> source,
            Deferred<IntervalReduction> reduction,
            Deferred<LabelConfidence> modeLabel,
            Deferred<LabelConfidence> maxMedianLabel,
            Map<Interval, Deferred<RasterSeries>> windows) {
    }

    public Plan plan(Region region, LocalDate start, LocalDate end) {
        List<Interval> intervals = intervalGenerator.generate(start, end, config.getPeriodFrequency());
        Interval range = new Interval(start, end);

        Deferred<RasterSeries> source = Deferred.of("query" + range, () -> backend.query(region, range));
        Deferred<IntervalReduction> reduction = temporalReducer.reduce(source, intervals,
                config.getReducerKind(), null, config.getMetadataMode());
        Deferred<LabelConfidence> mode = modeAggregator.modeLabel(source, config.getLabelBand());
        Deferred<LabelConfidence> maxMedian = argmaxAggregator.maxMedianLabel(source);

        Map<Interval, Deferred<RasterSeries>> windows = new LinkedHashMap<>();
        for (Interval interval : intervals) {
            windows.put(interval, source.map("filterDate" + interval, s -> s.filterDate(interval)));
        }
        return new Plan(intervals, source, reduction, mode, maxMedian, ImmutableMap.copyOf(windows));
    }

    public LandCoverProducts run(Region region, LocalDate start, LocalDate end) {
        Plan plan = plan(region, start, end);
        LOG.info("Running land-cover pipeline for {} .. {} over {} intervals", start, end, plan.intervals().size());

        IntervalReduction reduction = plan.reduction().resolve();
        for (IntervalOutcome skipped : reduction.skipped()) {
            eventBus.post(new ProcessingEvents.IntervalSkippedEvent(skipped.interval(),
                    skipped.failure().map(Throwable::getMessage).orElse("unknown")));
        }

        Map<Interval, LabelConfidence> perInterval = new LinkedHashMap<>();
        plan.windows().forEach((interval, window) -> {
            if (!window.resolve().isEmpty()) {
                perInterval.put(interval, modeAggregator.modeLabel(window, config.getLabelBand()).resolve());
            }
        });

        LandCoverProducts products = new LandCoverProducts(plan.intervals(), reduction,
                plan.modeLabel().resolve(), plan.maxMedianLabel().resolve(), perInterval);
        eventBus.post(new ProcessingEvents.ProductsReadyEvent(reduction.series().size(), reduction.skippedCount()));
        return products;
    }

    /**
     * Assesses both whole-range products against {@code reference} with the
     * configured sampling parameters.
     *
     * @return reports keyed by {@link #MODE_PRODUCT} and
     *         {@link #MAX_MEDIAN_PRODUCT}
     */
    public Map<String, AccuracyReport> assess(LandCoverProducts products, LabelImage reference, Region region) {
        Map<String, AccuracyReport> reports = new LinkedHashMap<>();
        reports.put(MODE_PRODUCT, assessOne(MODE_PRODUCT, reference, products.modeLabel().label(), region));
        reports.put(MAX_MEDIAN_PRODUCT,
                assessOne(MAX_MEDIAN_PRODUCT, reference, products.maxMedianLabel().label(), region));
        return reports;
    }

    public void shutdown() {
        gateway.shutdown();
    }

    private AccuracyReport assessOne(String product, LabelImage reference, LabelImage prediction, Region region) {
        AccuracyReport report = assessor.assess(reference, prediction, region);
        eventBus.post(new ProcessingEvents.AssessmentCompletedEvent(product, report.overallAccuracy(),
                report.sampleCount()));
        return report;
    }
}
