package de.bsommerfeld.landcover.core.event;

import de.bsommerfeld.landcover.core.domain.Interval;

/**
 * Events published while a land-cover product is built and assessed.
 */
public class ProcessingEvents {

    /** An interval had no rasters and produced no output. */
    public record IntervalSkippedEvent(Interval interval, String reason) {
    }

    /**
     * Interval reduction and both label aggregations have resolved.
     *
     * @param reducedIntervals rasters emitted by temporal reduction
     * @param skippedIntervals intervals without rasters
     */
    public record ProductsReadyEvent(int reducedIntervals, int skippedIntervals) {
    }

    /**
     * One label product was compared against reference data.
     *
     * @param product         which aggregation was assessed
     * @param overallAccuracy trace over total of the confusion matrix
     * @param samples         number of sampled points
     */
    public record AssessmentCompletedEvent(String product, double overallAccuracy, long samples) {
    }
}
