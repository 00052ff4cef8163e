/**
 * End-to-end wiring: Guice module and the production run.
 *
 * <pre>
 *   query(region, range) ──┬── TemporalReducer ─────────── IntervalReduction
 *                          ├── ModeLabelAggregator ─────── mode label
 *                          ├── ProbabilityArgmaxAggregator  max-median label
 *                          └── filterDate(interval) ×N ─── mode label per interval
 *                                                │
 *                                                ▼
 *                                        AccuracyAssessor
 * </pre>
 *
 * Every branch hangs off one memoized source node, so the backend query runs
 * once per {@link de.bsommerfeld.landcover.pipeline.LandCoverPipeline#run}.
 * Progress is published on the
 * {@link de.bsommerfeld.landcover.core.event.ApplicationEventBus}.
 */
package de.bsommerfeld.landcover.pipeline;
