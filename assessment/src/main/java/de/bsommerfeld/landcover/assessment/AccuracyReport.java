package de.bsommerfeld.landcover.assessment;

import de.bsommerfeld.landcover.core.domain.ConfusionMatrix;

/**
 * Outcome of comparing a predicted label image to reference data.
 *
 * @param matrix          reference (rows) against prediction (columns) counts
 * @param overallAccuracy {@code trace / total} of {@code matrix}
 */
public record AccuracyReport(ConfusionMatrix matrix, double overallAccuracy) {

    public long sampleCount() {
        return matrix.total();
    }
}
