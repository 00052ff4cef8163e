package de.bsommerfeld.landcover.assessment;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.backend.BackendGateway;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.config.AssessmentConfig;
import de.bsommerfeld.landcover.core.domain.ConfusionMatrix;
import de.bsommerfeld.landcover.core.domain.LabelImage;
import de.bsommerfeld.landcover.core.domain.Legend;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.Region;
import de.bsommerfeld.landcover.core.domain.SamplePoint;
import de.bsommerfeld.landcover.core.error.EmptyRegionException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Compares a predicted label image to a reference label image.
 *
 * <p>
 * Points are drawn by stratified random sampling on the reference class, so
 * rare classes contribute samples too; pixels masked in either image are never
 * drawn. Sampled pairs are tallied into a {@link ConfusionMatrix} whose axes
 * follow the legend. The matrix grows beyond the legend only if the images hold
 * class IDs the legend does not know.
 *
 * <p>
 * Sampling is the read boundary where label images are materialized by the
 * backend, so it runs through the {@link BackendGateway} under a timeout.
 */
@Singleton
public class AccuracyAssessor {

    private static final Logger LOG = LoggerFactory.getLogger(AccuracyAssessor.class);

    static final String REFERENCE = "reference";
    static final String PREDICTION = "prediction";

    private final RasterBackend backend;
    private final BackendGateway gateway;
    private final AssessmentConfig config;
    private final Legend legend;

    @Inject
    public AccuracyAssessor(RasterBackend backend, BackendGateway gateway, AssessmentConfig config, Legend legend) {
        this.backend = backend;
        this.gateway = gateway;
        this.config = config;
        this.legend = legend;
    }

    /** Uses the configured point count, scale, seed and timeout. */
    public AccuracyReport assess(LabelImage reference, LabelImage prediction, Region region) {
        return assess(reference, prediction, region, config.getNumPoints(), config.getScale(), config.getSeed(),
                config.getTimeout());
    }

    public AccuracyReport assess(LabelImage reference, LabelImage prediction, Region region,
            int numPoints, double scale, long seed) {
        return assess(reference, prediction, region, numPoints, scale, seed, config.getTimeout());
    }

    /**
     * @param numPoints points drawn per reference class
     * @param scale     sampling resolution in ground units
     * @param seed      makes the draw reproducible
     * @param timeout   upper bound for the sampling call
     * @throws IllegalArgumentException if {@code numPoints} or {@code scale}
     *                                  is not positive, or the grids differ
     * @throws EmptyRegionException if no valid point could be drawn
     * @throws de.bsommerfeld.landcover.core.error.BackendTimeoutException if
     *         sampling exceeds {@code timeout}
     */
    public AccuracyReport assess(LabelImage reference, LabelImage prediction, Region region,
            int numPoints, double scale, long seed, Duration timeout) {
        if (numPoints <= 0) {
            throw new IllegalArgumentException("numPoints must be positive: " + numPoints);
        }
        if (!(scale > 0)) {
            throw new IllegalArgumentException("scale must be positive: " + scale);
        }
        if (reference.width() != prediction.width() || reference.height() != prediction.height()) {
            throw new IllegalArgumentException("Reference grid " + reference.width() + "x" + reference.height()
                    + " differs from prediction grid " + prediction.width() + "x" + prediction.height());
        }
        Raster paired = reference.raster().renameBands(List.of(REFERENCE))
                .withBand(prediction.raster().band(LabelImage.BAND).renamed(PREDICTION));

        List<SamplePoint> samples = gateway.call("stratifiedSample",
                () -> backend.stratifiedSample(paired, REFERENCE, region, numPoints, scale, seed), timeout);
        if (samples.isEmpty()) {
            throw new EmptyRegionException("No valid sample points in region " + region);
        }

        int size = legend.size();
        for (SamplePoint sample : samples) {
            size = Math.max(size, 1 + (int) Math.max(sample.value(REFERENCE), sample.value(PREDICTION)));
        }
        ConfusionMatrix.Builder matrix = ConfusionMatrix.builder(size);
        for (SamplePoint sample : samples) {
            matrix.add((int) sample.value(REFERENCE), (int) sample.value(PREDICTION));
        }
        ConfusionMatrix built = matrix.build();

        LOG.info("Assessed {} samples over {} classes, overall accuracy {}", samples.size(), size,
                String.format("%.4f", built.overallAccuracy()));
        return new AccuracyReport(built, built.overallAccuracy());
    }

    /**
     * Row-normalizes {@code matrix}, labelling axes with {@code classLabels}.
     *
     * @throws IllegalArgumentException if the label count differs from the
     *                                  matrix size
     */
    public NormalizedConfusionMatrix normalize(ConfusionMatrix matrix, List<String> classLabels) {
        if (classLabels.size() != matrix.size()) {
            throw new IllegalArgumentException(classLabels.size() + " labels for a matrix of size " + matrix.size());
        }
        NormalizedConfusionMatrix normalized = new NormalizedConfusionMatrix(classLabels, matrix.rowNormalized());
        List<String> undefined = normalized.undefinedRows();
        if (!undefined.isEmpty()) {
            LOG.debug("Reference classes without samples: {}", undefined);
        }
        return normalized;
    }

    /** Labels the axes with legend names, and with class IDs beyond the legend. */
    public NormalizedConfusionMatrix normalize(ConfusionMatrix matrix) {
        return normalize(matrix, classLabels(matrix.size()));
    }

    /** Legend names for the first classes, class IDs as text past the legend. */
    public List<String> classLabels(int size) {
        ImmutableList.Builder<String> labels = ImmutableList.builder();
        for (int i = 0; i < size; i++) {
            labels.add(i < legend.size() ? legend.entry(i).name() : String.valueOf(i));
        }
        return labels.build();
    }
}
