package de.bsommerfeld.landcover.aggregation;

import com.google.inject.Singleton;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.domain.Band;
import de.bsommerfeld.landcover.core.domain.ConfidenceImage;
import de.bsommerfeld.landcover.core.domain.LabelConfidence;
import de.bsommerfeld.landcover.core.domain.LabelImage;
import de.bsommerfeld.landcover.core.domain.Raster;
import de.bsommerfeld.landcover.core.domain.RasterSeries;
import de.bsommerfeld.landcover.core.domain.ReducerKind;
import de.bsommerfeld.landcover.core.graph.Deferred;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Temporal mode of a discrete label band.
 *
 * <p>
 * The label of a pixel is the value observed most often across the series,
 * counting only observations where the pixel is valid. Ties go to the lowest
 * class ID. Confidence is the share of valid observations that agree with the
 * label, as a rounded percentage:
 *
 * <pre>
 * confidence = round(100 * matchCount / validObservationCount)
 * </pre>
 *
 * Pixels never observed are masked in both outputs.
 */
@Singleton
public class ModeLabelAggregator {

    private final RasterBackend backend;

    @Inject
    public ModeLabelAggregator(RasterBackend backend) {
        this.backend = backend;
    }

    public Deferred<LabelConfidence> modeLabel(RasterSeries series, String band) {
        return modeLabel(Deferred.completed("series", series), band);
    }

    public Deferred<LabelConfidence> modeLabel(Deferred<RasterSeries> series, String band) {
        return series.map("modeLabel(" + band + ")", s -> computeModeLabel(s, band));
    }

    /**
     * Share of valid observations of {@code band} equal to {@code target}, per
     * pixel. Masked where {@code target} is masked or the band was never
     * observed.
     */
    public Deferred<ConfidenceImage> modeConfidence(Deferred<RasterSeries> series, String band,
            Deferred<LabelImage> target) {
        return Deferred.combine("modeConfidence(" + band + ")", series, target,
                (s, t) -> matchConfidence(s, band, t));
    }

    private LabelConfidence computeModeLabel(RasterSeries series, String band) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute a mode label over an empty series");
        }
        Raster mode = backend.reduce(series.select(List.of(band)), ReducerKind.MODE);
        LabelImage label = LabelImage.fromRaster(mode, band + "_" + ReducerKind.MODE.label());
        return new LabelConfidence(label, matchConfidence(series, band, label));
    }

    static ConfidenceImage matchConfidence(RasterSeries series, String band, LabelImage target) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute confidence over an empty series");
        }
        int pixels = target.pixelCount();
        int[] confidence = new int[pixels];
        boolean[] valid = new boolean[pixels];

        for (int i = 0; i < pixels; i++) {
            if (!target.isValid(i)) {
                continue;
            }
            int observations = 0;
            int matches = 0;
            for (Raster raster : series) {
                Band values = raster.band(band);
                if (values.isValid(i)) {
                    observations++;
                    if (values.value(i) == target.value(i)) {
                        matches++;
                    }
                }
            }
            if (observations > 0) {
                confidence[i] = (int) Math.round(100.0 * matches / observations);
                valid[i] = true;
            }
        }
        return ConfidenceImage.of(target.width(), target.height(), confidence, valid);
    }
}
