package de.bsommerfeld.landcover.core.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * A label image and its confidence image, masked identically.
 *
 * @param label      per-pixel class IDs
 * @param confidence per-pixel confidence percentages
 */
public record LabelConfidence(LabelImage label, ConfidenceImage confidence) {

    public LabelConfidence {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(confidence, "confidence");
        if (label.width() != confidence.width() || label.height() != confidence.height()) {
            throw new IllegalArgumentException("Label and confidence grids differ");
        }
        if (!Arrays.equals(label.mask(), confidence.mask())) {
            throw new IllegalArgumentException("Label and confidence masks differ");
        }
    }

    /** Two-band raster with bands {@code label} and {@code confidence}. */
    public Raster toRaster() {
        return label.raster().withBand(confidence.raster().band(ConfidenceImage.BAND));
    }
}
