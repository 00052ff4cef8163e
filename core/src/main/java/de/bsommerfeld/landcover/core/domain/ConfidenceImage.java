package de.bsommerfeld.landcover.core.domain;

/**
 * Per-pixel confidence of a {@link LabelImage}, an integer percentage in
 * {@code [0, 100]}.
 */
public final class ConfidenceImage extends IntegerImage {

    public static final String BAND = "confidence";

    private ConfidenceImage(Raster raster) {
        super(raster, BAND);
    }

    public static ConfidenceImage of(int width, int height, int[] confidence, boolean[] valid) {
        return new ConfidenceImage(singleBand(BAND, width, height, confidence, valid));
    }

    public int confidence(int x, int y) {
        return value(x, y);
    }

    @Override
    void checkDomain(int value, int index) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("Confidence " + value + " at index " + index + " outside [0, 100]");
        }
    }
}
