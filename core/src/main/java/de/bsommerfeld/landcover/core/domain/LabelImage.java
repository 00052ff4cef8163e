package de.bsommerfeld.landcover.core.domain;

import java.util.List;

/**
 * Per-pixel class assignment. Valid values are class IDs, non-negative
 * integers indexing the legend.
 */
public final class LabelImage extends IntegerImage {

    public static final String BAND = "label";

    private LabelImage(Raster raster) {
        super(raster, BAND);
    }

    public static LabelImage of(int width, int height, int[] labels, boolean[] valid) {
        return new LabelImage(singleBand(BAND, width, height, labels, valid));
    }

    /**
     * Wraps {@code band} of an existing raster (e.g. a reference classification)
     * as a label image. Metadata is carried over.
     */
    public static LabelImage fromRaster(Raster raster, String band) {
        Raster single = raster.select(List.of(band)).renameBands(List.of(BAND));
        return new LabelImage(single);
    }

    public int label(int x, int y) {
        return value(x, y);
    }

    /** Highest valid class ID, or -1 if every pixel is masked. */
    public int maxLabel() {
        int max = -1;
        for (int i = 0; i < pixelCount(); i++) {
            if (isValid(i)) {
                max = Math.max(max, value(i));
            }
        }
        return max;
    }

    @Override
    void checkDomain(int value, int index) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative class ID " + value + " at index " + index);
        }
    }
}
