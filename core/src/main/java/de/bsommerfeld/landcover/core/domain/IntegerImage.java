package de.bsommerfeld.landcover.core.domain;

/**
 * Single-band raster holding integral values. Base of {@link LabelImage} and
 * {@link ConfidenceImage}; the concrete type fixes the band name and the value
 * domain.
 */
public abstract class IntegerImage {

    private final Raster raster;
    private final String bandName;

    IntegerImage(Raster raster, String bandName) {
        this.raster = raster;
        this.bandName = bandName;
        Band band = raster.band(bandName);
        for (int i = 0; i < band.size(); i++) {
            if (band.isValid(i)) {
                double v = band.value(i);
                if (v != Math.rint(v)) {
                    throw new IllegalArgumentException(getClass().getSimpleName() + " value " + v
                            + " at index " + i + " is not integral");
                }
                checkDomain((int) v, i);
            }
        }
    }

    static Raster singleBand(String name, int width, int height, int[] values, boolean[] valid) {
        double[] asDouble = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            asDouble[i] = values[i];
        }
        return Raster.builder(width, height).band(name, asDouble, valid).build();
    }

    abstract void checkDomain(int value, int index);

    public int width() {
        return raster.width();
    }

    public int height() {
        return raster.height();
    }

    public int pixelCount() {
        return raster.pixelCount();
    }

    public boolean isValid(int index) {
        return raster.band(bandName).isValid(index);
    }

    public boolean isValid(int x, int y) {
        return isValid(raster.index(x, y));
    }

    /** Value at {@code index}; meaningless where {@link #isValid(int)} is false. */
    public int value(int index) {
        return (int) raster.band(bandName).value(index);
    }

    public int value(int x, int y) {
        return value(raster.index(x, y));
    }

    public boolean[] mask() {
        return raster.band(bandName).mask();
    }

    /** The backing single-band raster. */
    public Raster raster() {
        return raster;
    }

    public String bandName() {
        return bandName;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o != null && getClass() == o.getClass() && raster.equals(((IntegerImage) o).raster));
    }

    @Override
    public int hashCode() {
        return raster.hashCode();
    }
}
