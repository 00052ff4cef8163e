package de.bsommerfeld.landcover.core.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One named channel of a {@link Raster}: a row-major value grid plus its
 * validity mask. Instances are immutable; arrays are copied on the way in and
 * on the way out.
 */
public final class Band {

    private final String name;
    private final double[] values;
    private final boolean[] valid;

    private Band(String name, double[] values, boolean[] valid) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = values;
        this.valid = valid;
    }

    /**
     * Creates a band whose NaN cells are masked and every other cell is valid.
     */
    public static Band of(String name, double[] values) {
        boolean[] valid = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            valid[i] = !Double.isNaN(values[i]);
        }
        return new Band(name, values.clone(), valid);
    }

    /**
     * Creates a band with an explicit mask. NaN cells are masked regardless of
     * what the mask says.
     *
     * @throws IllegalArgumentException if the array lengths differ
     */
    public static Band of(String name, double[] values, boolean[] valid) {
        if (values.length != valid.length) {
            throw new IllegalArgumentException("Band '" + name + "' has " + values.length
                    + " values but " + valid.length + " mask cells");
        }
        boolean[] mask = valid.clone();
        for (int i = 0; i < values.length; i++) {
            mask[i] &= !Double.isNaN(values[i]);
        }
        return new Band(name, values.clone(), mask);
    }

    public String name() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public double value(int index) {
        return values[index];
    }

    public boolean isValid(int index) {
        return valid[index];
    }

    public int validCount() {
        int count = 0;
        for (boolean v : valid) {
            if (v) {
                count++;
            }
        }
        return count;
    }

    public double[] values() {
        return values.clone();
    }

    public boolean[] mask() {
        return valid.clone();
    }

    public Band renamed(String newName) {
        return new Band(newName, values, valid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Band other)) {
            return false;
        }
        return name.equals(other.name)
                && Arrays.equals(values, other.values)
                && Arrays.equals(valid, other.valid);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name);
        result = 31 * result + Arrays.hashCode(values);
        return 31 * result + Arrays.hashCode(valid);
    }

    @Override
    public String toString() {
        return "Band[" + name + ", " + validCount() + "/" + values.length + " valid]";
    }
}
