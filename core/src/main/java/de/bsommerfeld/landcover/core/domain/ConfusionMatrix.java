package de.bsommerfeld.landcover.core.domain;

import java.util.Arrays;

/**
 * Square cross-tabulation of sample counts, rows indexed by reference class and
 * columns by predicted class. Immutable once built.
 */
public final class ConfusionMatrix {

    private final long[][] counts;

    private ConfusionMatrix(long[][] counts) {
        this.counts = counts;
    }

    public static Builder builder(int numClasses) {
        return new Builder(numClasses);
    }

    /**
     * @throws IllegalArgumentException if the array is not square or holds
     *                                  negative counts
     */
    public static ConfusionMatrix of(long[][] counts) {
        Builder builder = new Builder(counts.length);
        for (int r = 0; r < counts.length; r++) {
            if (counts[r].length != counts.length) {
                throw new IllegalArgumentException("Row " + r + " has " + counts[r].length
                        + " columns, expected " + counts.length);
            }
            for (int c = 0; c < counts.length; c++) {
                builder.add(r, c, counts[r][c]);
            }
        }
        return builder.build();
    }

    public int size() {
        return counts.length;
    }

    public long count(int referenceClass, int predictedClass) {
        return counts[referenceClass][predictedClass];
    }

    public long rowSum(int referenceClass) {
        return Arrays.stream(counts[referenceClass]).sum();
    }

    public long total() {
        long total = 0;
        for (long[] row : counts) {
            total += Arrays.stream(row).sum();
        }
        return total;
    }

    public long trace() {
        long trace = 0;
        for (int i = 0; i < counts.length; i++) {
            trace += counts[i][i];
        }
        return trace;
    }

    /** {@code trace / total}; NaN for a matrix without samples. */
    public double overallAccuracy() {
        long total = total();
        return total == 0 ? Double.NaN : (double) trace() / total;
    }

    /** Whether every off-diagonal count is zero. */
    public boolean isDiagonal() {
        for (int r = 0; r < counts.length; r++) {
            for (int c = 0; c < counts.length; c++) {
                if (r != c && counts[r][c] != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Divides each row by its sum. Rows without samples are filled with NaN,
     * never zero.
     */
    public double[][] rowNormalized() {
        double[][] normalized = new double[counts.length][counts.length];
        for (int r = 0; r < counts.length; r++) {
            long sum = rowSum(r);
            for (int c = 0; c < counts.length; c++) {
                normalized[r][c] = sum == 0 ? Double.NaN : (double) counts[r][c] / sum;
            }
        }
        return normalized;
    }

    public long[][] toArray() {
        long[][] copy = new long[counts.length][];
        for (int r = 0; r < counts.length; r++) {
            copy[r] = counts[r].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ConfusionMatrix other && Arrays.deepEquals(counts, other.counts));
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(counts);
    }

    @Override
    public String toString() {
        return "ConfusionMatrix" + Arrays.deepToString(counts);
    }

    public static final class Builder {

        private final long[][] counts;

        private Builder(int numClasses) {
            if (numClasses <= 0) {
                throw new IllegalArgumentException("Confusion matrix needs at least one class");
            }
            this.counts = new long[numClasses][numClasses];
        }

        public Builder add(int referenceClass, int predictedClass) {
            return add(referenceClass, predictedClass, 1);
        }

        public Builder add(int referenceClass, int predictedClass, long count) {
            if (count < 0) {
                throw new IllegalArgumentException("Negative count " + count);
            }
            if (referenceClass < 0 || referenceClass >= counts.length
                    || predictedClass < 0 || predictedClass >= counts.length) {
                throw new IllegalArgumentException("Class pair (" + referenceClass + ", " + predictedClass
                        + ") outside matrix of size " + counts.length);
            }
            counts[referenceClass][predictedClass] += count;
            return this;
        }

        public ConfusionMatrix build() {
            long[][] copy = new long[counts.length][];
            for (int r = 0; r < counts.length; r++) {
                copy[r] = counts[r].clone();
            }
            return new ConfusionMatrix(copy);
        }
    }
}
