package de.bsommerfeld.landcover.core.domain;

import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import com.google.common.primitives.Doubles;
import de.bsommerfeld.landcover.core.error.UnknownReducerException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Per-pixel statistics available to temporal reduction. Each constant is a pure
 * function over the valid observations of one pixel; callers never pass an
 * empty array because fully masked pixels stay masked.
 */
public enum ReducerKind {

    MEAN {
        @Override
        public double apply(double[] values) {
            return Stats.meanOf(values);
        }
    },
    MEDIAN {
        @Override
        public double apply(double[] values) {
            return Quantiles.median().computeInPlace(values.clone());
        }
    },
    /**
     * Most frequent value. Ties resolve to the lowest value, which for label
     * bands means the lowest class ID.
     */
    MODE {
        @Override
        public double apply(double[] values) {
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            double best = sorted[0];
            int bestRun = 0;
            int i = 0;
            while (i < sorted.length) {
                int j = i;
                while (j < sorted.length && sorted[j] == sorted[i]) {
                    j++;
                }
                // strictly greater keeps the earlier (lower) value on ties
                if (j - i > bestRun) {
                    bestRun = j - i;
                    best = sorted[i];
                }
                i = j;
            }
            return best;
        }
    },
    MAX {
        @Override
        public double apply(double[] values) {
            return Doubles.max(values);
        }
    },
    MIN {
        @Override
        public double apply(double[] values) {
            return Doubles.min(values);
        }
    };

    /**
     * Reduces the valid observations of one pixel.
     *
     * @param values at least one observation
     */
    public abstract double apply(double[] values);

    /** Lower-case name, used as the suffix of reduced band names. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws UnknownReducerException if {@code name} is not one of
     *                                 mean, median, mode, max, min
     */
    public static ReducerKind fromName(String name) {
        if (name == null) {
            throw new UnknownReducerException("null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownReducerException(name);
        }
    }
}
