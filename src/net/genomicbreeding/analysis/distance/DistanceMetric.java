/*
 *  DistanceMetric
 */
package net.genomicbreeding.analysis.distance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

/**
 * Pairwise distances and correlations computed by {@link PairwiseDistances}.
 * Each metric is evaluated over two vectors of equal length holding only
 * finite values, at least two of them.
 */
public enum DistanceMetric {

    EUCLIDEAN("euclidean") {
        @Override
        public double compute(double[] u, double[] v) {
            double sum = 0.0;
            for (int k = 0; k < u.length; k++) {
                double diff = u[k] - v[k];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    },

    /**
     * Pearson correlation. Undefined when either vector has a sample variance
     * below {@value #MIN_VARIANCE}.
     */
    CORRELATION("correlation") {
        @Override
        public double compute(double[] u, double[] v) {
            Variance variance = new Variance();
            if (variance.evaluate(u) < MIN_VARIANCE || variance.evaluate(v) < MIN_VARIANCE) {
                return UNDEFINED;
            }
            return new PearsonsCorrelation().correlation(u, v);
        }
    },

    /**
     * Mean absolute deviation.
     */
    MAD("mad") {
        @Override
        public double compute(double[] u, double[] v) {
            double sum = 0.0;
            for (int k = 0; k < u.length; k++) {
                sum += Math.abs(u[k] - v[k]);
            }
            return sum / u.length;
        }
    },

    /**
     * Root mean square deviation.
     */
    RMSD("rmsd") {
        @Override
        public double compute(double[] u, double[] v) {
            double sum = 0.0;
            for (int k = 0; k < u.length; k++) {
                double diff = u[k] - v[k];
                sum += diff * diff;
            }
            return Math.sqrt(sum / u.length);
        }
    },

    /**
     * Chi-square distance with the second vector as expected values, so
     * {@code compute(u, v)} and {@code compute(v, u)} generally differ.
     */
    CHI_SQUARE("chi_square") {
        @Override
        public double compute(double[] u, double[] v) {
            double sum = 0.0;
            for (int k = 0; k < u.length; k++) {
                double diff = u[k] - v[k];
                sum += diff * diff / (v[k] + EPSILON);
            }
            return sum;
        }
    };

    /**
     * Value of a cell for which no comparison is available.
     */
    public static final double UNDEFINED = Double.NEGATIVE_INFINITY;

    public static final double MIN_VARIANCE = 1e-7;

    private static final double EPSILON = Math.ulp(1.0);

    private static final String CHI_SQUARE_ALIAS = "χ²";

    private final String myName;

    DistanceMetric(String name) {
        myName = name;
    }

    /**
     * @param u first vector
     * @param v second vector, same length as u
     *
     * @return the distance or correlation, {@link #UNDEFINED} if it cannot be
     * computed
     */
    public abstract double compute(double[] u, double[] v);

    /**
     * @return name used in result keys and parameter values
     */
    public String metricName() {
        return myName;
    }

    @Override
    public String toString() {
        return myName;
    }

    /**
     * @return the metric with this name, null if there is none
     */
    public static DistanceMetric fromName(String name) {
        if (CHI_SQUARE_ALIAS.equals(name)) {
            return CHI_SQUARE;
        }
        for (DistanceMetric current : values()) {
            if (current.myName.equals(name)) {
                return current;
            }
        }
        return null;
    }

    /**
     * Resolves metric names, dropping duplicates and keeping the order in
     * which they first appear.
     *
     * @throws IllegalArgumentException if there are no names or any is not
     * recognised
     */
    public static List<DistanceMetric> resolve(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("DistanceMetric: resolve: please supply at least 1 distance metric. Choose from: " + recognisedNames());
        }
        Set<DistanceMetric> result = new LinkedHashSet<>();
        List<String> unrecognised = new ArrayList<>();
        for (String name : names) {
            DistanceMetric metric = fromName(name);
            if (metric == null) {
                unrecognised.add(name);
            } else {
                result.add(metric);
            }
        }
        if (!unrecognised.isEmpty()) {
            throw new IllegalArgumentException("DistanceMetric: resolve: unrecognised metric/s: " + unrecognised + ". Please choose from: " + recognisedNames());
        }
        return new ArrayList<>(result);
    }

    public static String recognisedNames() {
        return Arrays.stream(values()).map(DistanceMetric::metricName).collect(Collectors.joining(", "));
    }

}
