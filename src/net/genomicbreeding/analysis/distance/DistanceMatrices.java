/*
 *  DistanceMatrices
 */
package net.genomicbreeding.analysis.distance;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Result of {@link PairwiseDistances}: square matrices keyed by
 * {@code <axis>|<metric>} and {@code <axis>|counts}, where axis is
 * {@value #FEATURES} or {@value #ENTRIES}.
 */
public class DistanceMatrices {

    public static final String FEATURES = "features";
    public static final String ENTRIES = "entries";
    public static final String COUNTS = "counts";

    private final String[] myFeatures;
    private final String[] myEntries;
    private final Map<String, double[][]> myMatrices;

    DistanceMatrices(String[] features, String[] entries, Map<String, double[][]> matrices) {
        myFeatures = features.clone();
        myEntries = entries.clone();
        myMatrices = new LinkedHashMap<>(matrices);
    }

    public static String key(String axis, String name) {
        return axis + "|" + name;
    }

    public String[] features() {
        return myFeatures.clone();
    }

    public String[] entries() {
        return myEntries.clone();
    }

    /**
     * @return keys in the order the matrices were computed
     */
    public Set<String> keys() {
        return ImmutableSet.copyOf(myMatrices.keySet());
    }

    public boolean contains(String key) {
        return myMatrices.containsKey(key);
    }

    /**
     * @return copy of the matrix with this key
     *
     * @throws IllegalArgumentException if there is no such matrix
     */
    public double[][] get(String key) {
        double[][] matrix = myMatrices.get(key);
        if (matrix == null) {
            throw new IllegalArgumentException("DistanceMatrices: get: no matrix: " + key + ". Available: " + myMatrices.keySet());
        }
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    public double[][] get(String axis, DistanceMetric metric) {
        return get(key(axis, metric.metricName()));
    }

    /**
     * @return number of positions used for each pair along the axis
     */
    public double[][] counts(String axis) {
        return get(key(axis, COUNTS));
    }

    @Override
    public String toString() {
        return "DistanceMatrices" + myMatrices.keySet();
    }

}
