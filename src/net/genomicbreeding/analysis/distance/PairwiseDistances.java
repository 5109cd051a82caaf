/*
 *  PairwiseDistances
 */
package net.genomicbreeding.analysis.distance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.log4j.Logger;

import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.matrix.EntryFeatureMatrixValidator;
import net.genomicbreeding.prefs.GBPrefs;

/**
 * Distances and correlations between every pair of features (columns) and
 * every pair of entries (rows) of an entry by feature matrix. Only positions
 * where both vectors hold finite, non-missing values are compared; pairs
 * sharing fewer than two such positions are {@link DistanceMetric#UNDEFINED}.
 */
public class PairwiseDistances {

    private static final Logger myLogger = Logger.getLogger(PairwiseDistances.class);

    private static final int MIN_USABLE_POSITIONS = 2;

    private PairwiseDistances() {
        // utility
    }

    /**
     * Computes every metric without standardization.
     */
    public static DistanceMatrices getInstance(EntryFeatureMatrix<?> matrix) {
        return getInstance(matrix, Arrays.asList(DistanceMetric.values()), false);
    }

    /**
     * @param matrix source matrix
     * @param metricNames names of the metrics to compute
     * @param standardize whether to standardize each feature first
     *
     * @return distance matrices
     *
     * @throws IllegalArgumentException if the matrix is not consistent or a
     * metric name is not recognised
     * @throws InsufficientDataException if there are neither two entries nor
     * two features
     */
    public static DistanceMatrices getInstance(EntryFeatureMatrix<?> matrix, String[] metricNames, boolean standardize) {
        return getInstance(matrix, DistanceMetric.resolve(metricNames == null ? null : Arrays.asList(metricNames)), standardize);
    }

    /**
     * @param matrix source matrix
     * @param metrics metrics to compute, duplicates ignored
     * @param standardize whether to standardize each feature first
     *
     * @return distance matrices
     *
     * @throws IllegalArgumentException if the matrix is not consistent or no
     * metric is given
     * @throws InsufficientDataException if there are neither two entries nor
     * two features
     */
    public static DistanceMatrices getInstance(EntryFeatureMatrix<?> matrix, Collection<DistanceMetric> metrics, boolean standardize) {

        EntryFeatureMatrixValidator.validate(matrix, "PairwiseDistances: getInstance");
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("PairwiseDistances: getInstance: please supply at least 1 distance metric. Choose from: " + DistanceMetric.recognisedNames());
        }
        Set<DistanceMetric> metricSet = new LinkedHashSet<>(metrics);
        for (DistanceMetric current : metricSet) {
            if (current == null) {
                throw new IllegalArgumentException("PairwiseDistances: getInstance: null distance metric. Choose from: " + DistanceMetric.recognisedNames());
            }
        }
        List<DistanceMetric> uniqueMetrics = new ArrayList<>(metricSet);

        long time = System.currentTimeMillis();

        // missing cells are NaN here so only finite cells are usable
        double[][] values = matrix.values();
        if (standardize) {
            standardize(values);
        }

        int numEntries = matrix.numberOfEntries();
        int numFeatures = matrix.numberOfFeatures();
        Map<String, double[][]> result = new LinkedHashMap<>();

        if (numFeatures > 1) {
            double[][] vectors = new double[numFeatures][numEntries];
            for (int i = 0; i < numEntries; i++) {
                for (int j = 0; j < numFeatures; j++) {
                    vectors[j][i] = values[i][j];
                }
            }
            computeAxis(DistanceMatrices.FEATURES, vectors, uniqueMetrics, result);
        }

        if (numEntries > 1) {
            computeAxis(DistanceMatrices.ENTRIES, values, uniqueMetrics, result);
        }

        if (result.isEmpty()) {
            throw new InsufficientDataException("PairwiseDistances: getInstance: " + matrix + " is too sparse: at least 2 entries or 2 features are needed.");
        }

        myLogger.info("PairwiseDistances: getInstance: " + uniqueMetrics + " for " + matrix + " time: " + (System.currentTimeMillis() - time) / 1000 + " seconds");
        return new DistanceMatrices(matrix.features(), matrix.entries(), result);

    }

    /**
     * Replaces the finite values of each column with their z-scores over the
     * finite values of that column.
     */
    static void standardize(double[][] values) {
        if (values.length == 0) {
            return;
        }
        int numFeatures = values[0].length;
        Mean mean = new Mean();
        StandardDeviation sd = new StandardDeviation();
        for (int j = 0; j < numFeatures; j++) {
            final int column = j;
            int[] rows = IntStream.range(0, values.length).filter(i -> Double.isFinite(values[i][column])).toArray();
            double[] y = Arrays.stream(rows).mapToDouble(i -> values[i][column]).toArray();
            double mu = mean.evaluate(y);
            double sigma = sd.evaluate(y);
            for (int i : rows) {
                values[i][j] = (values[i][j] - mu) / sigma;
            }
        }
    }

    private static void computeAxis(String axis, double[][] vectors, List<DistanceMetric> metrics, Map<String, double[][]> result) {

        int size = vectors.length;
        int numMetrics = metrics.size();
        double[][][] distances = new double[numMetrics][size][size];
        for (double[][] current : distances) {
            for (double[] row : current) {
                Arrays.fill(row, DistanceMetric.UNDEFINED);
            }
        }
        double[][] counts = new double[size][size];

        ForkJoinPool pool = new ForkJoinPool(GBPrefs.getMaxThreads());
        try {
            pool.submit(() -> IntStream.range(0, size).parallel().forEach(i -> computeRow(i, vectors, metrics, distances, counts))).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("PairwiseDistances: computeAxis: interrupted computing " + axis + " distances.", e);
        } catch (ExecutionException e) {
            myLogger.debug(e.getMessage(), e);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("PairwiseDistances: computeAxis: problem computing " + axis + " distances: " + cause.getMessage(), cause);
        } finally {
            pool.shutdown();
        }

        for (int m = 0; m < numMetrics; m++) {
            result.put(DistanceMatrices.key(axis, metrics.get(m).metricName()), distances[m]);
        }
        result.put(DistanceMatrices.key(axis, DistanceMatrices.COUNTS), counts);
        myLogger.debug("computeAxis: " + axis + ": " + size + " x " + size);

    }

    // each task writes row i only
    private static void computeRow(int i, double[][] vectors, List<DistanceMetric> metrics, double[][][] distances, double[][] counts) {
        double[] first = vectors[i];
        int length = first.length;
        double[] u = new double[length];
        double[] v = new double[length];
        for (int j = 0; j < vectors.length; j++) {
            double[] second = vectors[j];
            int numUsable = 0;
            for (int k = 0; k < length; k++) {
                if (Double.isFinite(first[k]) && Double.isFinite(second[k])) {
                    u[numUsable] = first[k];
                    v[numUsable] = second[k];
                    numUsable++;
                }
            }
            if (numUsable < MIN_USABLE_POSITIONS) {
                continue;
            }
            counts[i][j] = numUsable;
            double[] uUsable = Arrays.copyOf(u, numUsable);
            double[] vUsable = Arrays.copyOf(v, numUsable);
            for (int m = 0; m < metrics.size(); m++) {
                distances[m][i][j] = metrics.get(m).compute(uUsable, vUsable);
            }
        }
    }

}
