/*
 *  EntryFeatureMatrixValidator
 */
package net.genomicbreeding.matrix;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural checks shared by every entry by feature matrix.
 */
public final class EntryFeatureMatrixValidator {

    private EntryFeatureMatrixValidator() {
        // utility
    }

    /**
     * True if the matrix is consistent: as many unique entries and
     * populations as rows of values, missing indicators and mask; as many
     * unique features as columns in every row of those matrices.
     *
     * @param matrix matrix to check
     *
     * @return whether the matrix is consistent
     */
    public static boolean checkDimensions(EntryFeatureMatrix<?> matrix) {

        if (matrix == null) {
            return false;
        }

        String[] entries = matrix.myEntries;
        String[] populations = matrix.myPopulations;
        String[] features = matrix.myFeatures;
        if (entries == null || populations == null || features == null) {
            return false;
        }

        int n = entries.length;
        int p = features.length;
        if (populations.length != n) {
            return false;
        }
        if (!hasShape(matrix.myValues, n, p) || !hasShape(matrix.myMissing, n, p) || !hasShape(matrix.myMask, n, p)) {
            return false;
        }

        return allUnique(entries) && allUnique(features);

    }

    /**
     * Throws IllegalArgumentException if the matrix fails
     * {@link #checkDimensions(EntryFeatureMatrix)}.
     *
     * @param matrix matrix to check
     * @param context caller named in the message
     */
    public static void validate(EntryFeatureMatrix<?> matrix, String context) {
        if (!checkDimensions(matrix)) {
            throw new IllegalArgumentException(context + ": " + describe(matrix) + " is corrupted.");
        }
    }

    static String describe(EntryFeatureMatrix<?> matrix) {
        return matrix == null ? "null matrix" : matrix.getClass().getSimpleName() + " struct";
    }

    private static boolean hasShape(double[][] matrix, int rows, int cols) {
        if (matrix == null || matrix.length != rows) {
            return false;
        }
        for (double[] row : matrix) {
            if (row == null || row.length != cols) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasShape(boolean[][] matrix, int rows, int cols) {
        if (matrix == null || matrix.length != rows) {
            return false;
        }
        for (boolean[] row : matrix) {
            if (row == null || row.length != cols) {
                return false;
            }
        }
        return true;
    }

    private static boolean allUnique(String[] names) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || !seen.add(name)) {
                return false;
            }
        }
        return true;
    }

}
