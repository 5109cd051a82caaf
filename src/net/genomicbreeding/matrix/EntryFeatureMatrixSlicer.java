/*
 *  EntryFeatureMatrixSlicer
 */
package net.genomicbreeding.matrix;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.apache.log4j.Logger;

/**
 * Projects entry by feature matrices onto subsets of their entries and
 * features. Results are new matrices that share no storage with the source.
 */
public final class EntryFeatureMatrixSlicer {

    private static final Logger myLogger = Logger.getLogger(EntryFeatureMatrixSlicer.class);

    private EntryFeatureMatrixSlicer() {
        // utility
    }

    /**
     * Selects entries and features by index. Indices are de-duplicated and
     * sorted so the result always follows the source ordering.
     *
     * @param matrix source matrix
     * @param entryIndices indices of entries to keep, null for all
     * @param featureIndices indices of features to keep, null for all
     *
     * @return new matrix holding the selected cells
     */
    public static <M extends EntryFeatureMatrix<M>> M slice(M matrix, int[] entryIndices, int[] featureIndices) {

        EntryFeatureMatrixValidator.validate(matrix, "EntryFeatureMatrixSlicer: slice");

        int[] rows = normalizeIndices(entryIndices, matrix.numberOfEntries(), "entry");
        int[] cols = normalizeIndices(featureIndices, matrix.numberOfFeatures(), "feature");

        EntryFeatureMatrix<M> source = matrix;
        M result = source.newInstance(rows.length, cols.length);
        EntryFeatureMatrix<M> target = result;
        for (int i = 0; i < rows.length; i++) {
            int row = rows[i];
            target.myEntries[i] = source.myEntries[row];
            target.myPopulations[i] = source.myPopulations[row];
            for (int j = 0; j < cols.length; j++) {
                target.myValues[i][j] = source.myValues[row][cols[j]];
                target.myMissing[i][j] = source.myMissing[row][cols[j]];
                target.myMask[i][j] = source.myMask[row][cols[j]];
            }
        }
        for (int j = 0; j < cols.length; j++) {
            target.myFeatures[j] = source.myFeatures[cols[j]];
        }

        if (!EntryFeatureMatrixValidator.checkDimensions(result)) {
            throw new IllegalStateException("EntryFeatureMatrixSlicer: slice: error slicing the " + matrix.kind() + ".");
        }

        myLogger.debug("slice: " + matrix + " to " + result);
        return result;

    }

    /**
     * Keeps only entries and features whose mask is true in every cell of
     * their row or column. Both decisions are made on the full mask, so an
     * entry is dropped for a false cell in a feature that is itself dropped.
     *
     * @param matrix source matrix
     *
     * @return new matrix without masked entries and features
     */
    public static <M extends EntryFeatureMatrix<M>> M filter(M matrix) {

        EntryFeatureMatrixValidator.validate(matrix, "EntryFeatureMatrixSlicer: filter");

        int numEntries = matrix.numberOfEntries();
        int numFeatures = matrix.numberOfFeatures();
        boolean[][] mask = ((EntryFeatureMatrix<M>) matrix).myMask;

        int[] keepEntries = IntStream.range(0, numEntries)
                .filter(i -> IntStream.range(0, numFeatures).allMatch(j -> mask[i][j]))
                .toArray();
        int[] keepFeatures = IntStream.range(0, numFeatures)
                .filter(j -> IntStream.range(0, numEntries).allMatch(i -> mask[i][j]))
                .toArray();

        if ((numEntries > 0 && keepEntries.length == 0) || (numFeatures > 0 && keepFeatures.length == 0)) {
            myLogger.warn("filter: mask removes every " + (keepEntries.length == 0 ? "entry" : "feature") + " of " + matrix);
        }

        return slice(matrix, keepEntries, keepFeatures);

    }

    private static int[] normalizeIndices(int[] indices, int size, String axis) {
        if (indices == null) {
            return IntStream.range(0, size).toArray();
        }
        for (int index : indices) {
            if (index < 0 || index >= size) {
                throw new IllegalArgumentException("EntryFeatureMatrixSlicer: slice: " + axis + " index: " + index + " outside range 0 to " + (size - 1) + ".");
            }
        }
        return Arrays.stream(indices).distinct().sorted().toArray();
    }

}
