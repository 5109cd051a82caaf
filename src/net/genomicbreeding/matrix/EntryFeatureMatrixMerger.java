/*
 *  EntryFeatureMatrixMerger
 */
package net.genomicbreeding.matrix;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

/**
 * Union of two entry by feature matrices. Cells present in both sources with
 * different values are resolved with a pair of weights.
 */
public final class EntryFeatureMatrixMerger {

    private static final Logger myLogger = Logger.getLogger(EntryFeatureMatrixMerger.class);

    public static final double DEFAULT_WEIGHT = 0.5;

    private static final double WEIGHT_SUM_TOLERANCE = 1e-12;

    private EntryFeatureMatrixMerger() {
        // utility
    }

    /**
     * Merges with equal conflict resolution weights.
     */
    public static <M extends EntryFeatureMatrix<M>> M merge(M first, M second) {
        return merge(first, second, DEFAULT_WEIGHT, DEFAULT_WEIGHT);
    }

    /**
     * Merges with conflict resolution weights given as an array, which must
     * hold exactly two weights.
     */
    public static <M extends EntryFeatureMatrix<M>> M merge(M first, M second, double[] conflictResolution) {
        if (conflictResolution == null || conflictResolution.length != 2) {
            throw new IllegalArgumentException("EntryFeatureMatrixMerger: merge: conflict resolution must be two weights summing to 1.0.");
        }
        return merge(first, second, conflictResolution[0], conflictResolution[1]);
    }

    /**
     * Merges two matrices. The result holds the union of entries and of
     * features: those of the first matrix in its order followed by those only
     * in the second, in its order.
     * <p>
     * For each cell: if only one source has it, its value and mask are copied.
     * If both have it with equal values (or both missing), the first source
     * wins. Otherwise two present values are combined as
     * {@code firstWeight * a + secondWeight * b}, a single present value is
     * kept, and the mask is the weighted mask rounded half to even. Cells
     * whose entry and feature come from different sources are missing and
     * masked out.
     * <p>
     * Populations that disagree are replaced by
     * {@code CONFLICT (<first>, <second>)}.
     *
     * @param first first matrix
     * @param second second matrix
     * @param firstWeight weight of the first matrix in conflicts
     * @param secondWeight weight of the second matrix in conflicts
     *
     * @return new merged matrix
     */
    public static <M extends EntryFeatureMatrix<M>> M merge(M first, M second, double firstWeight, double secondWeight) {

        boolean firstValid = EntryFeatureMatrixValidator.checkDimensions(first);
        boolean secondValid = EntryFeatureMatrixValidator.checkDimensions(second);
        if (!firstValid && !secondValid) {
            throw new IllegalArgumentException("EntryFeatureMatrixMerger: merge: both structs are corrupted.");
        } else if (!firstValid) {
            throw new IllegalArgumentException("EntryFeatureMatrixMerger: merge: the first " + EntryFeatureMatrixValidator.describe(first) + " is corrupted.");
        } else if (!secondValid) {
            throw new IllegalArgumentException("EntryFeatureMatrixMerger: merge: the second " + EntryFeatureMatrixValidator.describe(second) + " is corrupted.");
        }
        checkWeights(firstWeight, secondWeight);

        EntryFeatureMatrix<M> a = first;
        EntryFeatureMatrix<M> b = second;

        String[] entries = union(a.myEntries, b.myEntries);
        String[] features = union(a.myFeatures, b.myFeatures);

        Map<String, Integer> entriesA = indexOf(a.myEntries);
        Map<String, Integer> entriesB = indexOf(b.myEntries);
        Map<String, Integer> featuresA = indexOf(a.myFeatures);
        Map<String, Integer> featuresB = indexOf(b.myFeatures);

        // feature positions in each source, -1 where absent
        int[] colA = new int[features.length];
        int[] colB = new int[features.length];
        for (int j = 0; j < features.length; j++) {
            colA[j] = featuresA.getOrDefault(features[j], -1);
            colB[j] = featuresB.getOrDefault(features[j], -1);
        }

        M result = a.newInstance(entries.length, features.length);
        EntryFeatureMatrix<M> out = result;
        out.myEntries = entries;
        out.myFeatures = features;

        int numPopulationConflicts = 0;
        int numValueConflicts = 0;
        for (int i = 0; i < entries.length; i++) {

            int rowA = entriesA.getOrDefault(entries[i], -1);
            int rowB = entriesB.getOrDefault(entries[i], -1);

            if (rowA >= 0 && rowB >= 0) {
                String popA = a.myPopulations[rowA];
                String popB = b.myPopulations[rowB];
                if (popA.equals(popB)) {
                    out.myPopulations[i] = popA;
                } else {
                    out.myPopulations[i] = "CONFLICT (" + popA + ", " + popB + ")";
                    numPopulationConflicts++;
                }
            } else if (rowA >= 0) {
                out.myPopulations[i] = a.myPopulations[rowA];
            } else {
                out.myPopulations[i] = b.myPopulations[rowB];
            }

            for (int j = 0; j < features.length; j++) {

                boolean inA = rowA >= 0 && colA[j] >= 0;
                boolean inB = rowB >= 0 && colB[j] >= 0;

                if (inA && inB) {
                    boolean missingA = a.myMissing[rowA][colA[j]];
                    boolean missingB = b.myMissing[rowB][colB[j]];
                    double valueA = a.myValues[rowA][colA[j]];
                    double valueB = b.myValues[rowB][colB[j]];
                    boolean maskA = a.myMask[rowA][colA[j]];
                    boolean maskB = b.myMask[rowB][colB[j]];
                    if (sameValue(missingA, valueA, missingB, valueB)) {
                        copyCell(a, rowA, colA[j], out, i, j);
                    } else {
                        numValueConflicts++;
                        if (!missingA && !missingB) {
                            out.myValues[i][j] = firstWeight * valueA + secondWeight * valueB;
                            out.myMissing[i][j] = false;
                        } else if (!missingA) {
                            out.myValues[i][j] = valueA;
                            out.myMissing[i][j] = false;
                        } else {
                            out.myValues[i][j] = valueB;
                            out.myMissing[i][j] = false;
                        }
                        double weightedMask = firstWeight * (maskA ? 1.0 : 0.0) + secondWeight * (maskB ? 1.0 : 0.0);
                        out.myMask[i][j] = Math.rint(weightedMask) == 1.0;
                    }
                } else if (inA) {
                    copyCell(a, rowA, colA[j], out, i, j);
                } else if (inB) {
                    copyCell(b, rowB, colB[j], out, i, j);
                } else {
                    out.myValues[i][j] = Double.NaN;
                    out.myMissing[i][j] = true;
                    out.myMask[i][j] = false;
                }

            }
        }

        if (!EntryFeatureMatrixValidator.checkDimensions(result)) {
            throw new IllegalStateException("EntryFeatureMatrixMerger: merge: error merging the 2 " + first.kind() + " structs.");
        }

        if (numPopulationConflicts > 0) {
            myLogger.warn("merge: " + numPopulationConflicts + " entries have conflicting populations");
        }
        myLogger.info("merge: " + first + " + " + second + " = " + result + ", " + numValueConflicts + " conflicting cells resolved with weights (" + firstWeight + ", " + secondWeight + ")");
        return result;

    }

    private static void checkWeights(double firstWeight, double secondWeight) {
        if (!Double.isFinite(firstWeight) || !Double.isFinite(secondWeight)
                || firstWeight < 0.0 || secondWeight < 0.0
                || Math.abs(firstWeight + secondWeight - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalArgumentException("EntryFeatureMatrixMerger: merge: conflict resolution must be two non-negative weights summing to 1.0: ("
                    + firstWeight + ", " + secondWeight + ")");
        }
    }

    private static boolean sameValue(boolean missingA, double valueA, boolean missingB, double valueB) {
        if (missingA || missingB) {
            return missingA && missingB;
        }
        return Double.compare(valueA, valueB) == 0;
    }

    private static void copyCell(EntryFeatureMatrix<?> from, int fromRow, int fromCol, EntryFeatureMatrix<?> to, int toRow, int toCol) {
        to.myValues[toRow][toCol] = from.myValues[fromRow][fromCol];
        to.myMissing[toRow][toCol] = from.myMissing[fromRow][fromCol];
        to.myMask[toRow][toCol] = from.myMask[fromRow][fromCol];
    }

    static String[] union(String[] first, String[] second) {
        Set<String> result = new LinkedHashSet<>();
        for (String current : first) {
            result.add(current);
        }
        for (String current : second) {
            result.add(current);
        }
        return result.toArray(new String[0]);
    }

    static Map<String, Integer> indexOf(String[] names) {
        Map<String, Integer> result = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            result.put(names[i], i);
        }
        return result;
    }

}
