/*
 *  EntryFeatureMatrix
 */
package net.genomicbreeding.matrix;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import net.genomicbreeding.util.TableReport;
import net.genomicbreeding.util.TableReportBuilder;

/**
 * Entries (rows) by features (columns) matrix of numeric values. Every cell
 * is either missing or holds a double, which may itself be NaN or infinite.
 * Each cell also carries a mask flag that marks it usable for downstream
 * analyses independently of whether it is missing.
 * <p>
 * Storage is populated by assignment. The whole-array setters copy their
 * arguments and may leave the matrix inconsistent, which
 * {@link EntryFeatureMatrixValidator#checkDimensions(EntryFeatureMatrix)}
 * reports. Operations in this package never mutate their inputs.
 *
 * @param <M> the concrete matrix type, so operations return the type they
 * were given
 */
public abstract class EntryFeatureMatrix<M extends EntryFeatureMatrix<M>> {

    protected String[] myEntries;
    protected String[] myPopulations;
    protected String[] myFeatures;
    protected double[][] myValues;
    protected boolean[][] myMissing;
    protected boolean[][] myMask;

    /**
     * Allocates empty storage: names are empty strings, values are missing and
     * the mask is true everywhere.
     *
     * @param numEntries number of entries (rows)
     * @param numFeatures number of features (columns)
     */
    protected EntryFeatureMatrix(int numEntries, int numFeatures) {
        if (numEntries < 0 || numFeatures < 0) {
            throw new IllegalArgumentException("EntryFeatureMatrix: init: dimensions must not be negative: " + numEntries + " x " + numFeatures);
        }
        myEntries = new String[numEntries];
        myPopulations = new String[numEntries];
        myFeatures = new String[numFeatures];
        Arrays.fill(myEntries, "");
        Arrays.fill(myPopulations, "");
        Arrays.fill(myFeatures, "");
        myValues = new double[numEntries][numFeatures];
        myMissing = new boolean[numEntries][numFeatures];
        myMask = new boolean[numEntries][numFeatures];
        for (int i = 0; i < numEntries; i++) {
            Arrays.fill(myValues[i], Double.NaN);
            Arrays.fill(myMissing[i], true);
            Arrays.fill(myMask[i], true);
        }
    }

    /**
     * Creates an empty matrix of this concrete type.
     */
    protected abstract M newInstance(int numEntries, int numFeatures);

    /**
     * Short name of this kind of data, used in messages and table titles.
     */
    public abstract String kind();

    @SuppressWarnings("unchecked")
    protected final M self() {
        return (M) this;
    }

    //
    // Dimensions
    //

    public int numberOfEntries() {
        return myEntries.length;
    }

    public int numberOfFeatures() {
        return myFeatures.length;
    }

    //
    // Names
    //

    public String[] entries() {
        return myEntries.clone();
    }

    public M entries(String[] entries) {
        myEntries = entries.clone();
        return self();
    }

    public String entry(int index) {
        return myEntries[index];
    }

    public String[] populations() {
        return myPopulations.clone();
    }

    public M populations(String[] populations) {
        myPopulations = populations.clone();
        return self();
    }

    public String population(int index) {
        return myPopulations[index];
    }

    public String[] features() {
        return myFeatures.clone();
    }

    public M features(String[] features) {
        myFeatures = features.clone();
        return self();
    }

    public String feature(int index) {
        return myFeatures[index];
    }

    /**
     * @return index of the entry with this name, -1 if absent
     */
    public int entryIndex(String entry) {
        for (int i = 0; i < myEntries.length; i++) {
            if (myEntries[i].equals(entry)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return index of the feature with this name, -1 if absent
     */
    public int featureIndex(String feature) {
        for (int j = 0; j < myFeatures.length; j++) {
            if (myFeatures[j].equals(feature)) {
                return j;
            }
        }
        return -1;
    }

    //
    // Values
    //

    /**
     * @return the value, or NaN when the cell is missing. Use
     * {@link #isMissing(int, int)} to tell a missing cell from a NaN value.
     */
    public double value(int entry, int feature) {
        return myMissing[entry][feature] ? Double.NaN : myValues[entry][feature];
    }

    public boolean isMissing(int entry, int feature) {
        return myMissing[entry][feature];
    }

    /**
     * @return true if the cell holds a value that is neither NaN nor infinite
     */
    public boolean isUsable(int entry, int feature) {
        return !myMissing[entry][feature] && Double.isFinite(myValues[entry][feature]);
    }

    public M setValue(int entry, int feature, double value) {
        myValues[entry][feature] = value;
        myMissing[entry][feature] = false;
        return self();
    }

    public M setMissing(int entry, int feature) {
        myValues[entry][feature] = Double.NaN;
        myMissing[entry][feature] = true;
        return self();
    }

    /**
     * @return copy of the values, missing cells as NaN
     */
    public double[][] values() {
        double[][] result = new double[myValues.length][];
        for (int i = 0; i < myValues.length; i++) {
            result[i] = new double[myValues[i].length];
            for (int j = 0; j < myValues[i].length; j++) {
                result[i][j] = storedAsMissing(i, j) ? Double.NaN : myValues[i][j];
            }
        }
        return result;
    }

    /**
     * Replaces all values. Every cell of the new matrix is present, including
     * NaN ones; mark missing cells afterwards with
     * {@link #setMissing(int, int)} or use {@link #values(double[][], boolean[][])}.
     */
    public M values(double[][] values) {
        boolean[][] missing = new boolean[values.length][];
        for (int i = 0; i < values.length; i++) {
            missing[i] = new boolean[values[i].length];
        }
        return values(values, missing);
    }

    /**
     * Replaces all values along with which of them are missing.
     */
    public M values(double[][] values, boolean[][] missing) {
        myValues = deepCopy(values);
        myMissing = deepCopy(missing);
        return self();
    }

    /**
     * @return copy of the missing indicators
     */
    public boolean[][] missing() {
        return deepCopy(myMissing);
    }

    //
    // Mask
    //

    public boolean mask(int entry, int feature) {
        return myMask[entry][feature];
    }

    public M setMask(int entry, int feature, boolean usable) {
        myMask[entry][feature] = usable;
        return self();
    }

    public boolean[][] mask() {
        return deepCopy(myMask);
    }

    public M mask(boolean[][] mask) {
        myMask = deepCopy(mask);
        return self();
    }

    //
    // Copies, summaries and views
    //

    /**
     * Deep copy sharing no storage with this matrix.
     */
    public M copy() {
        M result = newInstance(0, 0);
        EntryFeatureMatrix<M> target = result;
        target.myEntries = myEntries.clone();
        target.myPopulations = myPopulations.clone();
        target.myFeatures = myFeatures.clone();
        target.myValues = deepCopy(myValues);
        target.myMissing = deepCopy(myMissing);
        target.myMask = deepCopy(myMask);
        return result;
    }

    /**
     * Copy of this matrix with one more feature after the existing ones. Its
     * cells are missing and their mask is true.
     *
     * @param feature name of the new feature
     *
     * @return new matrix
     */
    public M appendFeature(String feature) {
        int numEntries = myEntries.length;
        int numFeatures = myFeatures.length;
        M result = newInstance(numEntries, numFeatures + 1);
        EntryFeatureMatrix<M> target = result;
        target.myEntries = myEntries.clone();
        target.myPopulations = myPopulations.clone();
        target.myFeatures = Arrays.copyOf(myFeatures, numFeatures + 1);
        target.myFeatures[numFeatures] = feature;
        for (int i = 0; i < numEntries; i++) {
            System.arraycopy(myValues[i], 0, target.myValues[i], 0, numFeatures);
            System.arraycopy(myMissing[i], 0, target.myMissing[i], 0, numFeatures);
            System.arraycopy(myMask[i], 0, target.myMask[i], 0, numFeatures);
        }
        return result;
    }

    /**
     * Counts of unique entries, unique populations, features and of total,
     * zero, missing, NaN and infinite cells. Zero, NaN and infinite counts
     * only consider cells that are not missing.
     *
     * @param featureCountKey key used for the number of features
     *
     * @return insertion ordered map of counts
     */
    protected Map<String, Integer> cellCounts(String featureCountKey) {
        EntryFeatureMatrixValidator.validate(this, getClass().getSimpleName() + ": dimensions");
        Map<String, Integer> result = new LinkedHashMap<>();
        result.put("n_entries", (int) Arrays.stream(myEntries).distinct().count());
        result.put("n_populations", (int) Arrays.stream(myPopulations).distinct().count());
        result.put(featureCountKey, myFeatures.length);
        int zeroes = 0;
        int missing = 0;
        int nan = 0;
        int inf = 0;
        for (int i = 0; i < myValues.length; i++) {
            for (int j = 0; j < myValues[i].length; j++) {
                if (myMissing[i][j]) {
                    missing++;
                } else if (Double.isNaN(myValues[i][j])) {
                    nan++;
                } else if (Double.isInfinite(myValues[i][j])) {
                    inf++;
                } else if (myValues[i][j] == 0.0) {
                    zeroes++;
                }
            }
        }
        result.put("n_total", myEntries.length * myFeatures.length);
        result.put("n_zeroes", zeroes);
        result.put("n_missing", missing);
        result.put("n_nan", nan);
        result.put("n_inf", inf);
        return result;
    }

    /**
     * Summary counts of this matrix. Fails if the matrix is not valid.
     */
    public abstract Map<String, Integer> dimensions();

    /**
     * One row per entry with columns id (1 based), entries, populations and
     * one column per feature. Missing cells are null.
     */
    public TableReport tabularise() {
        EntryFeatureMatrixValidator.validate(this, getClass().getSimpleName() + ": tabularise");
        Object[] columnNames = new Object[myFeatures.length + 3];
        columnNames[0] = "id";
        columnNames[1] = "entries";
        columnNames[2] = "populations";
        System.arraycopy(myFeatures, 0, columnNames, 3, myFeatures.length);
        TableReportBuilder builder = TableReportBuilder.getInstance(kind(), columnNames);
        for (int i = 0; i < myEntries.length; i++) {
            Object[] row = new Object[columnNames.length];
            row[0] = i + 1;
            row[1] = myEntries[i];
            row[2] = myPopulations[i];
            for (int j = 0; j < myFeatures.length; j++) {
                row[j + 3] = myMissing[i][j] ? null : Double.valueOf(myValues[i][j]);
            }
            builder.add(row);
        }
        return builder.build();
    }

    /**
     * Structural equality over names, populations, missingness, values and
     * mask. Values compare as {@link Double#equals(Object)} does, so NaN
     * equals NaN. Values of missing cells are not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        EntryFeatureMatrix<?> other = (EntryFeatureMatrix<?>) obj;
        if (!Arrays.equals(myEntries, other.myEntries)
                || !Arrays.equals(myPopulations, other.myPopulations)
                || !Arrays.equals(myFeatures, other.myFeatures)
                || !Arrays.deepEquals(myMissing, other.myMissing)
                || !Arrays.deepEquals(myMask, other.myMask)
                || myValues.length != other.myValues.length) {
            return false;
        }
        for (int i = 0; i < myValues.length; i++) {
            if (myValues[i].length != other.myValues[i].length) {
                return false;
            }
            for (int j = 0; j < myValues[i].length; j++) {
                if (!storedAsMissing(i, j) && Double.compare(myValues[i][j], other.myValues[i][j]) != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(myEntries);
        result = 31 * result + Arrays.hashCode(myPopulations);
        result = 31 * result + Arrays.hashCode(myFeatures);
        result = 31 * result + Arrays.deepHashCode(myMissing);
        result = 31 * result + Arrays.deepHashCode(myMask);
        for (int i = 0; i < myValues.length; i++) {
            for (int j = 0; j < myValues[i].length; j++) {
                if (!storedAsMissing(i, j)) {
                    result = 31 * result + Double.hashCode(myValues[i][j]);
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + myEntries.length + " entries x " + myFeatures.length + " features)";
    }

    // tolerates a missing matrix whose shape disagrees with the values
    private boolean storedAsMissing(int entry, int feature) {
        return entry < myMissing.length && feature < myMissing[entry].length && myMissing[entry][feature];
    }

    static double[][] deepCopy(double[][] source) {
        double[][] result = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }

    static boolean[][] deepCopy(boolean[][] source) {
        boolean[][] result = new boolean[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }

}
