/*
 *  CompositeFeature
 */
package net.genomicbreeding.analysis.numericaltransform;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import net.genomicbreeding.formula.Formula;
import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.matrix.EntryFeatureMatrixValidator;

/**
 * Derives a feature from existing ones with an arithmetic formula evaluated
 * per entry. Variables of the formula are feature names.
 */
public final class CompositeFeature {

    private static final Logger myLogger = Logger.getLogger(CompositeFeature.class);

    private CompositeFeature() {
        // utility
    }

    /**
     * Adds or replaces a feature computed from a formula. The result for an
     * entry is missing if any feature the formula refers to is missing for
     * that entry. The new feature is appended if its name is new, otherwise
     * the existing feature is overwritten in place. Its mask is true for
     * every entry.
     *
     * @param matrix source matrix, not modified
     * @param name name of the derived feature
     * @param formula formula over feature names, e.g.
     * {@code log10(yield) * 2 + sqrt(`plant height`)}
     *
     * @return new matrix with the derived feature
     *
     * @throws IllegalArgumentException if the matrix is not consistent, the
     * formula is malformed or refers to an unknown feature
     */
    public static <M extends EntryFeatureMatrix<M>> M add(M matrix, String name, String formula) {

        EntryFeatureMatrixValidator.validate(matrix, "CompositeFeature: add");
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("CompositeFeature: add: name of the new feature must not be empty.");
        }

        Formula parsed = Formula.parse(formula);

        Map<String, Integer> columns = new HashMap<>();
        List<String> unknown = new ArrayList<>();
        for (String variable : parsed.variables()) {
            int column = matrix.featureIndex(variable);
            if (column < 0) {
                unknown.add(variable);
            } else {
                columns.put(variable, column);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("CompositeFeature: add: formula: " + formula + " refers to unknown features: " + unknown);
        }

        List<Integer> matches = new ArrayList<>();
        for (int j = 0; j < matrix.numberOfFeatures(); j++) {
            if (matrix.feature(j).equals(name)) {
                matches.add(j);
            }
        }

        M result;
        int target;
        if (matches.isEmpty()) {
            result = matrix.appendFeature(name);
            target = matrix.numberOfFeatures();
        } else if (matches.size() == 1) {
            result = matrix.copy();
            target = matches.get(0);
        } else {
            throw new IllegalStateException("CompositeFeature: add: more than one feature named: " + name);
        }

        int numMissing = 0;
        for (int i = 0; i < matrix.numberOfEntries(); i++) {
            final int entry = i;
            boolean anyMissing = columns.values().stream().anyMatch(j -> matrix.isMissing(entry, j));
            if (anyMissing) {
                result.setMissing(i, target);
                numMissing++;
            } else {
                result.setValue(i, target, parsed.evaluate(variable -> matrix.value(entry, columns.get(variable))));
            }
            result.setMask(i, target, true);
        }

        if (!EntryFeatureMatrixValidator.checkDimensions(result)) {
            throw new IllegalStateException("CompositeFeature: add: error adding " + name + " to the " + matrix.kind() + ".");
        }

        myLogger.info("add: " + name + " = " + formula + " (" + (matches.isEmpty() ? "appended" : "replaced") + ", " + numMissing + " missing)");
        return result;

    }

}
