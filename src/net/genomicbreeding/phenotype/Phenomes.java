/*
 *  Phenomes
 */
package net.genomicbreeding.phenotype;

import java.util.Map;

import net.genomicbreeding.matrix.EntryFeatureMatrix;

/**
 * Phenotype data: entries by traits, each cell a numeric phenotype value that
 * may be missing.
 */
public class Phenomes extends EntryFeatureMatrix<Phenomes> {

    /**
     * @param numEntries number of entries
     * @param numTraits number of traits
     */
    public Phenomes(int numEntries, int numTraits) {
        super(numEntries, numTraits);
    }

    @Override
    protected Phenomes newInstance(int numEntries, int numFeatures) {
        return new Phenomes(numEntries, numFeatures);
    }

    @Override
    public String kind() {
        return "Phenomes";
    }

    public int numberOfTraits() {
        return numberOfFeatures();
    }

    public String[] traits() {
        return features();
    }

    public Phenomes traits(String[] traits) {
        return features(traits);
    }

    public String trait(int index) {
        return feature(index);
    }

    public double[][] phenotypes() {
        return values();
    }

    public Phenomes phenotypes(double[][] phenotypes) {
        return values(phenotypes);
    }

    public Phenomes phenotypes(double[][] phenotypes, boolean[][] missing) {
        return values(phenotypes, missing);
    }

    /**
     * Counts of unique entries (n_entries), unique populations
     * (n_populations), traits (n_traits) and of total, zero, missing, NaN and
     * infinite cells.
     */
    @Override
    public Map<String, Integer> dimensions() {
        return cellCounts("n_traits");
    }

}
