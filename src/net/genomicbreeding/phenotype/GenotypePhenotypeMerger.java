/*
 *  GenotypePhenotypeMerger
 */
package net.genomicbreeding.phenotype;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.matrix.EntryFeatureMatrixValidator;
import net.genomicbreeding.util.Tuple;

/**
 * Aligns {@link Genomes} and {@link Phenomes} on their entries so both hold
 * the same entries in the same order. Loci-alleles and traits are unchanged.
 */
public class GenotypePhenotypeMerger {

    private static final Logger myLogger = Logger.getLogger(GenotypePhenotypeMerger.class);

    private Genomes myGenomes = null;
    private Phenomes myPhenomes = null;
    private boolean isUnion = false;

    /**
     * @param genomes genomes to align
     * @param phenomes phenomes to align
     * @param keepAll union of entries if true, intersection otherwise
     *
     * @return aligned genomes and phenomes
     */
    public static Tuple<Genomes, Phenomes> merge(Genomes genomes, Phenomes phenomes, boolean keepAll) {
        GenotypePhenotypeMerger merger = new GenotypePhenotypeMerger().genomes(genomes).phenomes(phenomes);
        if (keepAll) {
            merger.union();
        } else {
            merger.intersect();
        }
        return merger.build();
    }

    public GenotypePhenotypeMerger genomes(Genomes genomes) {
        myGenomes = genomes;
        return this;
    }

    public GenotypePhenotypeMerger phenomes(Phenomes phenomes) {
        myPhenomes = phenomes;
        return this;
    }

    /**
     * Keeps every entry: those of the genomes followed by those only in the
     * phenomes. Cells of entries a source lacks are missing.
     *
     * @return this builder
     */
    public GenotypePhenotypeMerger union() {
        isUnion = true;
        return this;
    }

    /**
     * Keeps only entries common to both, in genomes order. This is the
     * default.
     *
     * @return this builder
     */
    public GenotypePhenotypeMerger intersect() {
        isUnion = false;
        return this;
    }

    public Tuple<Genomes, Phenomes> build() {

        if (myGenomes == null) {
            throw new IllegalArgumentException("GenotypePhenotypeMerger: build: no genomes were specified.");
        }
        if (myPhenomes == null) {
            throw new IllegalArgumentException("GenotypePhenotypeMerger: build: no phenomes were specified.");
        }
        EntryFeatureMatrixValidator.validate(myGenomes, "GenotypePhenotypeMerger: build");
        EntryFeatureMatrixValidator.validate(myPhenomes, "GenotypePhenotypeMerger: build");

        List<String> entries = new ArrayList<>();
        if (isUnion) {
            Set<String> all = new LinkedHashSet<>();
            for (String entry : myGenomes.entries()) {
                all.add(entry);
            }
            for (String entry : myPhenomes.entries()) {
                all.add(entry);
            }
            entries.addAll(all);
        } else {
            Set<String> inPhenomes = new LinkedHashSet<>();
            for (String entry : myPhenomes.entries()) {
                inPhenomes.add(entry);
            }
            for (String entry : myGenomes.entries()) {
                if (inPhenomes.contains(entry)) {
                    entries.add(entry);
                }
            }
        }

        int numEntries = entries.size();
        String[] entryNames = entries.toArray(new String[0]);
        String[] populations = new String[numEntries];
        Genomes genomes = new Genomes(numEntries, myGenomes.numberOfLociAlleles());
        Phenomes phenomes = new Phenomes(numEntries, myPhenomes.numberOfTraits());

        Map<String, Integer> genomesRows = indexOf(myGenomes.entries());
        Map<String, Integer> phenomesRows = indexOf(myPhenomes.entries());

        int numConflicts = 0;
        for (int i = 0; i < numEntries; i++) {
            int genomesRow = genomesRows.getOrDefault(entryNames[i], -1);
            int phenomesRow = phenomesRows.getOrDefault(entryNames[i], -1);
            if (genomesRow >= 0 && phenomesRow >= 0) {
                String genomesPopulation = myGenomes.population(genomesRow);
                String phenomesPopulation = myPhenomes.population(phenomesRow);
                if (genomesPopulation.equals(phenomesPopulation)) {
                    populations[i] = genomesPopulation;
                } else {
                    populations[i] = "CONFLICT (" + genomesPopulation + ", " + phenomesPopulation + ")";
                    numConflicts++;
                }
            } else if (genomesRow >= 0) {
                populations[i] = myGenomes.population(genomesRow);
            } else {
                populations[i] = myPhenomes.population(phenomesRow);
            }
            if (genomesRow >= 0) {
                copyRow(myGenomes, genomesRow, genomes, i);
            }
            if (phenomesRow >= 0) {
                copyRow(myPhenomes, phenomesRow, phenomes, i);
            }
        }

        genomes.entries(entryNames).populations(populations).lociAlleles(myGenomes.lociAlleles());
        phenomes.entries(entryNames).populations(populations).traits(myPhenomes.traits());

        if (!EntryFeatureMatrixValidator.checkDimensions(genomes) || !EntryFeatureMatrixValidator.checkDimensions(phenomes)) {
            throw new IllegalStateException("GenotypePhenotypeMerger: build: error aligning " + myGenomes + " with " + myPhenomes + ".");
        }

        if (numConflicts > 0) {
            myLogger.warn("build: " + numConflicts + " entries have conflicting populations");
        }
        myLogger.info("build: " + (isUnion ? "union" : "intersect") + " of " + myGenomes + " and " + myPhenomes + " has " + numEntries + " entries");
        return new Tuple<>(genomes, phenomes);

    }

    private static Map<String, Integer> indexOf(String[] names) {
        Map<String, Integer> result = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            result.put(names[i], i);
        }
        return result;
    }

    private static void copyRow(EntryFeatureMatrix<?> from, int fromRow, EntryFeatureMatrix<?> to, int toRow) {
        for (int j = 0; j < from.numberOfFeatures(); j++) {
            if (from.isMissing(fromRow, j)) {
                to.setMissing(toRow, j);
            } else {
                to.setValue(toRow, j, from.value(fromRow, j));
            }
            to.setMask(toRow, j, from.mask(fromRow, j));
        }
    }

}
