/*
 *  GenomesFilter
 */
package net.genomicbreeding.dna.snp;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.log4j.Logger;

import net.genomicbreeding.matrix.EntryFeatureMatrixSlicer;
import net.genomicbreeding.matrix.EntryFeatureMatrixValidator;

/**
 * Filters {@link Genomes} by entry sparsity, then loci-alleles by sparsity
 * over the remaining entries and by mean allele frequency.
 */
public class GenomesFilter {

    private static final Logger myLogger = Logger.getLogger(GenomesFilter.class);

    private final Genomes myBaseGenomes;

    private double myMinAlleleFrequency = 0.0;
    private double myMaxEntrySparsity = 0.0;
    private double myMaxLocusSparsity = 0.0;
    private List<String> myLociAllelesToKeep = null;

    private GenomesFilter(Genomes baseGenomes) {
        myBaseGenomes = baseGenomes;
    }

    public static GenomesFilter getInstance(Genomes baseGenomes) {
        return new GenomesFilter(baseGenomes);
    }

    /**
     * Filters in one call.
     *
     * @param genomes genomes to filter
     * @param maf minimum allele frequency, 0.0 to 0.5
     * @param maxEntrySparsity maximum fraction of missing cells of an entry
     * @param maxLocusSparsity maximum fraction of missing cells of a
     * loci-allele over the kept entries
     * @param lociAllelesToKeep descriptors of loci-alleles to consider, null
     * for all
     *
     * @return filtered genomes
     */
    public static Genomes filter(Genomes genomes, double maf, double maxEntrySparsity, double maxLocusSparsity, List<String> lociAllelesToKeep) {
        return getInstance(genomes)
                .minAlleleFrequency(maf)
                .maxEntrySparsity(maxEntrySparsity)
                .maxLocusSparsity(maxLocusSparsity)
                .lociAllelesToKeep(lociAllelesToKeep)
                .build();
    }

    /**
     * Loci-alleles whose mean frequency is outside [maf, 1 - maf] are removed.
     *
     * @param maf minimum allele frequency (default 0.0)
     *
     * @return this builder
     */
    public GenomesFilter minAlleleFrequency(double maf) {
        if (!(maf >= 0.0 && maf <= 0.5)) {
            throw new IllegalArgumentException("GenomesFilter: minAlleleFrequency: value must be between 0.0 and 0.5: " + maf);
        }
        myMinAlleleFrequency = maf;
        return this;
    }

    /**
     * @param sparsity maximum fraction of missing loci-alleles an entry may
     * have (default 0.0)
     *
     * @return this builder
     */
    public GenomesFilter maxEntrySparsity(double sparsity) {
        if (!(sparsity >= 0.0 && sparsity <= 1.0)) {
            throw new IllegalArgumentException("GenomesFilter: maxEntrySparsity: value must be between 0.0 and 1.0: " + sparsity);
        }
        myMaxEntrySparsity = sparsity;
        return this;
    }

    /**
     * @param sparsity maximum fraction of missing entries a loci-allele may
     * have (default 0.0)
     *
     * @return this builder
     */
    public GenomesFilter maxLocusSparsity(double sparsity) {
        if (!(sparsity >= 0.0 && sparsity <= 1.0)) {
            throw new IllegalArgumentException("GenomesFilter: maxLocusSparsity: value must be between 0.0 and 1.0: " + sparsity);
        }
        myMaxLocusSparsity = sparsity;
        return this;
    }

    /**
     * @param lociAlleles only these loci-alleles are considered, null for all
     *
     * @return this builder
     */
    public GenomesFilter lociAllelesToKeep(List<String> lociAlleles) {
        myLociAllelesToKeep = lociAlleles;
        return this;
    }

    public Genomes build() {

        EntryFeatureMatrixValidator.validate(myBaseGenomes, "GenomesFilter: build");

        int numEntries = myBaseGenomes.numberOfEntries();
        int numLociAlleles = myBaseGenomes.numberOfLociAlleles();

        int[] keepEntries = IntStream.range(0, numEntries)
                .filter(i -> fractionMissing(IntStream.range(0, numLociAlleles).filter(j -> myBaseGenomes.isMissing(i, j)).count(), numLociAlleles) <= myMaxEntrySparsity)
                .toArray();

        boolean[] candidates = new boolean[numLociAlleles];
        if (myLociAllelesToKeep == null) {
            Arrays.fill(candidates, true);
        } else {
            Set<String> requested = new HashSet<>(myLociAllelesToKeep);
            int numFound = 0;
            for (int j = 0; j < numLociAlleles; j++) {
                if (requested.contains(myBaseGenomes.locusAllele(j))) {
                    candidates[j] = true;
                    numFound++;
                }
            }
            if (numFound < requested.size()) {
                myLogger.warn("build: " + (requested.size() - numFound) + " requested loci-alleles are not in " + myBaseGenomes);
            }
        }

        Mean mean = new Mean();
        int[] keepLociAlleles = IntStream.range(0, numLociAlleles)
                .filter(j -> candidates[j])
                .filter(j -> fractionMissing(Arrays.stream(keepEntries).filter(i -> myBaseGenomes.isMissing(i, j)).count(), keepEntries.length) <= myMaxLocusSparsity)
                .filter(j -> {
                    double[] frequencies = Arrays.stream(keepEntries)
                            .filter(i -> myBaseGenomes.isUsable(i, j))
                            .mapToDouble(i -> myBaseGenomes.value(i, j))
                            .toArray();
                    double frequency = mean.evaluate(frequencies);
                    return frequency >= myMinAlleleFrequency && frequency <= 1.0 - myMinAlleleFrequency;
                })
                .toArray();

        Genomes result = EntryFeatureMatrixSlicer.slice(myBaseGenomes, keepEntries, keepLociAlleles);
        if (result.numberOfEntries() == 0 || result.numberOfLociAlleles() == 0) {
            myLogger.warn("build: nothing left after filtering " + myBaseGenomes);
        }
        myLogger.info("build: filtered " + myBaseGenomes + " to " + result);
        return result;

    }

    // no cells counts as fully missing
    private static double fractionMissing(long numMissing, int numCells) {
        return numCells == 0 ? 1.0 : (double) numMissing / numCells;
    }

}
