/*
 *  Genomes
 */
package net.genomicbreeding.dna.snp;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import net.genomicbreeding.matrix.EntryFeatureMatrix;

/**
 * Genotype data: entries by loci-alleles, each cell the frequency of one
 * allele of one locus in that entry, which may be missing. Loci-alleles are
 * named by descriptors of the form
 * {@code <chromosome>\t<position>\t<allele>|<allele>...\t<allele>}.
 *
 * @see LociAlleles
 * @see Loci
 */
public class Genomes extends EntryFeatureMatrix<Genomes> {

    /**
     * @param numEntries number of entries
     * @param numLociAlleles number of loci-alleles
     */
    public Genomes(int numEntries, int numLociAlleles) {
        super(numEntries, numLociAlleles);
    }

    @Override
    protected Genomes newInstance(int numEntries, int numFeatures) {
        return new Genomes(numEntries, numFeatures);
    }

    @Override
    public String kind() {
        return "Genomes";
    }

    public int numberOfLociAlleles() {
        return numberOfFeatures();
    }

    public String[] lociAlleles() {
        return features();
    }

    public Genomes lociAlleles(String[] lociAlleles) {
        return features(lociAlleles);
    }

    public String locusAllele(int index) {
        return feature(index);
    }

    public double[][] alleleFrequencies() {
        return values();
    }

    public Genomes alleleFrequencies(double[][] alleleFrequencies) {
        return values(alleleFrequencies);
    }

    public Genomes alleleFrequencies(double[][] alleleFrequencies, boolean[][] missing) {
        return values(alleleFrequencies, missing);
    }

    /**
     * Counts of unique entries (n_entries), unique populations
     * (n_populations), loci-alleles (n_loci_alleles), chromosomes (n_chr),
     * loci (n_loci), the largest number of alleles listed for a locus
     * (max_n_alleles) and of total, zero, missing, NaN and infinite cells.
     *
     * @throws IllegalArgumentException if the genomes are not consistent or a
     * loci-allele descriptor is malformed
     */
    @Override
    public Map<String, Integer> dimensions() {

        Map<String, Integer> cells = cellCounts("n_loci_alleles");
        LociAlleles lociAlleles = LociAlleles.parse(this);
        Loci loci = Loci.of(lociAlleles);

        Map<String, Integer> result = new LinkedHashMap<>();
        result.put("n_entries", cells.remove("n_entries"));
        result.put("n_populations", cells.remove("n_populations"));
        result.put("n_loci_alleles", cells.remove("n_loci_alleles"));
        result.put("n_chr", (int) Arrays.stream(lociAlleles.chromosomes()).distinct().count());
        result.put("n_loci", loci.numberOfLoci());
        result.put("max_n_alleles", lociAlleles.maxNumberOfAlleles());
        result.putAll(cells);
        return result;

    }

}
