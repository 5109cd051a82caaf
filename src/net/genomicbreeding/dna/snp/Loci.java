/*
 *  Loci
 */
package net.genomicbreeding.dna.snp;

import java.util.ArrayList;
import java.util.List;

import com.google.common.primitives.Ints;

/**
 * Loci of a {@link Genomes}. A locus is a run of consecutive loci-alleles
 * sharing chromosome and position; each locus records the first and last
 * (inclusive) loci-allele index of its run.
 */
public final class Loci {

    private final String[] myChromosomes;
    private final int[] myPositions;
    private final int[] myStartIndices;
    private final int[] myEndIndices;

    private Loci(String[] chromosomes, int[] positions, int[] startIndices, int[] endIndices) {
        myChromosomes = chromosomes;
        myPositions = positions;
        myStartIndices = startIndices;
        myEndIndices = endIndices;
    }

    /**
     * @throws IllegalArgumentException if a loci-allele descriptor is
     * malformed
     */
    public static Loci of(Genomes genomes) {
        return of(LociAlleles.parse(genomes));
    }

    public static Loci of(LociAlleles lociAlleles) {

        List<String> chromosomes = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();

        int numLociAlleles = lociAlleles.numberOfLociAlleles();
        int start = 0;
        for (int i = 1; i <= numLociAlleles; i++) {
            if (i == numLociAlleles
                    || !lociAlleles.chromosome(i).equals(lociAlleles.chromosome(start))
                    || lociAlleles.position(i) != lociAlleles.position(start)) {
                chromosomes.add(lociAlleles.chromosome(start));
                positions.add(lociAlleles.position(start));
                starts.add(start);
                ends.add(i - 1);
                start = i;
            }
        }

        return new Loci(chromosomes.toArray(new String[0]), Ints.toArray(positions), Ints.toArray(starts), Ints.toArray(ends));

    }

    public int numberOfLoci() {
        return myChromosomes.length;
    }

    public String chromosome(int locus) {
        return myChromosomes[locus];
    }

    public String[] chromosomes() {
        return myChromosomes.clone();
    }

    public int position(int locus) {
        return myPositions[locus];
    }

    public int[] positions() {
        return myPositions.clone();
    }

    /**
     * @return index of the first loci-allele of the locus
     */
    public int startIndex(int locus) {
        return myStartIndices[locus];
    }

    /**
     * @return index of the last loci-allele of the locus, inclusive
     */
    public int endIndex(int locus) {
        return myEndIndices[locus];
    }

    public int[] startIndices() {
        return myStartIndices.clone();
    }

    public int[] endIndices() {
        return myEndIndices.clone();
    }

}
