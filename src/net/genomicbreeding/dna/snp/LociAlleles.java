/*
 *  LociAlleles
 */
package net.genomicbreeding.dna.snp;

import java.util.Arrays;

import com.google.common.base.Splitter;

/**
 * Parsed loci-allele descriptors of a {@link Genomes}, one element per
 * loci-allele in feature order.
 */
public final class LociAlleles {

    private static final Splitter FIELD_SPLITTER = Splitter.on('\t');
    private static final Splitter ALLELE_SPLITTER = Splitter.on('|');

    private final String[] myChromosomes;
    private final int[] myPositions;
    private final String[][] myLocusAlleles;
    private final String[] myAlleles;

    private LociAlleles(String[] chromosomes, int[] positions, String[][] locusAlleles, String[] alleles) {
        myChromosomes = chromosomes;
        myPositions = positions;
        myLocusAlleles = locusAlleles;
        myAlleles = alleles;
    }

    /**
     * Parses the loci-alleles of the given genomes.
     *
     * @throws IllegalArgumentException if a descriptor is malformed
     */
    public static LociAlleles parse(Genomes genomes) {
        return parse(genomes.lociAlleles());
    }

    /**
     * Parses descriptors of the form
     * {@code <chromosome>\t<position>\t<allele>|<allele>...\t<allele>}.
     *
     * @throws IllegalArgumentException if a descriptor is malformed
     */
    public static LociAlleles parse(String[] descriptors) {

        int numLociAlleles = descriptors.length;
        String[] chromosomes = new String[numLociAlleles];
        int[] positions = new int[numLociAlleles];
        String[][] locusAlleles = new String[numLociAlleles][];
        String[] alleles = new String[numLociAlleles];

        for (int i = 0; i < numLociAlleles; i++) {
            String descriptor = descriptors[i];
            if (descriptor == null) {
                throw new IllegalArgumentException("LociAlleles: parse: loci-allele " + i + " is null.");
            }
            String[] fields = FIELD_SPLITTER.splitToList(descriptor).toArray(new String[0]);
            if (fields.length != 4 || fields[0].isEmpty() || fields[2].isEmpty() || fields[3].isEmpty()) {
                throw new IllegalArgumentException("LociAlleles: parse: expected chromosome, position, alleles and allele separated by tabs: " + printable(descriptor));
            }
            chromosomes[i] = fields[0];
            try {
                positions[i] = Integer.parseInt(fields[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("LociAlleles: parse: position is not an integer: " + printable(descriptor), e);
            }
            locusAlleles[i] = ALLELE_SPLITTER.splitToList(fields[2]).toArray(new String[0]);
            alleles[i] = fields[3];
        }

        return new LociAlleles(chromosomes, positions, locusAlleles, alleles);

    }

    private static String printable(String descriptor) {
        return descriptor.replace("\t", "\\t");
    }

    public int numberOfLociAlleles() {
        return myChromosomes.length;
    }

    public String[] chromosomes() {
        return myChromosomes.clone();
    }

    public String chromosome(int index) {
        return myChromosomes[index];
    }

    public int[] positions() {
        return myPositions.clone();
    }

    public int position(int index) {
        return myPositions[index];
    }

    /**
     * @return alleles listed for the locus of this loci-allele
     */
    public String[] locusAlleles(int index) {
        return myLocusAlleles[index].clone();
    }

    /**
     * @return the allele whose frequency this loci-allele holds
     */
    public String allele(int index) {
        return myAlleles[index];
    }

    public String[] alleles() {
        return myAlleles.clone();
    }

    /**
     * @return largest number of alleles listed for any locus, 0 if there are
     * no loci-alleles
     */
    public int maxNumberOfAlleles() {
        return Arrays.stream(myLocusAlleles).mapToInt(a -> a.length).max().orElse(0);
    }

}
