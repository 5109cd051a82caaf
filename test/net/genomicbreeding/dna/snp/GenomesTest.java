/*
 *  GenomesTest
 */
package net.genomicbreeding.dna.snp;

import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.Test;

import net.genomicbreeding.matrix.MatrixFixtures;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenomesTest {

    private static final String[] MULTI_ALLELIC = {
        "chr1\t1\tA|T|C\tA",
        "chr1\t1\tA|T|C\tT",
        "chr1\t2\tG|C\tG",
        "chr2\t1\tA|T\tA"
    };

    @Test
    void dimensionsCountLociAndChromosomes() {
        Genomes genomes = MatrixFixtures.genomes(4, 3);
        genomes.setMissing(3, 1);

        Map<String, Integer> dimensions = genomes.dimensions();

        assertArrayEquals(new String[]{"n_entries", "n_populations", "n_loci_alleles", "n_chr", "n_loci", "max_n_alleles",
            "n_total", "n_zeroes", "n_missing", "n_nan", "n_inf"}, dimensions.keySet().toArray(new String[0]));
        assertEquals(4, dimensions.get("n_entries"));
        assertEquals(2, dimensions.get("n_populations"));
        assertEquals(3, dimensions.get("n_loci_alleles"));
        assertEquals(2, dimensions.get("n_chr"));
        assertEquals(3, dimensions.get("n_loci"));
        assertEquals(2, dimensions.get("max_n_alleles"));
        assertEquals(12, dimensions.get("n_total"));
        assertEquals(2, dimensions.get("n_zeroes"));
        assertEquals(1, dimensions.get("n_missing"));
        assertEquals(0, dimensions.get("n_nan"));
        assertEquals(0, dimensions.get("n_inf"));
    }

    @Test
    void dimensionsOfMultiAllelicLoci() {
        Genomes genomes = new Genomes(2, 4)
                .entries(new String[]{"a", "b"})
                .populations(new String[]{"p", "p"})
                .lociAlleles(MULTI_ALLELIC)
                .alleleFrequencies(new double[][]{{0.5, 0.25, 1.0, 0.0}, {Double.NaN, Double.POSITIVE_INFINITY, 0.0, 1.0}});

        Map<String, Integer> dimensions = genomes.dimensions();
        assertEquals(2, dimensions.get("n_chr"));
        assertEquals(3, dimensions.get("n_loci"));
        assertEquals(3, dimensions.get("max_n_alleles"));
        assertEquals(2, dimensions.get("n_zeroes"));
        assertEquals(1, dimensions.get("n_nan"));
        assertEquals(1, dimensions.get("n_inf"));
        assertEquals(0, dimensions.get("n_missing"));
    }

    @Test
    void dimensionsRejectMalformedDescriptors() {
        Genomes genomes = MatrixFixtures.genomes(2, 2).lociAlleles(new String[]{"chr1\t1\tA|T\tA", "chr1_1_A"});
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, genomes::dimensions);
        assertTrue(e.getMessage().contains("chr1_1_A"));
    }

    @Test
    void parseSplitsDescriptorFields() {
        LociAlleles lociAlleles = LociAlleles.parse(MULTI_ALLELIC);
        assertEquals(4, lociAlleles.numberOfLociAlleles());
        assertArrayEquals(new String[]{"chr1", "chr1", "chr1", "chr2"}, lociAlleles.chromosomes());
        assertArrayEquals(new int[]{1, 1, 2, 1}, lociAlleles.positions());
        assertArrayEquals(new String[]{"A", "T", "C"}, lociAlleles.locusAlleles(1));
        assertEquals("T", lociAlleles.allele(1));
        assertArrayEquals(new String[]{"A", "T", "G", "A"}, lociAlleles.alleles());
        assertEquals(3, lociAlleles.maxNumberOfAlleles());
    }

    @Test
    void parseOfNothing() {
        LociAlleles lociAlleles = LociAlleles.parse(new String[0]);
        assertEquals(0, lociAlleles.numberOfLociAlleles());
        assertEquals(0, lociAlleles.maxNumberOfAlleles());
        assertEquals(0, Loci.of(lociAlleles).numberOfLoci());
    }

    @Test
    void parseRejectsMalformedDescriptors() {
        for (String descriptor : Arrays.asList("chr1\t1\tA|T", "chr1\tone\tA|T\tA", "\t1\tA|T\tA", "chr1\t1\tA|T\tA\textra", "chr1 1 A|T A")) {
            assertThrows(IllegalArgumentException.class, () -> LociAlleles.parse(new String[]{descriptor}), descriptor);
        }
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> LociAlleles.parse(new String[]{"chr1\tone\tA|T\tA"}));
        assertTrue(e.getMessage().contains("chr1\\tone\\tA|T\\tA"));
    }

    @Test
    void lociGroupConsecutiveLociAlleles() {
        Loci loci = Loci.of(LociAlleles.parse(MULTI_ALLELIC));
        assertEquals(3, loci.numberOfLoci());
        assertArrayEquals(new String[]{"chr1", "chr1", "chr2"}, loci.chromosomes());
        assertArrayEquals(new int[]{1, 2, 1}, loci.positions());
        assertArrayEquals(new int[]{0, 2, 3}, loci.startIndices());
        assertArrayEquals(new int[]{1, 2, 3}, loci.endIndices());
        assertEquals(0, loci.startIndex(0));
        assertEquals(1, loci.endIndex(0));
    }

    @Test
    void lociAreNotMergedAcrossRuns() {
        Loci loci = Loci.of(LociAlleles.parse(new String[]{"chr1\t1\tA|T\tA", "chr2\t1\tA|T\tA", "chr1\t1\tA|T\tT"}));
        assertEquals(3, loci.numberOfLoci());
    }

}
