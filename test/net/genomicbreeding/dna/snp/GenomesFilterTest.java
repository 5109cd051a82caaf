/*
 *  GenomesFilterTest
 */
package net.genomicbreeding.dna.snp;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GenomesFilterTest {

    private static final String[] LOCI_ALLELES = {
        "chr1\t100\tA|T\tA",
        "chr1\t200\tC|G\tC",
        "chr2\t100\tA|G\tG"
    };

    private Genomes myGenomes;

    @BeforeEach
    void setUp() {
        myGenomes = new Genomes(4, 3)
                .entries(new String[]{"e1", "e2", "e3", "e4"})
                .populations(new String[]{"p1", "p1", "p2", "p2"})
                .lociAlleles(LOCI_ALLELES)
                .alleleFrequencies(new double[][]{
                    {0.0, 0.5, 1.0},
                    {0.0, 0.5, 1.0},
                    {0.1, 0.0, 0.9},
                    {0.0, 0.0, 0.0}});
        myGenomes.setMissing(2, 1);
        myGenomes.setMissing(3, 0);
        myGenomes.setMissing(3, 1);
        myGenomes.setMissing(3, 2);
    }

    @Test
    void defaultsKeepOnlyCompleteEntriesAndLoci() {
        Genomes filtered = GenomesFilter.getInstance(myGenomes).build();
        assertArrayEquals(new String[]{"e1", "e2"}, filtered.entries());
        assertArrayEquals(LOCI_ALLELES, filtered.lociAlleles());
    }

    @Test
    void minAlleleFrequencyDropsFixedLoci() {
        Genomes filtered = GenomesFilter.filter(myGenomes, 0.05, 0.0, 0.0, null);
        assertArrayEquals(new String[]{"e1", "e2"}, filtered.entries());
        assertArrayEquals(new String[]{LOCI_ALLELES[1]}, filtered.lociAlleles());
        assertEquals(0.5, filtered.value(0, 0));
    }

    @Test
    void locusSparsityIsMeasuredOverKeptEntries() {
        Genomes filtered = GenomesFilter.getInstance(myGenomes).maxEntrySparsity(0.4).build();
        assertArrayEquals(new String[]{"e1", "e2", "e3"}, filtered.entries());
        assertArrayEquals(new String[]{LOCI_ALLELES[0], LOCI_ALLELES[2]}, filtered.lociAlleles());
        assertEquals(0.1, filtered.value(2, 0));
    }

    @Test
    void permissiveThresholdsKeepEverything() {
        Genomes filtered = GenomesFilter.filter(myGenomes, 0.0, 1.0, 0.5, null);
        assertEquals(myGenomes, filtered);
    }

    @Test
    void onlyRequestedLociAllelesAreConsidered() {
        Genomes filtered = GenomesFilter.getInstance(myGenomes)
                .lociAllelesToKeep(Arrays.asList(LOCI_ALLELES[2], "chr9\t1\tA|T\tA"))
                .build();
        assertArrayEquals(new String[]{LOCI_ALLELES[2]}, filtered.lociAlleles());
        assertEquals(2, filtered.numberOfEntries());
    }

    @Test
    void noRequestedLociAllelesLeavesNothing() {
        Genomes filtered = GenomesFilter.getInstance(myGenomes).lociAllelesToKeep(Collections.emptyList()).build();
        assertEquals(0, filtered.numberOfLociAlleles());
    }

    @Test
    void lociWithoutUsableFrequenciesAreDropped() {
        Genomes filtered = GenomesFilter.filter(myGenomes, 0.0, 1.0, 1.0, null);
        assertEquals(4, filtered.numberOfEntries());
        assertEquals(3, filtered.numberOfLociAlleles());

        Genomes allMissing = myGenomes.copy();
        for (int i = 0; i < 4; i++) {
            allMissing.setMissing(i, 0);
        }
        Genomes result = GenomesFilter.filter(allMissing, 0.0, 1.0, 1.0, null);
        assertArrayEquals(new String[]{LOCI_ALLELES[1], LOCI_ALLELES[2]}, result.lociAlleles());
    }

    @Test
    void inputIsNotModified() {
        Genomes before = myGenomes.copy();
        GenomesFilter.filter(myGenomes, 0.1, 0.5, 0.5, null);
        assertEquals(before, myGenomes);
    }

    @Test
    void thresholdsAreRangeChecked() {
        GenomesFilter filter = GenomesFilter.getInstance(myGenomes);
        assertThrows(IllegalArgumentException.class, () -> filter.minAlleleFrequency(0.6));
        assertThrows(IllegalArgumentException.class, () -> filter.minAlleleFrequency(-0.1));
        assertThrows(IllegalArgumentException.class, () -> filter.maxEntrySparsity(1.1));
        assertThrows(IllegalArgumentException.class, () -> filter.maxLocusSparsity(Double.NaN));
    }

    @Test
    void corruptedGenomesAreRejected() {
        myGenomes.populations(new String[]{"p1"});
        assertThrows(IllegalArgumentException.class, () -> GenomesFilter.getInstance(myGenomes).build());
    }

}
