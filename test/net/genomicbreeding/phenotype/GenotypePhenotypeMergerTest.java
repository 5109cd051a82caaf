/*
 *  GenotypePhenotypeMergerTest
 */
package net.genomicbreeding.phenotype;

import org.junit.jupiter.api.Test;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.matrix.EntryFeatureMatrixSlicer;
import net.genomicbreeding.matrix.MatrixFixtures;
import net.genomicbreeding.util.Tuple;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenotypePhenotypeMergerTest {

    @Test
    void intersectKeepsCommonEntriesInGenomesOrder() {
        Genomes genomes = EntryFeatureMatrixSlicer.slice(MatrixFixtures.genomes(6, 3), new int[]{0, 2, 3, 5}, null);
        Phenomes phenomes = EntryFeatureMatrixSlicer.slice(MatrixFixtures.phenomes(6, 2), new int[]{0, 1, 2, 5}, null);

        Tuple<Genomes, Phenomes> aligned = GenotypePhenotypeMerger.merge(genomes, phenomes, false);

        assertArrayEquals(new String[]{"entry_1", "entry_3", "entry_6"}, aligned.x.entries());
        assertArrayEquals(aligned.x.entries(), aligned.y.entries());
        assertArrayEquals(aligned.x.populations(), aligned.y.populations());
        assertArrayEquals(genomes.lociAlleles(), aligned.x.lociAlleles());
        assertArrayEquals(phenomes.traits(), aligned.y.traits());
        assertEquals(genomes.value(0, 2), aligned.x.value(0, 2));
        assertEquals(phenomes.value(3, 1), aligned.y.value(2, 1));
    }

    @Test
    void phenomesOrderDoesNotMatter() {
        Genomes genomes = MatrixFixtures.genomes(3, 2).entries(new String[]{"c", "a", "b"}).populations(new String[]{"p", "p", "p"});
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2).entries(new String[]{"a", "b", "c"}).populations(new String[]{"p", "p", "p"});
        Tuple<Genomes, Phenomes> aligned = GenotypePhenotypeMerger.merge(genomes, phenomes, false);
        assertArrayEquals(new String[]{"c", "a", "b"}, aligned.y.entries());
        assertEquals(phenomes.value(2, 0), aligned.y.value(0, 0));
        assertEquals(genomes, aligned.x);
    }

    @Test
    void unionAppendsPhenomesOnlyEntries() {
        Genomes genomes = EntryFeatureMatrixSlicer.slice(MatrixFixtures.genomes(5, 2), new int[]{0, 1, 2}, null);
        Phenomes phenomes = EntryFeatureMatrixSlicer.slice(MatrixFixtures.phenomes(5, 2), new int[]{1, 3, 4}, null);

        Tuple<Genomes, Phenomes> aligned = new GenotypePhenotypeMerger().genomes(genomes).phenomes(phenomes).union().build();

        assertArrayEquals(new String[]{"entry_1", "entry_2", "entry_3", "entry_4", "entry_5"}, aligned.x.entries());
        assertArrayEquals(aligned.x.entries(), aligned.y.entries());
        assertEquals("pop_2", aligned.x.population(3));
        assertEquals("pop_1", aligned.y.population(4));

        // genomes of phenomes-only entries and phenomes of genomes-only entries are missing
        for (int j = 0; j < 2; j++) {
            assertTrue(aligned.x.isMissing(3, j));
            assertTrue(aligned.x.isMissing(4, j));
            assertTrue(aligned.y.isMissing(0, j));
            assertTrue(aligned.y.isMissing(2, j));
            assertTrue(aligned.x.mask(3, j));
            assertFalse(aligned.x.isMissing(0, j));
            assertFalse(aligned.y.isMissing(1, j));
        }
        assertEquals(phenomes.value(1, 1), aligned.y.value(3, 1));
    }

    @Test
    void masksAreCarriedOver() {
        Genomes genomes = MatrixFixtures.genomes(3, 2);
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2);
        genomes.setMask(1, 1, false);
        phenomes.setMask(2, 0, false);
        phenomes.setMissing(0, 0);

        Tuple<Genomes, Phenomes> aligned = GenotypePhenotypeMerger.merge(genomes, phenomes, false);
        assertEquals(genomes, aligned.x);
        assertEquals(phenomes, aligned.y);
    }

    @Test
    void conflictingPopulationsAreMarked() {
        Genomes genomes = MatrixFixtures.genomes(2, 2).populations(new String[]{"a", "b"});
        Phenomes phenomes = MatrixFixtures.phenomes(2, 2).populations(new String[]{"a", "c"});
        Tuple<Genomes, Phenomes> aligned = GenotypePhenotypeMerger.merge(genomes, phenomes, true);
        assertArrayEquals(new String[]{"a", "CONFLICT (b, c)"}, aligned.x.populations());
        assertArrayEquals(aligned.x.populations(), aligned.y.populations());
    }

    @Test
    void disjointEntriesIntersectToNothing() {
        Genomes genomes = MatrixFixtures.genomes(2, 2);
        Phenomes phenomes = MatrixFixtures.phenomes(2, 2).entries(new String[]{"x", "y"});
        Tuple<Genomes, Phenomes> aligned = GenotypePhenotypeMerger.merge(genomes, phenomes, false);
        assertEquals(0, aligned.x.numberOfEntries());
        assertEquals(0, aligned.y.numberOfEntries());
        assertEquals(2, aligned.x.numberOfLociAlleles());
        assertEquals(2, aligned.y.numberOfTraits());
    }

    @Test
    void bothInputsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> new GenotypePhenotypeMerger().genomes(MatrixFixtures.genomes(2, 2)).build());
        assertThrows(IllegalArgumentException.class, () -> new GenotypePhenotypeMerger().phenomes(MatrixFixtures.phenomes(2, 2)).build());
        Phenomes corrupted = MatrixFixtures.phenomes(2, 2).traits(new String[]{"t", "t"});
        assertThrows(IllegalArgumentException.class, () -> GenotypePhenotypeMerger.merge(MatrixFixtures.genomes(2, 2), corrupted, true));
    }

}
