/*
 *  EntryFeatureMatrixMergerTest
 */
package net.genomicbreeding.matrix;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.phenotype.Phenomes;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryFeatureMatrixMergerTest {

    @Test
    void mergingWithItselfChangesNothing() {
        Phenomes phenomes = MatrixFixtures.phenomes(5, 3);
        phenomes.setMissing(0, 1);
        phenomes.setValue(1, 1, Double.NaN);
        phenomes.setMask(2, 2, false);
        Phenomes merged = EntryFeatureMatrixMerger.merge(phenomes, phenomes);
        assertEquals(phenomes, merged);
    }

    @Test
    void overlappingSlicesMergeBackToTheUnion() {
        Phenomes source = MatrixFixtures.phenomes(10, 3);
        Phenomes first = EntryFeatureMatrixSlicer.slice(source, IntStream.range(0, 7).toArray(), new int[]{0, 1});
        Phenomes second = EntryFeatureMatrixSlicer.slice(source, IntStream.range(4, 10).toArray(), new int[]{1, 2});

        Phenomes merged = EntryFeatureMatrixMerger.merge(first, second);

        assertEquals(10, merged.numberOfEntries());
        assertEquals(3, merged.numberOfTraits());
        assertArrayEquals(source.entries(), merged.entries());
        assertArrayEquals(source.traits(), merged.traits());
        assertTrue(EntryFeatureMatrixValidator.checkDimensions(merged));

        int numMissing = 0;
        for (int i = 0; i < 10; i++) {
            for (int j = 0; j < 3; j++) {
                if (merged.isMissing(i, j)) {
                    numMissing++;
                    assertFalse(merged.mask(i, j));
                } else {
                    assertEquals(source.value(i, j), merged.value(i, j));
                    assertTrue(merged.mask(i, j));
                }
            }
        }
        // entries 1-4 lack trait 3 and entries 8-10 lack trait 1
        assertEquals(7, numMissing);
        assertEquals(7, merged.dimensions().get("n_missing"));
    }

    @Test
    void entriesAndFeaturesAreTheUnionInFirstThenSecondOrder() {
        Phenomes first = MatrixFixtures.phenomes(3, 2).entries(new String[]{"c", "a", "b"}).traits(new String[]{"y", "x"});
        Phenomes second = MatrixFixtures.phenomes(3, 2).entries(new String[]{"d", "a", "e"}).traits(new String[]{"z", "y"});
        Phenomes merged = EntryFeatureMatrixMerger.merge(first, second);

        assertArrayEquals(new String[]{"c", "a", "b", "d", "e"}, merged.entries());
        assertArrayEquals(new String[]{"y", "x", "z"}, merged.traits());
        Set<String> union = new HashSet<>(Arrays.asList(first.entries()));
        union.addAll(Arrays.asList(second.entries()));
        assertEquals(union, new HashSet<>(Arrays.asList(merged.entries())));
    }

    @Test
    void conflictingValuesAreWeighted() {
        Phenomes first = MatrixFixtures.phenomes(2, 1);
        Phenomes second = MatrixFixtures.phenomes(2, 1);
        first.setValue(0, 0, 10.0);
        second.setValue(0, 0, 20.0);

        Phenomes merged = EntryFeatureMatrixMerger.merge(first, second, 0.75, 0.25);
        assertEquals(12.5, merged.value(0, 0), 1e-12);
        assertEquals(first.value(1, 0), merged.value(1, 0));
        assertTrue(merged.mask(0, 0));

        Phenomes fromArray = EntryFeatureMatrixMerger.merge(first, second, new double[]{0.25, 0.75});
        assertEquals(17.5, fromArray.value(0, 0), 1e-12);
    }

    @Test
    void presentValueWinsOverMissing() {
        Phenomes first = MatrixFixtures.phenomes(2, 2);
        Phenomes second = MatrixFixtures.phenomes(2, 2);
        first.setMissing(0, 0);
        second.setValue(0, 0, 42.0);
        second.setMissing(1, 1);

        Phenomes merged = EntryFeatureMatrixMerger.merge(first, second);
        assertFalse(merged.isMissing(0, 0));
        assertEquals(42.0, merged.value(0, 0));
        assertFalse(merged.isMissing(1, 1));
        assertEquals(first.value(1, 1), merged.value(1, 1));
    }

    @Test
    void conflictMaskIsRoundedHalfToEven() {
        Phenomes first = MatrixFixtures.phenomes(1, 1);
        Phenomes second = MatrixFixtures.phenomes(1, 1);
        first.setValue(0, 0, 1.0);
        second.setValue(0, 0, 2.0);
        first.setMask(0, 0, true);
        second.setMask(0, 0, false);

        assertFalse(EntryFeatureMatrixMerger.merge(first, second, 0.5, 0.5).mask(0, 0));
        assertTrue(EntryFeatureMatrixMerger.merge(first, second, 0.75, 0.25).mask(0, 0));
        assertFalse(EntryFeatureMatrixMerger.merge(first, second, 0.25, 0.75).mask(0, 0));
    }

    @Test
    void equalCellsKeepTheFirstMask() {
        Phenomes first = MatrixFixtures.phenomes(1, 1);
        Phenomes second = MatrixFixtures.phenomes(1, 1);
        first.setMask(0, 0, false);
        assertFalse(EntryFeatureMatrixMerger.merge(first, second).mask(0, 0));
        assertTrue(EntryFeatureMatrixMerger.merge(second, first).mask(0, 0));
    }

    @Test
    void conflictingPopulationsAreMarked() {
        Genomes first = MatrixFixtures.genomes(2, 2).populations(new String[]{"popA", "same"});
        Genomes second = MatrixFixtures.genomes(2, 2).populations(new String[]{"popB", "same"});
        Genomes merged = EntryFeatureMatrixMerger.merge(first, second);
        assertEquals("CONFLICT (popA, popB)", merged.population(0));
        assertEquals("same", merged.population(1));
    }

    @Test
    void invalidWeightsAreRejected() {
        Phenomes phenomes = MatrixFixtures.phenomes(2, 2);
        assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(phenomes, phenomes, 0.5, 0.6));
        assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(phenomes, phenomes, -0.5, 1.5));
        assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(phenomes, phenomes, Double.NaN, 0.5));
        assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(phenomes, phenomes, new double[]{1.0}));
        assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(phenomes, phenomes, new double[]{0.5, 0.25, 0.25}));
    }

    @Test
    void corruptedInputsAreNamed() {
        Phenomes valid = MatrixFixtures.phenomes(2, 2);
        Phenomes corrupted = MatrixFixtures.phenomes(2, 2).entries(new String[]{"a", "a"});

        IllegalArgumentException first = assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(corrupted, valid));
        assertTrue(first.getMessage().contains("first"));
        IllegalArgumentException second = assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(valid, corrupted));
        assertTrue(second.getMessage().contains("second"));
        IllegalArgumentException both = assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixMerger.merge(corrupted, corrupted));
        assertTrue(both.getMessage().contains("both"));
    }

}
