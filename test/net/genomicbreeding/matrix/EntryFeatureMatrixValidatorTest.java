/*
 *  EntryFeatureMatrixValidatorTest
 */
package net.genomicbreeding.matrix;

import org.junit.jupiter.api.Test;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.phenotype.Phenomes;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryFeatureMatrixValidatorTest {

    @Test
    void populatedMatricesAreValid() {
        assertTrue(EntryFeatureMatrixValidator.checkDimensions(MatrixFixtures.phenomes(5, 3)));
        assertTrue(EntryFeatureMatrixValidator.checkDimensions(MatrixFixtures.genomes(5, 4)));
        assertTrue(EntryFeatureMatrixValidator.checkDimensions(new Phenomes(0, 0)));
    }

    @Test
    void nullIsInvalid() {
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(null));
    }

    @Test
    void duplicateEntriesAreInvalid() {
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2).entries(new String[]{"a", "b", "a"});
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(phenomes));
    }

    @Test
    void duplicateFeaturesAreInvalid() {
        Genomes genomes = MatrixFixtures.genomes(3, 2).lociAlleles(new String[]{"chr1\t1\tA|T\tA", "chr1\t1\tA|T\tA"});
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(genomes));
    }

    @Test
    void populationsMustMatchEntries() {
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2).populations(new String[]{"pop_1", "pop_1"});
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(phenomes));
    }

    @Test
    void valuesMustMatchNames() {
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2).phenotypes(new double[][]{{1.0, 2.0}, {3.0}, {5.0, 6.0}});
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(phenomes));

        Phenomes fewerRows = MatrixFixtures.phenomes(3, 2).phenotypes(new double[][]{{1.0, 2.0}});
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(fewerRows));
    }

    @Test
    void maskMustMatchValues() {
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2).mask(new boolean[][]{{true, true}, {true, true}});
        assertFalse(EntryFeatureMatrixValidator.checkDimensions(phenomes));
    }

    @Test
    void validateThrowsNamingTheCaller() {
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2).entries(new String[]{"a", "a", "b"});
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EntryFeatureMatrixValidator.validate(phenomes, "Caller: method"));
        assertTrue(e.getMessage().startsWith("Caller: method: Phenomes"));
    }

}
