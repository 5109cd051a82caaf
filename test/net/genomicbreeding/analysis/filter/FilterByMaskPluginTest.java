/*
 *  FilterByMaskPluginTest
 */
package net.genomicbreeding.analysis.filter;

import org.junit.jupiter.api.Test;

import net.genomicbreeding.matrix.MatrixFixtures;
import net.genomicbreeding.phenotype.Phenomes;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FilterByMaskPluginTest {

    @Test
    void maskedEntriesAndFeaturesAreRemoved() {
        Phenomes phenomes = MatrixFixtures.phenomes(3, 2);
        phenomes.setMask(0, 0, false);

        DataSet result = new FilterByMaskPlugin().performFunction(new DataSet(new Datum("pheno", phenomes, null), null));

        assertEquals("Filtered_pheno", result.getData(0).getName());
        Phenomes filtered = (Phenomes) result.getData(0).getData();
        assertArrayEquals(new String[]{"entry_2", "entry_3"}, filtered.entries());
        assertArrayEquals(new String[]{"trait_2"}, filtered.traits());
        assertEquals(phenomes.value(1, 1), filtered.value(0, 0));
    }

    @Test
    void onlyMatricesAreAccepted() {
        assertThrows(IllegalArgumentException.class, () -> new FilterByMaskPlugin().performFunction(DataSet.getDataSet(1.0)));
        assertThrows(IllegalArgumentException.class, () -> new FilterByMaskPlugin().performFunction(null));
    }

}
