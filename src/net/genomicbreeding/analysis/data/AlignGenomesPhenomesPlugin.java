/*
 *  AlignGenomesPhenomesPlugin
 */
package net.genomicbreeding.analysis.data;

import java.util.ArrayList;
import java.util.List;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.phenotype.GenotypePhenotypeMerger;
import net.genomicbreeding.phenotype.Phenomes;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;
import net.genomicbreeding.plugindef.PluginParameter;
import net.genomicbreeding.util.Tuple;

/**
 * Aligns one Genomes with one Phenomes on their entries.
 */
public class AlignGenomesPhenomesPlugin extends AbstractPlugin {

    private PluginParameter<Boolean> myKeepAll = new PluginParameter.Builder<>("keepAll", false, Boolean.class)
            .description("Keep the union of entries. Otherwise only entries in both are kept.")
            .build();

    @Override
    protected void preProcessParameters(DataSet input) {
        if (input == null || input.getDataOfType(Genomes.class).size() != 1 || input.getDataOfType(Phenomes.class).size() != 1) {
            throw new IllegalArgumentException("AlignGenomesPhenomesPlugin: preProcessParameters: please select one Genomes and one Phenomes.");
        }
    }

    @Override
    public DataSet processData(DataSet input) {

        Datum genomes = input.getDataOfType(Genomes.class).get(0);
        Datum phenomes = input.getDataOfType(Phenomes.class).get(0);

        Tuple<Genomes, Phenomes> aligned = GenotypePhenotypeMerger.merge((Genomes) genomes.getData(), (Phenomes) phenomes.getData(), keepAll());

        String join = keepAll() ? "union" : "intersect";
        List<Datum> result = new ArrayList<>();
        result.add(new Datum(genomes.getName() + "_" + join, aligned.x, "Genomes aligned with " + phenomes.getName()));
        result.add(new Datum(phenomes.getName() + "_" + join, aligned.y, "Phenomes aligned with " + genomes.getName()));
        return new DataSet(result, this);

    }

    public Boolean keepAll() {
        return myKeepAll.value();
    }

    public AlignGenomesPhenomesPlugin keepAll(Boolean value) {
        myKeepAll = new PluginParameter<>(myKeepAll, value);
        return this;
    }

    @Override
    public String getButtonName() {
        return "Align Genomes Phenomes";
    }

    @Override
    public String getToolTipText() {
        return "Align genomes and phenomes on their entries";
    }

}
