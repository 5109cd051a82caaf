/*
 *  MergeMatricesPlugin
 */
package net.genomicbreeding.analysis.data;

import java.util.List;

import com.google.common.collect.Range;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.matrix.EntryFeatureMatrixMerger;
import net.genomicbreeding.phenotype.Phenomes;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;
import net.genomicbreeding.plugindef.PluginParameter;

/**
 * Merges two Genomes or two Phenomes, resolving conflicting cells with a
 * weighted sum.
 */
public class MergeMatricesPlugin extends AbstractPlugin {

    private PluginParameter<Double> myWeightFirst = new PluginParameter.Builder<>("weightFirst", EntryFeatureMatrixMerger.DEFAULT_WEIGHT, Double.class)
            .range(Range.closed(0.0, 1.0))
            .description("Weight of the first data set in conflicting cells.")
            .build();

    private PluginParameter<Double> myWeightSecond = new PluginParameter.Builder<>("weightSecond", null, Double.class)
            .range(Range.closed(0.0, 1.0))
            .description("Weight of the second data set in conflicting cells. 1 - weightFirst if not set.")
            .build();

    @Override
    protected void preProcessParameters(DataSet input) {
        List<Datum> matrices = input == null ? null : input.getDataOfType(EntryFeatureMatrix.class);
        if (matrices == null || matrices.size() != 2) {
            throw new IllegalArgumentException("MergeMatricesPlugin: preProcessParameters: please select exactly two Genomes or two Phenomes.");
        }
        if (matrices.get(0).getData().getClass() != matrices.get(1).getData().getClass()) {
            throw new IllegalArgumentException("MergeMatricesPlugin: preProcessParameters: can't merge " + matrices.get(0).getName() + " with " + matrices.get(1).getName() + ": different kinds of data.");
        }
        if (weightFirst() == null) {
            throw new IllegalArgumentException("MergeMatricesPlugin: preProcessParameters: weightFirst must be defined.");
        }
    }

    @Override
    public DataSet processData(DataSet input) {

        List<Datum> matrices = input.getDataOfType(EntryFeatureMatrix.class);
        Datum first = matrices.get(0);
        Datum second = matrices.get(1);

        Object merged;
        if (first.getData() instanceof Phenomes) {
            merged = EntryFeatureMatrixMerger.merge((Phenomes) first.getData(), (Phenomes) second.getData(), weightFirst(), weightSecond());
        } else if (first.getData() instanceof Genomes) {
            merged = EntryFeatureMatrixMerger.merge((Genomes) first.getData(), (Genomes) second.getData(), weightFirst(), weightSecond());
        } else {
            throw new IllegalArgumentException("MergeMatricesPlugin: processData: can't merge: " + first.getName());
        }

        String name = first.getName() + "_" + second.getName();
        return new DataSet(new Datum(name, merged, "Merge of " + first.getName() + " and " + second.getName()), this);

    }

    public Double weightFirst() {
        return myWeightFirst.value();
    }

    public MergeMatricesPlugin weightFirst(Double value) {
        myWeightFirst = new PluginParameter<>(myWeightFirst, value);
        return this;
    }

    /**
     * @return weight of the second data set, derived from the first if not
     * set, or null if neither is set
     */
    public Double weightSecond() {
        if (!myWeightSecond.isEmpty()) {
            return myWeightSecond.value();
        }
        Double first = weightFirst();
        return first == null ? null : 1.0 - first;
    }

    public MergeMatricesPlugin weightSecond(Double value) {
        myWeightSecond = new PluginParameter<>(myWeightSecond, value);
        return this;
    }

    @Override
    public String getButtonName() {
        return "Merge";
    }

    @Override
    public String getToolTipText() {
        return "Merge two data sets of the same kind";
    }

}
