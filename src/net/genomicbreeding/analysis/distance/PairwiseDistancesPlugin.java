/*
 *  PairwiseDistancesPlugin
 */
package net.genomicbreeding.analysis.distance;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;

import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;
import net.genomicbreeding.plugindef.PluginParameter;

/**
 * Pairwise distances between features and between entries of every Genomes
 * and Phenomes in the input.
 */
public class PairwiseDistancesPlugin extends AbstractPlugin {

    private static final Splitter METRIC_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private PluginParameter<String> myMetrics = new PluginParameter.Builder<>("metrics", "euclidean,correlation,mad,rmsd,chi_square", String.class)
            .description("Comma separated distance metrics. Choose from: " + DistanceMetric.recognisedNames())
            .build();

    private PluginParameter<Boolean> myStandardize = new PluginParameter.Builder<>("standardize", false, Boolean.class)
            .description("Standardize each feature to mean 0 and standard deviation 1 first.")
            .build();

    private List<DistanceMetric> myResolvedMetrics = null;

    @Override
    protected void preProcessParameters(DataSet input) {
        if (input == null || input.getDataOfType(EntryFeatureMatrix.class).isEmpty()) {
            throw new IllegalArgumentException("PairwiseDistancesPlugin: preProcessParameters: please select Genomes or Phenomes.");
        }
        myResolvedMetrics = DistanceMetric.resolve(METRIC_SPLITTER.splitToList(myMetrics.isEmpty() ? "" : metrics()));
    }

    @Override
    public DataSet processData(DataSet input) {
        List<Datum> result = new ArrayList<>();
        for (Datum current : input.getDataOfType(EntryFeatureMatrix.class)) {
            DistanceMatrices distances = PairwiseDistances.getInstance((EntryFeatureMatrix<?>) current.getData(), myResolvedMetrics, standardize());
            result.add(new Datum("Distances_" + current.getName(), distances, "Pairwise " + myResolvedMetrics + " of " + current.getName()));
        }
        return new DataSet(result, this);
    }

    /**
     * Convenience method to run plugin with one return object.
     */
    public DistanceMatrices runPlugin(DataSet input) {
        return (DistanceMatrices) performFunction(input).getData(0).getData();
    }

    public String metrics() {
        return myMetrics.value();
    }

    public PairwiseDistancesPlugin metrics(String value) {
        myMetrics = new PluginParameter<>(myMetrics, value);
        return this;
    }

    public Boolean standardize() {
        return myStandardize.value();
    }

    public PairwiseDistancesPlugin standardize(Boolean value) {
        myStandardize = new PluginParameter<>(myStandardize, value);
        return this;
    }

    @Override
    public String getButtonName() {
        return "Pairwise Distances";
    }

    @Override
    public String getToolTipText() {
        return "Distances and correlations between features and between entries";
    }

}
