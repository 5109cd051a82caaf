/*
 *  SliceMatrixPlugin
 */
package net.genomicbreeding.analysis.filter;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.matrix.EntryFeatureMatrixSlicer;
import net.genomicbreeding.phenotype.Phenomes;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;
import net.genomicbreeding.plugindef.PluginParameter;

/**
 * Keeps the entries and features at the given indices of every Genomes and
 * Phenomes in the input.
 */
public class SliceMatrixPlugin extends AbstractPlugin {

    private static final Splitter INDEX_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private PluginParameter<String> myEntries = new PluginParameter.Builder<>("entries", null, String.class)
            .description("Comma separated 0 based indices of entries to keep. All entries if not set.")
            .build();

    private PluginParameter<String> myFeatures = new PluginParameter.Builder<>("features", null, String.class)
            .description("Comma separated 0 based indices of features to keep. All features if not set.")
            .build();

    @Override
    protected void preProcessParameters(DataSet input) {
        if (input == null || input.getDataOfType(EntryFeatureMatrix.class).isEmpty()) {
            throw new IllegalArgumentException("SliceMatrixPlugin: preProcessParameters: please select Genomes or Phenomes.");
        }
        parseIndices(myEntries);
        parseIndices(myFeatures);
    }

    @Override
    public DataSet processData(DataSet input) {

        int[] entries = parseIndices(myEntries);
        int[] features = parseIndices(myFeatures);

        List<Datum> result = new ArrayList<>();
        for (Datum current : input.getDataOfType(EntryFeatureMatrix.class)) {
            Object sliced;
            if (current.getData() instanceof Phenomes) {
                sliced = EntryFeatureMatrixSlicer.slice((Phenomes) current.getData(), entries, features);
            } else if (current.getData() instanceof Genomes) {
                sliced = EntryFeatureMatrixSlicer.slice((Genomes) current.getData(), entries, features);
            } else {
                throw new IllegalArgumentException("SliceMatrixPlugin: processData: can't slice: " + current.getName());
            }
            result.add(new Datum("Sliced_" + current.getName(), sliced, "Slice of " + current.getName()));
        }
        return new DataSet(result, this);

    }

    static int[] parseIndices(PluginParameter<String> parameter) {
        if (parameter.isEmpty()) {
            return null;
        }
        List<Integer> result = new ArrayList<>();
        for (String current : INDEX_SPLITTER.split(parameter.value())) {
            try {
                result.add(Integer.valueOf(current));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("SliceMatrixPlugin: parseIndices: " + parameter.cmdLineName() + ": not an index: " + current, e);
            }
        }
        return Ints.toArray(result);
    }

    public String entries() {
        return myEntries.value();
    }

    /**
     * Set Entries. Comma separated 0 based indices of entries to keep.
     *
     * @param value Entries
     *
     * @return this plugin
     */
    public SliceMatrixPlugin entries(String value) {
        myEntries = new PluginParameter<>(myEntries, value);
        return this;
    }

    public String features() {
        return myFeatures.value();
    }

    /**
     * Set Features. Comma separated 0 based indices of features to keep.
     *
     * @param value Features
     *
     * @return this plugin
     */
    public SliceMatrixPlugin features(String value) {
        myFeatures = new PluginParameter<>(myFeatures, value);
        return this;
    }

    @Override
    public String getButtonName() {
        return "Slice";
    }

    @Override
    public String getToolTipText() {
        return "Keep selected entries and features";
    }

}
