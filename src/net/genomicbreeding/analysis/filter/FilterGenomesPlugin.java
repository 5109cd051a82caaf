/*
 *  FilterGenomesPlugin
 */
package net.genomicbreeding.analysis.filter;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.Range;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.dna.snp.GenomesFilter;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;
import net.genomicbreeding.plugindef.PluginParameter;

/**
 * Filters Genomes by sparsity and minimum allele frequency.
 */
public class FilterGenomesPlugin extends AbstractPlugin {

    private PluginParameter<Double> myMaf = new PluginParameter.Builder<>("maf", 0.0, Double.class)
            .range(Range.closed(0.0, 0.5))
            .description("Minimum allele frequency. Loci-alleles with mean frequency outside [maf, 1 - maf] are removed.")
            .build();

    private PluginParameter<Double> myMaxEntrySparsity = new PluginParameter.Builder<>("maxEntrySparsity", 0.0, Double.class)
            .range(Range.closed(0.0, 1.0))
            .description("Maximum fraction of missing loci-alleles per entry.")
            .build();

    private PluginParameter<Double> myMaxLocusSparsity = new PluginParameter.Builder<>("maxLocusSparsity", 0.0, Double.class)
            .range(Range.closed(0.0, 1.0))
            .description("Maximum fraction of missing entries per loci-allele.")
            .build();

    @Override
    protected void preProcessParameters(DataSet input) {
        if (input == null || input.getDataOfType(Genomes.class).isEmpty()) {
            throw new IllegalArgumentException("FilterGenomesPlugin: preProcessParameters: please select Genomes.");
        }
    }

    @Override
    public DataSet processData(DataSet input) {
        List<Datum> result = new ArrayList<>();
        for (Datum current : input.getDataOfType(Genomes.class)) {
            Genomes filtered = GenomesFilter.getInstance((Genomes) current.getData())
                    .minAlleleFrequency(maf())
                    .maxEntrySparsity(maxEntrySparsity())
                    .maxLocusSparsity(maxLocusSparsity())
                    .build();
            result.add(new Datum("Filtered_" + current.getName(), filtered, "Filtered " + current.getName() + " maf: " + maf()));
        }
        return new DataSet(result, this);
    }

    /**
     * Convenience method to run plugin with one return object.
     */
    public Genomes runPlugin(DataSet input) {
        return (Genomes) performFunction(input).getData(0).getData();
    }

    public Double maf() {
        return myMaf.value();
    }

    public FilterGenomesPlugin maf(Double value) {
        myMaf = new PluginParameter<>(myMaf, value);
        return this;
    }

    public Double maxEntrySparsity() {
        return myMaxEntrySparsity.value();
    }

    public FilterGenomesPlugin maxEntrySparsity(Double value) {
        myMaxEntrySparsity = new PluginParameter<>(myMaxEntrySparsity, value);
        return this;
    }

    public Double maxLocusSparsity() {
        return myMaxLocusSparsity.value();
    }

    public FilterGenomesPlugin maxLocusSparsity(Double value) {
        myMaxLocusSparsity = new PluginParameter<>(myMaxLocusSparsity, value);
        return this;
    }

    @Override
    public String getButtonName() {
        return "Filter Genomes";
    }

    @Override
    public String getToolTipText() {
        return "Filter genomes by sparsity and allele frequency";
    }

}
