/*
 *  FilterByMaskPlugin
 */
package net.genomicbreeding.analysis.filter;

import java.util.ArrayList;
import java.util.List;

import net.genomicbreeding.dna.snp.Genomes;
import net.genomicbreeding.matrix.EntryFeatureMatrix;
import net.genomicbreeding.matrix.EntryFeatureMatrixSlicer;
import net.genomicbreeding.phenotype.Phenomes;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;

/**
 * Removes entries and features with any masked out cell.
 */
public class FilterByMaskPlugin extends AbstractPlugin {

    @Override
    protected void preProcessParameters(DataSet input) {
        if (input == null || input.getDataOfType(EntryFeatureMatrix.class).isEmpty()) {
            throw new IllegalArgumentException("FilterByMaskPlugin: preProcessParameters: please select Genomes or Phenomes.");
        }
    }

    @Override
    public DataSet processData(DataSet input) {
        List<Datum> result = new ArrayList<>();
        for (Datum current : input.getDataOfType(EntryFeatureMatrix.class)) {
            Object filtered;
            if (current.getData() instanceof Phenomes) {
                filtered = EntryFeatureMatrixSlicer.filter((Phenomes) current.getData());
            } else if (current.getData() instanceof Genomes) {
                filtered = EntryFeatureMatrixSlicer.filter((Genomes) current.getData());
            } else {
                throw new IllegalArgumentException("FilterByMaskPlugin: processData: can't filter: " + current.getName());
            }
            result.add(new Datum("Filtered_" + current.getName(), filtered, "Masked cells removed from " + current.getName()));
        }
        return new DataSet(result, this);
    }

    @Override
    public String getButtonName() {
        return "Filter By Mask";
    }

    @Override
    public String getToolTipText() {
        return "Remove entries and features with masked cells";
    }

}
