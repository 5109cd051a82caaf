/*
 *  CompositeTraitPlugin
 */
package net.genomicbreeding.analysis.numericaltransform;

import java.util.ArrayList;
import java.util.List;

import net.genomicbreeding.phenotype.Phenomes;
import net.genomicbreeding.plugindef.AbstractPlugin;
import net.genomicbreeding.plugindef.DataSet;
import net.genomicbreeding.plugindef.Datum;
import net.genomicbreeding.plugindef.PluginParameter;

/**
 * Adds a trait computed from other traits to every Phenomes in the input.
 */
public class CompositeTraitPlugin extends AbstractPlugin {

    private PluginParameter<String> myName = new PluginParameter.Builder<>("name", null, String.class)
            .required(true)
            .description("Name of the composite trait. An existing trait of that name is replaced.")
            .build();

    private PluginParameter<String> myFormula = new PluginParameter.Builder<>("formula", null, String.class)
            .required(true)
            .description("Formula over trait names using + - * / % ^, parentheses, abs, sqrt, log, log2 and log10. Quote names with backticks.")
            .build();

    @Override
    protected void preProcessParameters(DataSet input) {
        if (input == null || input.getDataOfType(Phenomes.class).isEmpty()) {
            throw new IllegalArgumentException("CompositeTraitPlugin: preProcessParameters: please select Phenomes.");
        }
    }

    @Override
    public DataSet processData(DataSet input) {
        List<Datum> result = new ArrayList<>();
        for (Datum current : input.getDataOfType(Phenomes.class)) {
            Phenomes phenomes = CompositeFeature.add((Phenomes) current.getData(), name(), formula());
            result.add(new Datum(current.getName() + "_" + name(), phenomes, name() + " = " + formula()));
        }
        return new DataSet(result, this);
    }

    /**
     * Convenience method to run plugin with one return object.
     */
    public Phenomes runPlugin(DataSet input) {
        return (Phenomes) performFunction(input).getData(0).getData();
    }

    public String name() {
        return myName.value();
    }

    public CompositeTraitPlugin name(String value) {
        myName = new PluginParameter<>(myName, value);
        return this;
    }

    public String formula() {
        return myFormula.value();
    }

    public CompositeTraitPlugin formula(String value) {
        myFormula = new PluginParameter<>(myFormula, value);
        return this;
    }

    @Override
    public String getButtonName() {
        return "Composite Trait";
    }

    @Override
    public String getToolTipText() {
        return "Add a trait computed from other traits";
    }

}
