/*
 *  Plugin
 */
package net.genomicbreeding.plugindef;

/**
 * Unit of work that turns an input {@link DataSet} into an output
 * {@link DataSet}, configured through {@link PluginParameter}s.
 */
public interface Plugin {

    /**
     * Checks parameters, then processes the input.
     *
     * @param input input data
     *
     * @return resulting data
     */
    public DataSet performFunction(DataSet input);

    /**
     * Does the work of this plugin. Called by
     * {@link #performFunction(DataSet)} once parameters are checked.
     *
     * @param input input data
     *
     * @return resulting data
     */
    public DataSet processData(DataSet input);

    public Comparable<?> getParameter(String key);

    public Plugin setParameter(PluginParameter<?> param, Object value);

    public Plugin setParameter(String key, Comparable<?> value);

    /**
     * Sets a parameter from its text form.
     *
     * @param key command line name of the parameter
     * @param value text form of the value
     *
     * @return this plugin
     */
    public Plugin setParameter(String key, String value);

    /**
     * Sets parameters from {@code -name value} pairs.
     *
     * @param args arguments
     */
    public void setParameters(String[] args);

    public String getButtonName();

    public String getToolTipText();

    public String pluginDescription();

    /**
     * @return one line per parameter: name, description and default
     */
    public String getUsage();

}
