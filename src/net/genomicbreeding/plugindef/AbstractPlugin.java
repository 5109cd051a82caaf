/*
 *  AbstractPlugin
 */
package net.genomicbreeding.plugindef;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Base of plugins configured by {@link PluginParameter} fields. Parameters
 * are discovered by reflection, so declaring a field is enough to make it
 * settable by name or from {@code -name value} arguments.
 */
public abstract class AbstractPlugin implements Plugin {

    private static final Logger myLogger = Logger.getLogger(AbstractPlugin.class);

    @Override
    public DataSet performFunction(DataSet input) {
        try {
            preProcessParameters(input);
            checkRequiredParameters();
            DataSet result = processData(input);
            myLogger.info(getClass().getSimpleName() + ": performFunction: done: " + result);
            return result;
        } catch (RuntimeException e) {
            myLogger.debug(e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Checks the input and parameters before processing. Throws
     * IllegalArgumentException on problems.
     *
     * @param input input data
     */
    protected void preProcessParameters(DataSet input) {
        // override when input or parameters need checking
    }

    private void checkRequiredParameters() {
        for (PluginParameter<?> current : getParameterInstances()) {
            if (current.required() && current.isEmpty()) {
                throw new IllegalArgumentException(getClass().getSimpleName() + ": checkRequiredParameters: " + current.cmdLineName() + " must be defined.");
            }
        }
    }

    /**
     * @return current parameter instances in declaration order
     */
    public List<PluginParameter<?>> getParameterInstances() {
        List<PluginParameter<?>> result = new ArrayList<>();
        for (Field field : parameterFields()) {
            result.add(fieldValue(field));
        }
        return result;
    }

    private List<Field> parameterFields() {
        List<Field> result = new ArrayList<>();
        Class<?> current = getClass();
        while (current != null && current != AbstractPlugin.class) {
            for (Field field : current.getDeclaredFields()) {
                if (PluginParameter.class.isAssignableFrom(field.getType())) {
                    field.setAccessible(true);
                    result.add(field);
                }
            }
            current = current.getSuperclass();
        }
        return result;
    }

    private PluginParameter<?> fieldValue(Field field) {
        try {
            return (PluginParameter<?>) field.get(this);
        } catch (IllegalAccessException e) {
            myLogger.debug(e.getMessage(), e);
            throw new IllegalStateException("AbstractPlugin: fieldValue: can't access parameter: " + field.getName(), e);
        }
    }

    private Field parameterField(String key) {
        for (Field field : parameterFields()) {
            if (fieldValue(field).cmdLineName().equals(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException(getClass().getSimpleName() + ": unknown parameter: " + key + ". Parameters are: " + parameterNames());
    }

    private List<String> parameterNames() {
        List<String> result = new ArrayList<>();
        for (PluginParameter<?> current : getParameterInstances()) {
            result.add(current.cmdLineName());
        }
        return result;
    }

    public PluginParameter<?> getParameterInstance(String key) {
        return fieldValue(parameterField(key));
    }

    @Override
    public Comparable<?> getParameter(String key) {
        return (Comparable<?>) getParameterInstance(key).value();
    }

    @Override
    public Plugin setParameter(PluginParameter<?> param, Object value) {
        return setParameterValue(parameterField(param.cmdLineName()), value);
    }

    @Override
    public Plugin setParameter(String key, Comparable<?> value) {
        return setParameterValue(parameterField(key), value);
    }

    @Override
    public Plugin setParameter(String key, String value) {
        Field field = parameterField(key);
        return setParameterValue(field, convert(value, fieldValue(field).valueType()));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Plugin setParameterValue(Field field, Object value) {
        PluginParameter<?> old = fieldValue(field);
        if (value != null && !old.valueType().isInstance(value)) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ": setParameter: " + old.cmdLineName() + " expects " + old.valueType().getSimpleName() + " but got: " + value);
        }
        try {
            field.set(this, new PluginParameter((PluginParameter) old, value));
        } catch (IllegalAccessException e) {
            myLogger.debug(e.getMessage(), e);
            throw new IllegalStateException("AbstractPlugin: setParameter: can't set parameter: " + old.cmdLineName(), e);
        }
        return this;
    }

    @Override
    public void setParameters(String[] args) {
        if (args == null) {
            return;
        }
        int index = 0;
        while (index < args.length) {
            String arg = args[index++];
            if (arg == null || arg.length() < 2 || !arg.startsWith("-")) {
                throw new IllegalArgumentException(getClass().getSimpleName() + ": setParameters: expected -name but found: " + arg + "\n" + getUsage());
            }
            String key = arg.substring(1);
            PluginParameter<?> parameter = getParameterInstance(key);
            String value;
            if (parameter.valueType() == Boolean.class && (index >= args.length || args[index].startsWith("-"))) {
                value = "true";
            } else if (index < args.length) {
                value = args[index++];
            } else {
                throw new IllegalArgumentException(getClass().getSimpleName() + ": setParameters: no value for: " + arg);
            }
            setParameter(key, value);
        }
    }

    /**
     * Converts text to a parameter value of the given type.
     *
     * @return the value, null for null or blank input
     *
     * @throws IllegalArgumentException if the text can't be converted
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <T> T convert(String input, Class<T> outputClass) {
        if (input == null || input.trim().isEmpty()) {
            return null;
        }
        String value = input.trim();
        try {
            if (outputClass == String.class) {
                return (T) input;
            } else if (outputClass == Integer.class) {
                return (T) Integer.valueOf(value);
            } else if (outputClass == Double.class) {
                return (T) Double.valueOf(value);
            } else if (outputClass == Boolean.class) {
                if (value.equalsIgnoreCase("true")) {
                    return (T) Boolean.TRUE;
                } else if (value.equalsIgnoreCase("false")) {
                    return (T) Boolean.FALSE;
                }
                throw new IllegalArgumentException("AbstractPlugin: convert: not true or false: " + input);
            } else if (outputClass.isEnum()) {
                for (Object current : outputClass.getEnumConstants()) {
                    if (((Enum) current).name().equalsIgnoreCase(value) || current.toString().equals(value)) {
                        return (T) current;
                    }
                }
                throw new IllegalArgumentException("AbstractPlugin: convert: unknown value: " + input + " for: " + outputClass.getSimpleName());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("AbstractPlugin: convert: not a number: " + input, e);
        }
        throw new IllegalArgumentException("AbstractPlugin: convert: unsupported type: " + outputClass.getName());
    }

    @Override
    public String pluginDescription() {
        return getToolTipText();
    }

    @Override
    public String getUsage() {
        StringBuilder builder = new StringBuilder();
        builder.append(getButtonName()).append(": ").append(pluginDescription()).append("\n");
        for (PluginParameter<?> current : getParameterInstances()) {
            builder.append("-").append(current.cmdLineName()).append(" <").append(current.valueType().getSimpleName()).append("> : ");
            builder.append(current.description());
            if (current.range() != null) {
                builder.append(" ").append(current.range());
            }
            if (current.required()) {
                builder.append(" (required)");
            } else if (current.defaultValue() != null) {
                builder.append(" (default: ").append(current.defaultValue()).append(")");
            }
            builder.append("\n");
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return getButtonName();
    }

}
