/*
 *  PluginParameter
 */
package net.genomicbreeding.plugindef;

import com.google.common.collect.Range;

import static net.genomicbreeding.plugindef.AbstractPlugin.convert;

import org.apache.log4j.Logger;

/**
 * Immutable description and value of one plugin parameter. Changing a value
 * creates a new instance through {@link #PluginParameter(PluginParameter, Object)},
 * which checks the value against the range.
 *
 * @param <T> type of the value
 */
public final class PluginParameter<T> {

    private static final Logger myLogger = Logger.getLogger(PluginParameter.class);

    private final String myCmdLineName;
    private final String myDescription;
    private final Range<Comparable<T>> myRange;
    private final T myDefaultValue;
    private final T myValue;
    private final boolean myRequired;
    private final Class<T> myClass;

    private PluginParameter(String cmdLineName, String description, Range<Comparable<T>> range, T defaultValue, T value, boolean required, Class<T> type) {
        myCmdLineName = cmdLineName;
        myDescription = description;
        myRange = range;
        myDefaultValue = defaultValue;
        myValue = value == null ? defaultValue : value;
        myRequired = required;
        myClass = type;

        if (myValue != null && !acceptsValue(myValue)) {
            StringBuilder builder = new StringBuilder();
            builder.append("PluginParameter: init: ").append(myCmdLineName).append(" value: ").append(myValue).append(" outside range: ");
            if (myClass.isEnum()) {
                builder.append("[");
                T[] values = myClass.getEnumConstants();
                for (int i = 0; i < values.length; i++) {
                    if (i != 0) {
                        builder.append(" ");
                    }
                    builder.append(values[i]);
                }
                builder.append("]");
            } else {
                builder.append(myRange);
            }
            throw new IllegalArgumentException(builder.toString());
        }

        if (myDefaultValue != null && myRequired) {
            throw new IllegalArgumentException("PluginParameter: init: " + myCmdLineName + " shouldn't have default value and be required.");
        }
    }

    /**
     * Copy of an existing parameter holding a new value.
     *
     * @param oldParameter parameter to copy
     * @param newValue new value, null for the default
     */
    public PluginParameter(PluginParameter<T> oldParameter, T newValue) {
        this(oldParameter.myCmdLineName, oldParameter.myDescription, oldParameter.myRange,
                oldParameter.myDefaultValue, newValue, oldParameter.myRequired, oldParameter.myClass);
    }

    public String cmdLineName() {
        return myCmdLineName;
    }

    public String description() {
        return myDescription;
    }

    public Range<Comparable<T>> range() {
        return myRange;
    }

    @SuppressWarnings("unchecked")
    public boolean acceptsValue(Object value) {
        try {
            return (myRange == null) || (myRange.contains((Comparable<T>) value));
        } catch (ClassCastException e) {
            myLogger.debug(e.getMessage(), e);
            return false;
        }
    }

    public boolean acceptsValue(String input) {
        return acceptsValue(convert(input, myClass));
    }

    public T value() {
        return myValue;
    }

    public T defaultValue() {
        return myDefaultValue;
    }

    public boolean required() {
        return myRequired;
    }

    public Class<T> valueType() {
        return myClass;
    }

    public boolean isEmpty() {
        return (myValue == null) || (myValue.toString().trim().isEmpty());
    }

    @Override
    public String toString() {
        return myCmdLineName + "=" + myValue;
    }

    public static class Builder<T> {

        private final String myCmdLineName;
        private String myDescription = "";
        private Range<Comparable<T>> myRange = null;
        private final T myDefaultValue;
        private boolean myIsRequired = false;
        private final Class<T> myClass;

        public Builder(String cmdLineName, T defaultValue, Class<T> type) {
            myCmdLineName = cmdLineName;
            myDefaultValue = defaultValue;
            myClass = type;
        }

        public Builder<T> description(String description) {
            myDescription = description;
            return this;
        }

        public Builder<T> range(Range<Comparable<T>> range) {
            myRange = range;
            return this;
        }

        public Builder<T> required(boolean required) {
            myIsRequired = required;
            return this;
        }

        public PluginParameter<T> build() {
            if (myCmdLineName == null || myCmdLineName.isEmpty()) {
                throw new IllegalArgumentException("PluginParameter: Builder: build: command line name must be set.");
            }
            if (myDescription.isEmpty()) {
                myDescription = myCmdLineName;
            }
            return new PluginParameter<>(myCmdLineName, myDescription, myRange, myDefaultValue, null, myIsRequired, myClass);
        }
    }
}
