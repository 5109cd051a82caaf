/*
 *  Datum
 */
package net.genomicbreeding.plugindef;

/**
 * Named piece of data passed between plugins.
 */
public class Datum {

    private final String myName;
    private final Object myData;
    private final String myComment;

    public Datum(String name, Object data, String comment) {
        if (name == null) {
            throw new IllegalArgumentException("Datum: init: name can not be null.");
        }
        if (data == null) {
            throw new IllegalArgumentException("Datum: init: data can not be null.");
        }
        myName = name;
        myData = data;
        myComment = comment == null ? "" : comment;
    }

    public String getName() {
        return myName;
    }

    public Object getData() {
        return myData;
    }

    public Class<?> getDataType() {
        return myData.getClass();
    }

    public String getComment() {
        return myComment;
    }

    @Override
    public String toString() {
        return myName;
    }

}
