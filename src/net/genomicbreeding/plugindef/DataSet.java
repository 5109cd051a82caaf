/*
 *  DataSet
 */
package net.genomicbreeding.plugindef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable list of {@link Datum} along with the plugin that created
 * it, if any.
 */
public class DataSet {

    private final List<Datum> myList;
    private final Plugin myCreator;

    public DataSet(List<Datum> list, Plugin creator) {
        myList = list == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
        myCreator = creator;
    }

    public DataSet(Datum theDatum, Plugin creator) {
        this(Collections.singletonList(theDatum), creator);
    }

    /**
     * Wraps objects that are not already Datum, naming each by its string
     * form.
     */
    public static DataSet getDataSet(Object... data) {
        List<Datum> list = new ArrayList<>();
        for (Object current : data) {
            if (current instanceof Datum) {
                list.add((Datum) current);
            } else {
                list.add(new Datum(current.toString(), current, null));
            }
        }
        return new DataSet(list, null);
    }

    public List<Datum> getDataSet() {
        return myList;
    }

    public Plugin getCreator() {
        return myCreator;
    }

    public int getSize() {
        return myList.size();
    }

    public Datum getData(int i) {
        return myList.get(i);
    }

    /**
     * @return every datum whose data is an instance of the given type, in
     * order
     */
    public List<Datum> getDataOfType(Class<?> theClass) {
        List<Datum> result = new ArrayList<>();
        for (Datum current : myList) {
            if (theClass.isInstance(current.getData())) {
                result.add(current);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "DataSet" + myList;
    }

}
