/*
 *  TableReportBuilder
 */
package net.genomicbreeding.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Accumulates rows in memory and builds a {@link SimpleTableReport}.
 */
public class TableReportBuilder {

    private static final Logger myLogger = Logger.getLogger(TableReportBuilder.class);

    private final String myTableName;
    private final Object[] myColumnNames;
    private final List<Object[]> myData;
    private final int myNumColumns;

    private TableReportBuilder(String tableName, Object[] columnNames) {
        myTableName = tableName;
        myColumnNames = columnNames.clone();
        myNumColumns = columnNames.length;
        myData = new ArrayList<>();
    }

    public static TableReportBuilder getInstance(String tableName, Object[] columnNames) {
        return new TableReportBuilder(tableName, columnNames);
    }

    public void add(Object[] row) {

        if (myNumColumns != row.length) {
            throw new IllegalArgumentException("TableReportBuilder: add: number of row elements: " + row.length + " doesn't equal number of headers: " + myNumColumns);
        }

        myData.add(row);

    }

    public TableReport build() {
        Object[][] data = myData.toArray(new Object[myData.size()][]);
        myLogger.debug("TableReportBuilder: build: " + myTableName + ": " + data.length + " rows, " + myNumColumns + " columns");
        return new SimpleTableReport(myTableName, myColumnNames, data);
    }

}
