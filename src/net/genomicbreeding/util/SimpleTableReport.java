/*
 *  SimpleTableReport
 */
package net.genomicbreeding.util;

import java.util.Arrays;

/**
 * Table report backed by an in-memory array of rows.
 */
public class SimpleTableReport extends AbstractTableReport {

    private final Object[][] theData;
    private final Object[] theColumnNames;
    private final String theName;

    public SimpleTableReport(String theName, Object[] columnNames, Object[][] theData) {
        this.theData = theData;
        this.theColumnNames = columnNames;
        this.theName = theName;
    }

    /**
     * Return column names for the table
     */
    @Override
    public Object[] getTableColumnNames() {
        return Arrays.copyOf(theColumnNames, theColumnNames.length);
    }

    /**
     * Returns specified row.
     *
     * @param row row number
     *
     * @return row
     */
    @Override
    public Object[] getRow(int row) {
        return Arrays.copyOf(theData[row], theData[row].length);
    }

    @Override
    public String getTableTitle() {
        return theName;
    }

    @Override
    public int getRowCount() {
        return theData.length;
    }

    @Override
    public int getColumnCount() {
        return theColumnNames.length;
    }

    @Override
    public Object getValueAt(int row, int col) {
        return theData[row][col];
    }

    /**
     * Index of the named column
     *
     * @param columnName column name
     *
     * @return index or -1 if no column has this name
     */
    public int columnIndex(String columnName) {
        for (int i = 0; i < theColumnNames.length; i++) {
            if (theColumnNames[i].toString().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

}
