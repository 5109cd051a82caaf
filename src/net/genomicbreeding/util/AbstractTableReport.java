/*
 * AbstractTableReport
 */
package net.genomicbreeding.util;

/**
 * Caches the most recently requested row so column by column access of one
 * row builds it only once.
 */
public abstract class AbstractTableReport implements TableReport {

    private int currentRowNumber = -1;
    private Object[] currentRow = null;

    @Override
    public Object getValueAt(int row, int col) {
        if (row != currentRowNumber) {
            currentRowNumber = row;
            currentRow = getRow(row);
        }
        return currentRow[col];
    }

    @Override
    public int getElementCount() {
        return getRowCount() * getColumnCount();
    }

}
