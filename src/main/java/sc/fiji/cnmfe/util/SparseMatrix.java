/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2025 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.cnmfe.util;

import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * A sparse matrix of doubles backed by an int to column open addressed hash
 * map. Each column is itself an open addressed map from row index to value.
 * Zero entries are never stored.
 */
public class SparseMatrix {

    private final Int2ObjectOpenHashMap<Int2DoubleOpenHashMap> columnMap;
    private final int nRows;
    private final int nColumns;

    public SparseMatrix(final int nRows, final int nColumns) {
        if (nRows < 0 || nColumns < 0) {
            throw new IllegalArgumentException("Matrix dimensions must be non-negative: " + nRows + "x" + nColumns);
        }
        this.columnMap = new Int2ObjectOpenHashMap<>();
        this.nRows = nRows;
        this.nColumns = nColumns;
    }

    public int numRows() {
        return nRows;
    }

    public int numColumns() {
        return nColumns;
    }

    private Int2DoubleOpenHashMap getColumn(final int column) {
        checkColumn(column);
        final Int2DoubleOpenHashMap col = columnMap.get(column);
        return (col == null) ? new Int2DoubleOpenHashMap() : col;
    }

    public double getValue(final int row, final int column) {
        checkRow(row);
        checkColumn(column);
        final Int2DoubleOpenHashMap col = columnMap.get(column);
        if (col == null) {
            return 0d;
        }
        return col.get(row);
    }

    public void setValue(final int row, final int column, final double value) {
        checkRow(row);
        checkColumn(column);
        Int2DoubleOpenHashMap col = columnMap.get(column);
        if (value == 0d) {
            if (col != null) col.remove(row);
            return;
        }
        if (col == null) {
            col = new Int2DoubleOpenHashMap();
            columnMap.put(column, col);
        }
        col.put(row, value);
    }

    /**
     * @return the sorted row indices of the non-zero entries of a column
     */
    public int[] nonZeroRows(final int column) {
        final int[] rows = getColumn(column).keySet().toIntArray();
        IntArrays.quickSort(rows);
        return rows;
    }

    /**
     * @return a dense copy of a column
     */
    public double[] columnAsArray(final int column) {
        final double[] dense = new double[nRows];
        getColumn(column).int2DoubleEntrySet().forEach(e -> dense[e.getIntKey()] = e.getDoubleValue());
        return dense;
    }

    private void checkRow(final int row) {
        if (row < 0 || row >= nRows) throw new IndexOutOfBoundsException("Row " + row + " outside [0, " + nRows + ")");
    }

    private void checkColumn(final int column) {
        if (column < 0 || column >= nColumns)
            throw new IndexOutOfBoundsException("Column " + column + " outside [0, " + nColumns + ")");
    }
}
