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

package sc.fiji.cnmfe.init;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A rectangular block of a {@code d1 x d2} frame, clipped to the frame bounds.
 * Pixels inside the window have local column-major indices
 * ({@code row + col * rows()}), matching the global indexing of the frame.
 */
public class PixelWindow {

    private final int d1;
    private final int rowMin;
    private final int rowMax;
    private final int colMin;
    private final int colMax;

    private PixelWindow(final int d1, final int rowMin, final int rowMax, final int colMin, final int colMax) {
        this.d1 = d1;
        this.rowMin = rowMin;
        this.rowMax = rowMax;
        this.colMin = colMin;
        this.colMax = colMax;
    }

    /**
     * @param row        center row
     * @param col        center column
     * @param halfWidth  number of pixels on each side of the center
     * @param d1         frame rows
     * @param d2         frame columns
     * @return the window centered on {@code (row, col)}, clipped to the frame
     */
    public static PixelWindow around(final int row, final int col, final int halfWidth, final int d1, final int d2) {
        return new PixelWindow(d1, Math.max(0, row - halfWidth), Math.min(d1 - 1, row + halfWidth),
                Math.max(0, col - halfWidth), Math.min(d2 - 1, col + halfWidth));
    }

    /**
     * @return a window covering the whole {@code d1 x d2} frame
     */
    public static PixelWindow frame(final int d1, final int d2) {
        return new PixelWindow(d1, 0, d1 - 1, 0, d2 - 1);
    }

    public int rows() {
        return rowMax - rowMin + 1;
    }

    public int cols() {
        return colMax - colMin + 1;
    }

    public int size() {
        return rows() * cols();
    }

    public int rowMin() {
        return rowMin;
    }

    public int colMin() {
        return colMin;
    }

    /**
     * @return the local index of frame pixel {@code (row, col)}, which must lie in the window
     */
    public int localIndex(final int row, final int col) {
        return (row - rowMin) + (col - colMin) * rows();
    }

    /**
     * @return the frame index of the pixel with the given local index
     */
    public int globalIndex(final int local) {
        final int nr = rows();
        return (rowMin + local % nr) + (colMin + local / nr) * d1;
    }

    /**
     * @return frame indices of all window pixels, in local order
     */
    public int[] globalIndices() {
        final int[] indices = new int[size()];
        for (int l = 0; l < indices.length; l++) {
            indices[l] = globalIndex(l);
        }
        return indices;
    }

    /**
     * @param mask local mask of length {@link #size()}
     * @return frame indices of the masked pixels, in local order
     */
    public int[] globalIndices(final boolean[] mask) {
        final IntArrayList indices = new IntArrayList();
        for (int l = 0; l < mask.length; l++) {
            if (mask[l]) indices.add(globalIndex(l));
        }
        return indices.toIntArray();
    }

    /**
     * @param other a window inside this one
     * @return local indices (in this window) of the pixels of {@code other}
     */
    public int[] localIndices(final PixelWindow other) {
        final int[] indices = new int[other.size()];
        int i = 0;
        for (int c = other.colMin; c <= other.colMax; c++) {
            for (int r = other.rowMin; r <= other.rowMax; r++) {
                indices[i++] = localIndex(r, c);
            }
        }
        return indices;
    }

    @Override
    public String toString() {
        return "rows [" + rowMin + ", " + rowMax + "], cols [" + colMin + ", " + colMax + "]";
    }
}
