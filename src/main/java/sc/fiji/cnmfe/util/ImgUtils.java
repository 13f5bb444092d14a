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

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Static utilities for moving data between {@link RandomAccessibleInterval}s and
 * pixel-by-time matrices. Pixels are indexed column-major: dimension 0 of an
 * image is the row axis and varies fastest.
 */
public class ImgUtils {

    private ImgUtils() {}

    /**
     * Flattens a movie into a {@code pixels x frames} matrix.
     *
     * @param movie a 2D (single frame) or 3D (rows, columns, time) interval
     * @return the signal matrix, indexed {@code [row + col * rows][frame]}
     */
    public static double[][] toPixelMatrix(final RandomAccessibleInterval<? extends RealType<?>> movie) {
        if (movie.numDimensions() < 2 || movie.numDimensions() > 3) {
            throw new IllegalArgumentException("Expected a 2D or 3D image but got " + movie.numDimensions() + " dimensions");
        }
        final RandomAccessibleInterval<? extends RealType<?>> zeroMin = Views.zeroMin(movie);
        final int d1 = (int) movie.dimension(0);
        final int d2 = (int) movie.dimension(1);
        final int nFrames = (movie.numDimensions() == 3) ? (int) movie.dimension(2) : 1;
        final double[][] y = new double[d1 * d2][nFrames];
        final Cursor<? extends RealType<?>> cursor = Views.flatIterable(zeroMin).localizingCursor();
        final long[] pos = new long[movie.numDimensions()];
        while (cursor.hasNext()) {
            cursor.fwd();
            cursor.localize(pos);
            final int frame = (pos.length == 3) ? (int) pos[2] : 0;
            y[(int) pos[0] + (int) pos[1] * d1][frame] = cursor.get().getRealDouble();
        }
        return y;
    }

    /**
     * Wraps a column-major pixel vector as a 2D image.
     *
     * @param pixels the pixel values (not copied)
     * @param d1     number of rows
     * @param d2     number of columns
     * @return a {@code d1 x d2} image backed by {@code pixels}
     */
    public static Img<DoubleType> toImg(final double[] pixels, final int d1, final int d2) {
        if (pixels.length != d1 * d2) {
            throw new IllegalArgumentException("Vector length " + pixels.length + " != " + d1 + "x" + d2);
        }
        return ArrayImgs.doubles(pixels, d1, d2);
    }

    /**
     * Copies a {@code pixels x frames} matrix into a {@code d1 x d2 x frames} movie.
     */
    public static Img<DoubleType> toMovie(final double[][] y, final int d1, final int d2) {
        final int nFrames = (y.length == 0) ? 0 : y[0].length;
        final Img<DoubleType> movie = ArrayImgs.doubles(d1, d2, nFrames);
        final RandomAccess<DoubleType> ra = movie.randomAccess();
        for (int c = 0; c < d2; c++) {
            for (int r = 0; r < d1; r++) {
                final double[] trace = y[r + c * d1];
                for (int t = 0; t < nFrames; t++) {
                    ra.setPosition(new long[]{r, c, t});
                    ra.get().set(trace[t]);
                }
            }
        }
        return movie;
    }

    /**
     * Copies a row-major {@code double[rows][columns]} matrix into a 2D image
     * whose dimension 0 indexes columns and dimension 1 indexes rows, i.e. the
     * layout of a table with one row per entry.
     */
    public static Img<DoubleType> toTableImg(final double[][] matrix) {
        final int nRows = matrix.length;
        final int nCols = (nRows == 0) ? 0 : matrix[0].length;
        final Img<DoubleType> img = ArrayImgs.doubles(nCols, nRows);
        final RandomAccess<DoubleType> ra = img.randomAccess();
        for (int r = 0; r < nRows; r++) {
            for (int c = 0; c < nCols; c++) {
                ra.setPosition(new long[]{c, r});
                ra.get().set(matrix[r][c]);
            }
        }
        return img;
    }

}
