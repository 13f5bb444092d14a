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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Local correlation image of a pixel-by-time signal matrix.
 * <p>
 * For each pixel, the image holds the mean Pearson correlation between the
 * pixel's time series and those of its neighbors at a fixed set of offsets.
 * Offsets are the integer displacements whose length falls in a ring
 * {@code [inner, outer)}: {@code [1, 2)} gives the 8-connected neighborhood,
 * larger rings probe correlation at a coarser spatial scale. Neighbors outside
 * the image are ignored; pixels without any valid neighbor, and constant
 * pixels, score 0.
 * </p>
 * <p>
 * The computation has no side effects and returns identical results whether
 * or not it runs in parallel.
 * </p>
 */
public class CorrelationImage {

    private CorrelationImage() {
    }

    /**
     * @param inner inclusive lower bound of the ring radius
     * @param outer exclusive upper bound of the ring radius
     * @return the {@code {dRow, dCol}} offsets of the ring
     */
    public static int[][] ringOffsets(final double inner, final double outer) {
        final int reach = (int) Math.ceil(outer);
        final List<int[]> offsets = new ArrayList<>();
        for (int dc = -reach; dc <= reach; dc++) {
            for (int dr = -reach; dr <= reach; dr++) {
                final double dist = Math.sqrt(dr * dr + dc * dc);
                if (dist >= inner && dist < outer && dist > 0) {
                    offsets.add(new int[]{dr, dc});
                }
            }
        }
        return offsets.toArray(new int[0][]);
    }

    /**
     * Computes the correlation image of a whole frame.
     *
     * @param y        pixel-by-time signal matrix
     * @param frames   frames to use
     * @param d1       frame rows
     * @param d2       frame columns
     * @param offsets  neighbor offsets, see {@link #ringOffsets(double, double)}
     * @param parallel whether to distribute pixels over threads
     * @return the correlation image, one value per pixel
     */
    public static double[] compute(final double[][] y, final int[] frames, final int d1, final int d2,
                                   final int[][] offsets, final boolean parallel) {
        return compute(y, PixelWindow.frame(d1, d2), frames, offsets, parallel);
    }

    /**
     * Computes the correlation image of a window, treating the window edges as
     * image borders.
     *
     * @param y        pixel-by-time signal matrix of the whole frame
     * @param window   the block of pixels to process
     * @param frames   frames to use
     * @param offsets  neighbor offsets, see {@link #ringOffsets(double, double)}
     * @param parallel whether to distribute pixels over threads
     * @return the correlation image of the window, in local pixel order
     */
    public static double[] compute(final double[][] y, final PixelWindow window, final int[] frames,
                                   final int[][] offsets, final boolean parallel) {
        final int nr = window.rows();
        final int nc = window.cols();
        final double[][] z = standardize(y, window.globalIndices(), frames);
        final double[] cn = new double[nr * nc];
        final IntStream pixels = IntStream.range(0, cn.length);
        (parallel ? pixels.parallel() : pixels).forEach(l -> cn[l] = meanNeighborCorrelation(z, l, nr, nc, offsets));
        return cn;
    }

    private static double meanNeighborCorrelation(final double[][] z, final int local, final int nr, final int nc,
                                                  final int[][] offsets) {
        final int r = local % nr;
        final int c = local / nr;
        final double[] zi = z[local];
        double sum = 0;
        int count = 0;
        for (final int[] offset : offsets) {
            final int rr = r + offset[0];
            final int cc = c + offset[1];
            if (rr < 0 || rr >= nr || cc < 0 || cc >= nc) continue;
            count++;
            if (zi == null) continue;
            final double[] zj = z[rr + cc * nr];
            if (zj == null) continue;
            double dot = 0;
            for (int t = 0; t < zi.length; t++) {
                dot += zi[t] * zj[t];
            }
            sum += dot / zi.length;
        }
        return (count == 0) ? 0 : sum / count;
    }

    /**
     * Z-scores the selected frames of each pixel with population moments.
     * Constant pixels map to {@code null}.
     */
    private static double[][] standardize(final double[][] y, final int[] pixels, final int[] frames) {
        final double[][] z = new double[pixels.length][];
        final int n = frames.length;
        for (int i = 0; i < pixels.length; i++) {
            final double[] trace = y[pixels[i]];
            double mean = 0;
            for (final int t : frames) {
                mean += trace[t];
            }
            mean /= n;
            double var = 0;
            for (final int t : frames) {
                final double d = trace[t] - mean;
                var += d * d;
            }
            final double sd = Math.sqrt(var / n);
            if (!(sd > 0) || !Double.isFinite(sd)) continue;
            final double[] zi = new double[n];
            for (int k = 0; k < n; k++) {
                zi[k] = (trace[frames[k]] - mean) / sd;
            }
            z[i] = zi;
        }
        return z;
    }

}
