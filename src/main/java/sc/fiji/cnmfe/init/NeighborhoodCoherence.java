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

import ij.process.FloatProcessor;
import ij.process.FloodFiller;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import sc.fiji.cnmfe.util.SignalStats;

/**
 * Tests whether the signal around a candidate pixel is spatially coherent.
 * <p>
 * A seed trace is averaged over a small patch centered on the candidate and
 * clipped to be non-negative. Every pixel of the surrounding search window is
 * correlated with it; pixels above the correlation threshold are labeled into
 * 8-connected components and only the component holding most of the seed
 * patch is kept. Other components are discarded even if they correlate with the
 * seed.
 * </p>
 */
public class NeighborhoodCoherence {

    private static final float UNLABELED = -1f;

    private final double[][] y;
    private final int d1;
    private final int d2;
    private final int searchRadius;
    private final int seedRadius;
    private final double minCorr;

    /**
     * @param y            residual signal matrix (read, never modified)
     * @param d1           frame rows
     * @param d2           frame columns
     * @param searchRadius half-width of the search window ({@code gSiz})
     * @param seedRadius   half-width of the seed patch ({@code pSiz})
     * @param minCorr      correlation a pixel must exceed to be coherent
     */
    public NeighborhoodCoherence(final double[][] y, final int d1, final int d2, final int searchRadius,
                                 final int seedRadius, final double minCorr) {
        this.y = y;
        this.d1 = d1;
        this.d2 = d2;
        this.searchRadius = searchRadius;
        this.seedRadius = seedRadius;
        this.minCorr = minCorr;
    }

    /**
     * Evaluates the neighborhood of a candidate pixel against the current
     * contents of the signal matrix.
     */
    public CoherentRegion evaluate(final int row, final int col) {
        final PixelWindow window = PixelWindow.around(row, col, searchRadius, d1, d2);
        final PixelWindow seed = PixelWindow.around(row, col, seedRadius, d1, d2);
        final int[] seedLocal = window.localIndices(seed);
        final int[] pixels = window.globalIndices();

        final double[] seedTrace = seedTrace(seed.globalIndices());

        final double[] correlations = new double[pixels.length];
        final boolean[] active = new boolean[pixels.length];
        for (int l = 0; l < pixels.length; l++) {
            correlations[l] = SignalStats.pearson(seedTrace, y[pixels[l]]);
            active[l] = correlations[l] > minCorr;
        }

        final int[] labels = label(active, window.rows(), window.cols());
        final int seedLabel = modeLabel(labels, seedLocal);
        final boolean[] mask = new boolean[pixels.length];
        for (int l = 0; l < mask.length; l++) {
            mask[l] = active[l] && labels[l] == seedLabel;
        }
        return new CoherentRegion(row, col, window, seedTrace, correlations, mask);
    }

    private double[] seedTrace(final int[] seedPixels) {
        final int nFrames = y[seedPixels[0]].length;
        final double[] trace = new double[nFrames];
        for (final int p : seedPixels) {
            final double[] yp = y[p];
            for (int t = 0; t < nFrames; t++) {
                trace[t] += yp[t];
            }
        }
        for (int t = 0; t < nFrames; t++) {
            trace[t] = Math.max(0, trace[t] / seedPixels.length);
        }
        return trace;
    }

    /**
     * 8-connected labeling. Background is 0, components are numbered from 1.
     */
    static int[] label(final boolean[] active, final int nr, final int nc) {
        final FloatProcessor ip = new FloatProcessor(nr, nc);
        for (int l = 0; l < active.length; l++) {
            if (active[l]) ip.setf(l % nr, l / nr, UNLABELED);
        }
        final FloodFiller filler = new FloodFiller(ip);
        final int[] labels = new int[active.length];
        int next = 0;
        for (int l = 0; l < labels.length; l++) {
            final int row = l % nr;
            final int col = l / nr;
            if (ip.getf(row, col) == UNLABELED) {
                ip.setValue(++next);
                filler.fill8(row, col);
            }
            labels[l] = (int) ip.getf(row, col);
        }
        return labels;
    }

    /**
     * Most frequent label among the given pixels, background included. Ties go
     * to the smallest label.
     */
    static int modeLabel(final int[] labels, final int[] pixels) {
        final Int2IntOpenHashMap counts = new Int2IntOpenHashMap();
        for (final int l : pixels) {
            counts.addTo(labels[l], 1);
        }
        int best = Integer.MAX_VALUE;
        int bestCount = 0;
        for (final Int2IntMap.Entry e : counts.int2IntEntrySet()) {
            final int label = e.getIntKey();
            final int count = e.getIntValue();
            if (count > bestCount || (count == bestCount && label < best)) {
                best = label;
                bestCount = count;
            }
        }
        return best;
    }

}
