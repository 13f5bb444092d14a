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

import sc.fiji.cnmfe.util.SignalStats;

/**
 * Mutable state of one peeling run: the median-centered residual, the
 * correlation images and the priority map.
 */
class PeelingState {

    final int d1;
    final int d2;
    final double[][] residual;
    final double[] median;
    final double[] noise;
    final int[] frames;
    final int[] coarseFrames;
    final int[][] fineOffsets;
    final double[] coarseCn;
    final double[] cn;
    final PeakSelector selector;

    PeelingState(final double[][] y, final double[] noise, final InitOptions options) {
        d1 = options.getD1();
        d2 = options.getD2();
        this.noise = noise;
        final int nFrames = y[0].length;
        frames = SignalStats.subsampleFrames(nFrames, options.getMaxCorrelationFrames());
        coarseFrames = SignalStats.everyNth(frames, options.getCoarseFrameStride());
        median = SignalStats.median(y, frames);
        residual = new double[y.length][];
        for (int p = 0; p < y.length; p++) {
            final double[] row = y[p].clone();
            for (int t = 0; t < nFrames; t++) {
                row[t] -= median[p];
            }
            residual[p] = row;
        }

        fineOffsets = CorrelationImage.ringOffsets(1, 2);
        final int gSiz = options.getGSiz();
        final int[][] coarseOffsets = CorrelationImage.ringOffsets(gSiz, gSiz + 1);
        cn = CorrelationImage.compute(residual, frames, d1, d2, fineOffsets, options.isParallel());
        coarseCn = CorrelationImage.compute(residual, coarseFrames, d1, d2, coarseOffsets, options.isParallel());
        for (int p = 0; p < cn.length; p++) {
            cn[p] -= coarseCn[p];
        }
        selector = new PeakSelector(PeakSelector.peakToNoise(residual, noise, d1, d2, options.getGSig()), cn);
    }

    /**
     * Subtracts {@code weights * trace} from the residual rows of the given
     * pixels.
     */
    void subtract(final int[] pixels, final double[] weights, final double[] trace) {
        for (int i = 0; i < pixels.length; i++) {
            final double w = weights[i];
            if (w == 0) continue;
            final double[] row = residual[pixels[i]];
            for (int t = 0; t < row.length; t++) {
                row[t] -= w * trace[t];
            }
        }
    }

    /**
     * Recomputes the fine-scale correlation image over a window, with the
     * window edges acting as image borders, and subtracts the stored
     * coarse-scale image.
     */
    void refreshCorrelation(final PixelWindow window, final boolean parallel) {
        final double[] local = CorrelationImage.compute(residual, window, frames, fineOffsets, parallel);
        for (int l = 0; l < local.length; l++) {
            final int p = window.globalIndex(l);
            cn[p] = local[l] - coarseCn[p];
        }
    }

    /**
     * @return the residual with the median added back
     */
    double[][] uncenteredResidual() {
        final double[][] out = new double[residual.length][];
        for (int p = 0; p < residual.length; p++) {
            final double[] row = residual[p].clone();
            for (int t = 0; t < row.length; t++) {
                row[t] += median[p];
            }
            out[p] = row;
        }
        return out;
    }

}
