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

import ij.plugin.filter.Convolver;
import ij.process.FloatProcessor;
import sc.fiji.cnmfe.util.SignalStats;

/**
 * Maintains the per-pixel priority (peak-to-noise ratio) and picks candidate
 * seeds in order of {@code priority * correlation}.
 * <p>
 * Priorities never increase: a selected pixel is zeroed immediately, explained
 * pixels are zeroed and explained signal is subtracted with {@link #decay}.
 * Together this bounds the number of selections by the number of pixels with
 * a positive priority.
 * </p>
 */
public class PeakSelector {

    private final double[] priority;
    private final double[] cn;
    private double lastScore = Double.NaN;

    /**
     * @param priority initial priority map, owned and modified by this selector
     * @param cn       correlation image, read at every selection
     */
    public PeakSelector(final double[] priority, final double[] cn) {
        if (priority.length != cn.length) {
            throw new IllegalArgumentException("Priority and correlation maps differ in size: "
                    + priority.length + " vs " + cn.length);
        }
        this.priority = priority;
        this.cn = cn;
    }

    /**
     * Computes {@code max_t(y) / noise} for each pixel of a median-centered
     * signal matrix. Non-finite ratios (zero noise) and pixels closer than
     * {@code margin} to the frame border get priority 0.
     */
    public static double[] peakToNoise(final double[][] centered, final double[] noise, final int d1, final int d2,
                                       final int margin) {
        final double[] ratio = new double[centered.length];
        for (int c = 0; c < d2; c++) {
            for (int r = 0; r < d1; r++) {
                if (r < margin || r >= d1 - margin || c < margin || c >= d2 - margin) continue;
                final int p = r + c * d1;
                final double value = SignalStats.max(centered[p]) / noise[p];
                ratio[p] = Double.isFinite(value) ? value : 0;
            }
        }
        return ratio;
    }

    /**
     * Picks the pixel with the highest score (the first one on ties) and zeroes
     * its priority so it cannot be picked again.
     *
     * @return the selected pixel index
     */
    public int selectNext() {
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int p = 0; p < priority.length; p++) {
            final double score = priority[p] * cn[p];
            if (score > bestScore) {
                bestScore = score;
                best = p;
            }
        }
        priority[best] = 0;
        lastScore = bestScore;
        return best;
    }

    /**
     * @return the score of the last selected pixel
     */
    public double getLastScore() {
        return lastScore;
    }

    /**
     * Zeroes the priority of window pixels whose seed correlation exceeds
     * {@code threshold}.
     */
    public void suppress(final PixelWindow window, final double[] correlations, final double threshold) {
        for (int l = 0; l < correlations.length; l++) {
            if (correlations[l] > threshold) priority[window.globalIndex(l)] = 0;
        }
    }

    /**
     * Subtracts explained signal from the priority map around a source.
     * <p>
     * For each support pixel the drop {@code max(0, old - new)} of its
     * peak-to-noise ratio is computed; the drop map is smoothed with a
     * {@code kernelSize x kernelSize} averaging kernel and subtracted from the
     * priority over the whole window, clamping at 0.
     * </p>
     *
     * @param window     search window of the source
     * @param support    support mask (local order)
     * @param residual   residual signal after subtraction of the source
     * @param noise      per-pixel noise level
     * @param kernelSize width of the smoothing kernel
     */
    public void decay(final PixelWindow window, final boolean[] support, final double[][] residual,
                      final double[] noise, final int kernelSize) {
        final double[] drop = new double[window.size()];
        for (int l = 0; l < drop.length; l++) {
            if (!support[l]) continue;
            final int p = window.globalIndex(l);
            final double updated = SignalStats.max(residual[p]) / noise[p];
            if (!Double.isFinite(updated)) continue;
            drop[l] = Math.max(0, priority[p] - updated);
        }
        final double[] smoothed = boxAverage(drop, window.rows(), window.cols(), kernelSize);
        for (int l = 0; l < smoothed.length; l++) {
            final int p = window.globalIndex(l);
            priority[p] = Math.max(0, priority[p] - smoothed[l]);
        }
    }

    /**
     * Same-size {@code size x size} mean filter of a column-major map with zero
     * padding. For even sizes the extra row and column lie after the pixel, as
     * with MATLAB's {@code imfilter}.
     */
    static double[] boxAverage(final double[] values, final int nr, final int nc, final int size) {
        // ImageJ kernels are odd and centered: the box is the trailing part of one
        final int kw = size | 1;
        final float[] kernel = new float[kw];
        for (int i = kw - size; i < kw; i++) {
            kernel[i] = 1f;
        }
        // border of zeros, so that edge replication adds nothing
        final int pad = kw / 2;
        final FloatProcessor fp = new FloatProcessor(nr + 2 * pad, nc + 2 * pad);
        for (int l = 0; l < values.length; l++) {
            fp.setf(pad + l % nr, pad + l / nr, (float) values[l]);
        }
        final Convolver convolver = new Convolver();
        convolver.setNormalize(true);
        convolver.convolve(fp, kernel, kw, 1);
        convolver.convolve(fp, kernel, 1, kw);
        final double[] out = new double[values.length];
        for (int l = 0; l < out.length; l++) {
            out[l] = fp.getf(pad + l % nr, pad + l / nr);
        }
        return out;
    }

    /**
     * @return a copy of the current priority map
     */
    public double[] snapshot() {
        return priority.clone();
    }

}
