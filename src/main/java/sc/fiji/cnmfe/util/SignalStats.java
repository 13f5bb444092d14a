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

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Static numeric helpers for pixel-by-time signal matrices ({@code double[pixel][frame]}).
 */
public class SignalStats {

    private SignalStats() {
    }

    /**
     * Evenly spaced frame indices, the zero-based equivalent of MATLAB's
     * {@code round(linspace(1, nFrames, min(nFrames, maxFrames)))}.
     *
     * @param nFrames   number of frames available
     * @param maxFrames maximum number of frames to select
     * @return sorted zero-based frame indices
     */
    public static int[] subsampleFrames(final int nFrames, final int maxFrames) {
        final int n = Math.min(nFrames, maxFrames);
        final int[] frames = new int[n];
        if (n == 1) {
            frames[0] = nFrames - 1;
            return frames;
        }
        final double step = (nFrames - 1d) / (n - 1d);
        for (int i = 0; i < n; i++) {
            frames[i] = (int) Math.round(1 + i * step) - 1;
        }
        return frames;
    }

    /**
     * @return every {@code stride}-th element of {@code frames}, starting with the first
     */
    public static int[] everyNth(final int[] frames, final int stride) {
        final int[] out = new int[(frames.length + stride - 1) / stride];
        for (int i = 0; i < out.length; i++) {
            out[i] = frames[i * stride];
        }
        return out;
    }

    /** Per-pixel median over the given frames. */
    public static double[] median(final double[][] y, final int[] frames) {
        final Median median = new Median();
        final double[] result = new double[y.length];
        final double[] values = new double[frames.length];
        for (int p = 0; p < y.length; p++) {
            for (int i = 0; i < frames.length; i++) {
                values[i] = y[p][frames[i]];
            }
            result[p] = median.evaluate(values);
        }
        return result;
    }

    /** Per-pixel (bias-corrected) temporal standard deviation over all frames. */
    public static double[] std(final double[][] y) {
        final StandardDeviation sd = new StandardDeviation();
        final double[] result = new double[y.length];
        for (int p = 0; p < y.length; p++) {
            result[p] = sd.evaluate(y[p]);
        }
        return result;
    }

    public static double max(final double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (final double v : values) {
            if (v > max) max = v;
        }
        return max;
    }

    public static double norm(final double[] values) {
        double sumSq = 0;
        for (final double v : values) {
            sumSq += v * v;
        }
        return Math.sqrt(sumSq);
    }

    public static double dot(final double[] a, final double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /**
     * Pearson correlation of two equally long series. Returns NaN when either
     * series is constant or shorter than two samples.
     */
    public static double pearson(final double[] a, final double[] b) {
        if (a.length < 2) return Double.NaN;
        return new PearsonsCorrelation().correlation(a, b);
    }

}
