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

package sc.fiji.cnmfe.init.extract;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Block-coordinate-descent refinement of a rank-1 factorization.
 * <p>
 * Starting from the seed trace, each round solves for the spatial weights
 * given the trace (non-negative projection, then unit norm) and for the trace
 * given the weights (non-negative projection). After the last round, trace
 * values below {@code median - 2 * std} are raised to that bound.
 * </p>
 */
public class FineTuneRank1Extractor implements Rank1Extractor {

    /** Default number of descent rounds */
    public static final int DEFAULT_ITERATIONS = 5;

    private final int iterations;

    public FineTuneRank1Extractor() {
        this(DEFAULT_ITERATIONS);
    }

    /**
     * @param iterations number of descent rounds (at least 1)
     */
    public FineTuneRank1Extractor(final int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Number of iterations must be at least 1: " + iterations);
        }
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public Rank1Factor extract(final double[][] patch, final double[] seedTrace) {
        final int nFrames = seedTrace.length;
        double[] trace = seedTrace.clone();
        double[] weights = new double[patch.length];
        for (int iter = 0; iter < iterations; iter++) {
            weights = ClosedFormRank1Extractor.spatialWeights(patch, trace);
            double norm = 0;
            for (final double w : weights) {
                norm += w * w;
            }
            norm = Math.sqrt(norm);
            if (norm == 0) break;
            for (int i = 0; i < weights.length; i++) {
                weights[i] /= norm;
            }
            // weights have unit norm: the projection needs no rescaling
            trace = new double[nFrames];
            for (int i = 0; i < patch.length; i++) {
                final double w = weights[i];
                if (w == 0) continue;
                final double[] row = patch[i];
                for (int t = 0; t < nFrames; t++) {
                    if (row[t] > 0) trace[t] += w * row[t];
                }
            }
        }
        clipLowerTail(trace);
        return new Rank1Factor(weights, trace);
    }

    private static void clipLowerTail(final double[] trace) {
        final DescriptiveStatistics stats = new DescriptiveStatistics(trace);
        final double floor = stats.getPercentile(50) - 2 * stats.getStandardDeviation();
        for (int t = 0; t < trace.length; t++) {
            if (trace[t] < floor) trace[t] = floor;
        }
    }

    @Override
    public String toString() {
        return "fine-tune (" + iterations + " iterations)";
    }

}
