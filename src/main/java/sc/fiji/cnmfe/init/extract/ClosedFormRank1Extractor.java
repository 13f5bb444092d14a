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

import sc.fiji.cnmfe.util.SignalStats;

/**
 * Closed-form non-negative least squares for the spatial factor with the
 * temporal factor fixed to the seed trace:
 * {@code a = max(0, (data+ . c) / (c . c))}, where {@code data+} is the
 * non-negative part of the patch. The seed trace is returned unchanged as the
 * temporal factor.
 */
public class ClosedFormRank1Extractor implements Rank1Extractor {

    @Override
    public Rank1Factor extract(final double[][] patch, final double[] seedTrace) {
        return new Rank1Factor(spatialWeights(patch, seedTrace), seedTrace.clone());
    }

    /**
     * Non-negative projection of each patch row (negatives clipped) onto a trace.
     * A zero trace yields zero weights.
     */
    static double[] spatialWeights(final double[][] patch, final double[] trace) {
        final double[] weights = new double[patch.length];
        final double energy = SignalStats.dot(trace, trace);
        if (!(energy > 0)) return weights;
        for (int i = 0; i < patch.length; i++) {
            double proj = 0;
            final double[] row = patch[i];
            for (int t = 0; t < row.length; t++) {
                if (row[t] > 0) proj += row[t] * trace[t];
            }
            weights[i] = Math.max(0, proj / energy);
        }
        return weights;
    }

    @Override
    public String toString() {
        return "closed-form";
    }

}
