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

import java.util.Arrays;

/**
 * A source accepted by the peeling loop: its spatial footprint over a support
 * of frame pixels, its temporal trace and the pixel it was seeded from.
 */
public class SourceComponent {

    private final int index;
    private final int row;
    private final int col;
    private final int[] support;
    private final double[] weights;
    private final double[] trace;

    /**
     * @param index   1-based acceptance order
     * @param row     seed row
     * @param col     seed column
     * @param support frame indices of the footprint support, ascending
     * @param weights footprint weight of each support pixel
     * @param trace   temporal trace
     */
    public SourceComponent(final int index, final int row, final int col, final int[] support,
                           final double[] weights, final double[] trace) {
        if (support.length != weights.length) {
            throw new IllegalArgumentException("Support and weights differ in length");
        }
        this.index = index;
        this.row = row;
        this.col = col;
        this.support = support;
        this.weights = weights;
        this.trace = trace;
    }

    public int getIndex() {
        return index;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * @return {row, col} of the seed pixel
     */
    public int[] getCenter() {
        return new int[]{row, col};
    }

    public int[] getSupport() {
        return support.clone();
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double[] getTrace() {
        return trace.clone();
    }

    /**
     * @return the footprint weight of a frame pixel, 0 outside the support
     */
    public double getFootprint(final int pixel) {
        final int i = Arrays.binarySearch(support, pixel);
        return (i < 0) ? 0 : weights[i];
    }

    /**
     * @return the footprint as a dense column-major frame
     */
    public double[] getFootprint(final int nPixels) {
        final double[] footprint = new double[nPixels];
        for (int i = 0; i < support.length; i++) {
            footprint[support[i]] = weights[i];
        }
        return footprint;
    }

    /**
     * @return a copy of this source with negative trace values set to 0
     */
    SourceComponent withNonNegativeTrace() {
        final double[] clipped = new double[trace.length];
        for (int t = 0; t < trace.length; t++) {
            clipped[t] = Math.max(0, trace[t]);
        }
        return new SourceComponent(index, row, col, support, weights, clipped);
    }

    @Override
    public String toString() {
        return "Source #" + index + " at (" + row + ", " + col + "), " + support.length + " px";
    }
}
