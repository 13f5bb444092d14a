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

import ij.plugin.filter.RankFilters;
import ij.process.ByteProcessor;

/**
 * The outcome of a neighborhood coherence test around one candidate pixel: the
 * seed trace, its correlation with every pixel of the search window and the
 * connected set of pixels that is coherent with the seed.
 */
public class CoherentRegion {

    private final int row;
    private final int col;
    private final PixelWindow window;
    private final double[] seedTrace;
    private final double[] correlations;
    private final boolean[] mask;
    private final int size;

    CoherentRegion(final int row, final int col, final PixelWindow window, final double[] seedTrace,
                   final double[] correlations, final boolean[] mask) {
        this.row = row;
        this.col = col;
        this.window = window;
        this.seedTrace = seedTrace;
        this.correlations = correlations;
        this.mask = mask;
        int count = 0;
        for (final boolean b : mask) {
            if (b) count++;
        }
        this.size = count;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public PixelWindow getWindow() {
        return window;
    }

    /**
     * @return the non-negative mean trace of the seed patch
     */
    public double[] getSeedTrace() {
        return seedTrace;
    }

    /**
     * @return correlation of the seed trace with each window pixel (local order);
     * NaN for constant pixels
     */
    public double[] getCorrelations() {
        return correlations;
    }

    /**
     * @return the coherent component containing the seed (local order)
     */
    public boolean[] getMask() {
        return mask;
    }

    /**
     * @return the number of coherent pixels
     */
    public int size() {
        return size;
    }

    /**
     * Grows the coherent component by a disk, staying inside the window.
     *
     * @param radius disk radius in pixels; 0 returns a copy of the mask
     * @return the dilated mask (local order)
     */
    public boolean[] dilatedMask(final int radius) {
        if (radius <= 0) return mask.clone();
        final int nr = window.rows();
        // x runs along rows so that the pixel array keeps the column-major order
        final ByteProcessor bp = new ByteProcessor(nr, window.cols());
        for (int l = 0; l < mask.length; l++) {
            if (mask[l]) bp.set(l % nr, l / nr, 255);
        }
        // ImageJ's circular mask holds dx^2 + dy^2 <= floor(r^2) + 1
        new RankFilters().rank(bp, Math.sqrt(radius * radius - 0.5), RankFilters.MAX);
        final boolean[] out = new boolean[mask.length];
        for (int l = 0; l < out.length; l++) {
            out[l] = bp.get(l % nr, l / nr) != 0;
        }
        return out;
    }

}
