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

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import sc.fiji.cnmfe.util.ImgUtils;
import sc.fiji.cnmfe.util.SparseMatrix;

import java.util.Collections;
import java.util.List;

/**
 * Output of a {@link SourceInitializer}: the accepted sources, zero background
 * placeholders and the unexplained residual.
 * <p>
 * Matrix accessors return the backing arrays; callers that modify them do so
 * at their own risk.
 * </p>
 */
public class InitResult {

    private final int d1;
    private final int d2;
    private final int nFrames;
    private final List<SourceComponent> components;
    private final SparseMatrix footprints;
    private final double[][] traces;
    private final double[][] backgroundFootprints;
    private final double[][] backgroundTraces;
    private final double[][] residual;
    private final TerminationReason terminationReason;

    InitResult(final int d1, final int d2, final int nFrames, final int nb, final List<SourceComponent> components,
               final double[][] residual, final TerminationReason terminationReason) {
        this.d1 = d1;
        this.d2 = d2;
        this.nFrames = nFrames;
        this.components = Collections.unmodifiableList(components);
        this.residual = residual;
        this.terminationReason = terminationReason;
        footprints = new SparseMatrix(d1 * d2, components.size());
        traces = new double[components.size()][];
        for (int k = 0; k < components.size(); k++) {
            final SourceComponent source = components.get(k);
            final int[] support = source.getSupport();
            final double[] weights = source.getWeights();
            for (int i = 0; i < support.length; i++) {
                footprints.setValue(support[i], k, weights[i]);
            }
            traces[k] = source.getTrace();
        }
        backgroundFootprints = new double[d1 * d2][nb];
        backgroundTraces = new double[nb][nFrames];
    }

    /**
     * @return the number of accepted sources
     */
    public int size() {
        return components.size();
    }

    public List<SourceComponent> getComponents() {
        return components;
    }

    /**
     * @return pixels x sources matrix of spatial footprints
     */
    public SparseMatrix getFootprints() {
        return footprints;
    }

    /**
     * @return sources x frames matrix of non-negative temporal traces
     */
    public double[][] getTraces() {
        return traces;
    }

    /**
     * @return pixels x nb spatial background placeholder (all zeros)
     */
    public double[][] getBackgroundFootprints() {
        return backgroundFootprints;
    }

    /**
     * @return nb x frames temporal background placeholder (all zeros)
     */
    public double[][] getBackgroundTraces() {
        return backgroundTraces;
    }

    /**
     * @return sources x 2 matrix of seed positions, {row, col} per source
     */
    public int[][] getCenters() {
        final int[][] centers = new int[components.size()][];
        for (int k = 0; k < centers.length; k++) {
            centers[k] = components.get(k).getCenter();
        }
        return centers;
    }

    /**
     * @return pixels x frames residual, including the per-pixel median removed
     * before peeling
     */
    public double[][] getResidual() {
        return residual;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    public int getD1() {
        return d1;
    }

    public int getD2() {
        return d2;
    }

    public int getNumFrames() {
        return nFrames;
    }

    /**
     * @param k 0-based source position
     * @return the footprint of source {@code k} as a d1 x d2 image
     */
    public Img<DoubleType> footprintImg(final int k) {
        return ImgUtils.toImg(footprints.columnAsArray(k), d1, d2);
    }

    /**
     * @return all footprints stacked as a d1 x d2 x sources image
     */
    public Img<DoubleType> footprintStack() {
        final double[][] stack = new double[d1 * d2][Math.max(1, components.size())];
        for (int k = 0; k < components.size(); k++) {
            for (final int p : footprints.nonZeroRows(k)) {
                stack[p][k] = footprints.getValue(p, k);
            }
        }
        return ImgUtils.toMovie(stack, d1, d2);
    }

    /**
     * @return the residual as a d1 x d2 x frames image
     */
    public Img<DoubleType> residualImg() {
        return ImgUtils.toMovie(residual, d1, d2);
    }

    @Override
    public String toString() {
        return "InitResult[" + components.size() + " sources, " + d1 + "x" + d2 + "x" + nFrames + ", "
                + terminationReason + "]";
    }
}
