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

import sc.fiji.cnmfe.init.extract.ClosedFormRank1Extractor;
import sc.fiji.cnmfe.init.extract.Rank1Extractor;

/**
 * Options controlling {@link GreedyCorrInitializer}. Each setter documents its
 * default. Options are checked by {@link #validate(int, int)} before
 * initialization starts.
 */
public class InitOptions {

    private int d1;
    private int d2;
    private int gSig = 3;
    private int gSiz = 13;
    private int nb = 1;
    private int bSiz = 1;
    private double minCorr = 0.8;
    private int pSiz = 1;
    private int minPixels = 4;
    private double highConfidenceCorr = 0.8;
    private double stopMultiplier = 3;
    private int maxCorrelationFrames = 1000;
    private int coarseFrameStride = 3;
    private boolean parallel = false;
    private Rank1Extractor extractor = new ClosedFormRank1Extractor();

    public InitOptions() {
    }

    /**
     * @param d1 number of rows of each frame
     * @param d2 number of columns of each frame
     */
    public InitOptions(final int d1, final int d2) {
        setDimensions(d1, d2);
    }

    /**
     * Sets the frame dimensions.
     *
     * @param d1 number of rows (image dimension 0)
     * @param d2 number of columns (image dimension 1)
     */
    public void setDimensions(final int d1, final int d2) {
        this.d1 = d1;
        this.d2 = d2;
    }

    public int getD1() {
        return d1;
    }

    public int getD2() {
        return d2;
    }

    /**
     * Sets the expected source radius, in pixels. It is used as the width of
     * the kernel that smooths priority updates and as the border margin in which
     * no source can be seeded. Default: 3
     */
    public void setGSig(final int gSig) {
        this.gSig = gSig;
    }

    public int getGSig() {
        return gSig;
    }

    /**
     * Sets the half-width of the neighborhood searched around each candidate,
     * in pixels. It also sets the radius of the coarse correlation ring.
     * Default: 13
     */
    public void setGSiz(final int gSiz) {
        this.gSiz = gSiz;
    }

    public int getGSiz() {
        return gSiz;
    }

    /**
     * Sets the number of background components. Background components are
     * returned as zero placeholders. Default: 1
     */
    public void setNb(final int nb) {
        this.nb = nb;
    }

    public int getNb() {
        return nb;
    }

    /**
     * Sets the radius of the disk used to dilate the support of each source.
     * Default: 1
     */
    public void setBSiz(final int bSiz) {
        this.bSiz = bSiz;
    }

    public int getBSiz() {
        return bSiz;
    }

    /**
     * Sets the minimum local correlation. Candidates whose correlation image
     * value is below it are skipped; pixels whose correlation with the seed
     * trace is at or below it are excluded from the source. Range: (0, 1];
     * Default: 0.8
     */
    public void setMinCorr(final double minCorr) {
        this.minCorr = minCorr;
    }

    public double getMinCorr() {
        return minCorr;
    }

    /**
     * Sets the half-width of the seed patch averaged into the seed trace.
     * Default: 1 (3x3 patch)
     */
    public void setPSiz(final int pSiz) {
        this.pSiz = pSiz;
    }

    public int getPSiz() {
        return pSiz;
    }

    /**
     * Sets the minimum number of coherent pixels a candidate needs. Default: 4
     */
    public void setMinPixels(final int minPixels) {
        this.minPixels = minPixels;
    }

    public int getMinPixels() {
        return minPixels;
    }

    /**
     * Sets the seed correlation above which neighborhood pixels are considered
     * explained and are never selected as candidates again. Default: 0.8
     */
    public void setHighConfidenceCorr(final double highConfidenceCorr) {
        this.highConfidenceCorr = highConfidenceCorr;
    }

    public double getHighConfidenceCorr() {
        return highConfidenceCorr;
    }

    /**
     * Sets the multiple of the minimum correlation below which the best
     * candidate score stops the whole search. Default: 3
     */
    public void setStopMultiplier(final double stopMultiplier) {
        this.stopMultiplier = stopMultiplier;
    }

    public double getStopMultiplier() {
        return stopMultiplier;
    }

    /**
     * Sets the maximum number of evenly spaced frames used to compute
     * correlation images and the baseline median. Default: 1000
     */
    public void setMaxCorrelationFrames(final int maxCorrelationFrames) {
        this.maxCorrelationFrames = maxCorrelationFrames;
    }

    public int getMaxCorrelationFrames() {
        return maxCorrelationFrames;
    }

    /**
     * Sets the stride applied to the correlation frames when computing the
     * coarse (background) correlation image. Default: 3
     */
    public void setCoarseFrameStride(final int coarseFrameStride) {
        this.coarseFrameStride = coarseFrameStride;
    }

    public int getCoarseFrameStride() {
        return coarseFrameStride;
    }

    /**
     * Sets whether correlation images are computed on multiple threads. Results
     * do not depend on this setting. Default: false
     */
    public void setParallel(final boolean parallel) {
        this.parallel = parallel;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Sets the strategy that factorizes each coherent patch. Default:
     * {@link ClosedFormRank1Extractor}
     */
    public void setExtractor(final Rank1Extractor extractor) {
        this.extractor = extractor;
    }

    public Rank1Extractor getExtractor() {
        return extractor;
    }

    /**
     * Checks these options against the data they will be applied to.
     *
     * @param nPixels number of pixels (rows of the signal matrix)
     * @param nFrames number of frames (columns of the signal matrix)
     * @throws IllegalArgumentException if any option is invalid
     */
    public void validate(final int nPixels, final int nFrames) {
        if (d1 <= 0 || d2 <= 0)
            throw new IllegalArgumentException("Frame dimensions must be positive: d1=" + d1 + ", d2=" + d2);
        if ((long) d1 * d2 != nPixels)
            throw new IllegalArgumentException("d1*d2 (" + d1 + "*" + d2 + ") does not match the number of pixels (" + nPixels + ")");
        if (nFrames <= 0)
            throw new IllegalArgumentException("Signal matrix has no frames");
        if (gSig <= 0)
            throw new IllegalArgumentException("gSig must be positive: " + gSig);
        if (gSiz <= 0)
            throw new IllegalArgumentException("gSiz must be positive: " + gSiz);
        if (nb < 0)
            throw new IllegalArgumentException("nb must not be negative: " + nb);
        if (bSiz < 0)
            throw new IllegalArgumentException("bSiz must not be negative: " + bSiz);
        if (pSiz < 0 || pSiz > gSiz)
            throw new IllegalArgumentException("pSiz must be in [0, gSiz]: " + pSiz);
        if (!(minCorr > 0 && minCorr <= 1))
            throw new IllegalArgumentException("min_corr must be in (0, 1]: " + minCorr);
        if (minPixels < 1)
            throw new IllegalArgumentException("minPixels must be at least 1: " + minPixels);
        if (Double.isNaN(highConfidenceCorr))
            throw new IllegalArgumentException("highConfidenceCorr must be a number");
        if (!(stopMultiplier > 0))
            throw new IllegalArgumentException("stopMultiplier must be positive: " + stopMultiplier);
        if (maxCorrelationFrames < 1)
            throw new IllegalArgumentException("maxCorrelationFrames must be at least 1: " + maxCorrelationFrames);
        if (coarseFrameStride < 1)
            throw new IllegalArgumentException("coarseFrameStride must be at least 1: " + coarseFrameStride);
        if (extractor == null)
            throw new IllegalArgumentException("Rank-1 extractor cannot be null");
    }

    @Override
    public String toString() {
        return "InitOptions[d1=" + d1 + ", d2=" + d2 + ", gSig=" + gSig + ", gSiz=" + gSiz + ", nb=" + nb
                + ", bSiz=" + bSiz + ", min_corr=" + minCorr + ", pSiz=" + pSiz + ", minPixels=" + minPixels
                + ", highConfidenceCorr=" + highConfidenceCorr + ", stopMultiplier=" + stopMultiplier
                + ", maxCorrelationFrames=" + maxCorrelationFrames + ", coarseFrameStride=" + coarseFrameStride
                + ", parallel=" + parallel + ", extractor=" + extractor + "]";
    }
}
