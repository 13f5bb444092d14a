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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import sc.fiji.cnmfe.CNMFEUtils;
import sc.fiji.cnmfe.init.extract.Rank1Factor;
import sc.fiji.cnmfe.util.ImgUtils;
import sc.fiji.cnmfe.util.Logger;
import sc.fiji.cnmfe.util.SignalStats;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy, correlation-driven initialization of neuronal sources in
 * one-photon (endoscopic) calcium imaging data.
 * <p>
 * Sources are peeled off one at a time. At each step the pixel maximizing
 * {@code peak-to-noise ratio x local correlation} is selected as a seed; the
 * pixels of its neighborhood whose activity correlates with the seed form a
 * connected footprint; a rank-1 factorization of that neighborhood gives the
 * spatial weights and temporal trace of the new source, which is then
 * subtracted from the residual. The priority and correlation maps are updated
 * locally so that explained signal is not selected again.
 * </p>
 * <p>
 * Usage:
 * </p>
 * <pre>
 * InitOptions options = new InitOptions(d1, d2);
 * options.setGSig(3);
 * options.setGSiz(13);
 * options.setMinCorr(0.8);
 * GreedyCorrInitializer init = new GreedyCorrInitializer(y, options);
 * init.setVerbose(true);
 * InitResult result = init.initialize(200);
 * </pre>
 *
 * @see InitOptions
 * @see PeelingProgressCallback
 */
public class GreedyCorrInitializer implements SourceInitializer {

    private final double[][] y;
    private final InitOptions options;
    private final List<PeelingProgressCallback> progressListeners = new ArrayList<>();
    private double[] noise;
    private Logger logger;
    private boolean verbose = false;

    /**
     * @param y       pixels x frames signal matrix, pixel index {@code row + col * d1};
     *                copied, never modified
     * @param options options holding the frame dimensions
     * @throws IllegalArgumentException if the matrix is empty or ragged or does
     *                                  not match the options
     */
    public GreedyCorrInitializer(final double[][] y, final InitOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        this.y = copy(y);
        this.options = options;
        options.validate(this.y.length, this.y[0].length);
    }

    /**
     * Creates an initializer for a movie. The frame dimensions of
     * {@code options} are set from the movie.
     *
     * @param movie   rows x columns x frames (a 2D image is a single frame)
     * @param options initialization options
     */
    public GreedyCorrInitializer(final RandomAccessibleInterval<? extends RealType<?>> movie,
                                 final InitOptions options) {
        this(toMatrix(movie, options), options);
    }

    private static double[][] toMatrix(final RandomAccessibleInterval<? extends RealType<?>> movie,
                                       final InitOptions options) {
        if (movie == null) {
            throw new IllegalArgumentException("Movie cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        final double[][] y = ImgUtils.toPixelMatrix(movie);
        options.setDimensions((int) movie.dimension(0), (int) movie.dimension(1));
        return y;
    }

    private static double[][] copy(final double[][] y) {
        if (y == null || y.length == 0) {
            throw new IllegalArgumentException("Signal matrix is empty");
        }
        final int nFrames = (y[0] == null) ? 0 : y[0].length;
        if (nFrames == 0) {
            throw new IllegalArgumentException("Signal matrix has no frames");
        }
        final double[][] copy = new double[y.length][];
        for (int p = 0; p < y.length; p++) {
            if (y[p] == null || y[p].length != nFrames) {
                throw new IllegalArgumentException("Signal matrix is ragged: row " + p + " does not have "
                        + nFrames + " frames");
            }
            copy[p] = y[p].clone();
        }
        return copy;
    }

    /**
     * Sets the per-pixel noise level used to normalize peak amplitudes. If
     * unset (or set to null), the temporal standard deviation of each pixel
     * is used.
     *
     * @param noise noise level of every pixel, or null
     */
    public void setNoiseLevels(final double[] noise) {
        if (noise != null && noise.length != y.length) {
            throw new IllegalArgumentException("Noise vector has " + noise.length + " entries, expected " + y.length);
        }
        this.noise = (noise == null) ? null : noise.clone();
    }

    public void addProgressListener(final PeelingProgressCallback listener) {
        progressListeners.add(listener);
    }

    public void removeProgressListener(final PeelingProgressCallback listener) {
        progressListeners.remove(listener);
    }

    public InitOptions getOptions() {
        return options;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Sets verbose logging mode.
     *
     * @param verbose true to log progress through the SciJava LogService
     */
    public void setVerbose(final boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Peels off up to {@code maxSources} sources. Each call starts over from the
     * input matrix.
     *
     * @param maxSources maximum number of sources (K)
     * @return the result
     * @throws IllegalArgumentException if {@code maxSources} is negative or the
     *                                  options became invalid
     */
    @Override
    public InitResult initialize(final int maxSources) {
        if (maxSources < 0) {
            throw new IllegalArgumentException("Number of sources must not be negative: " + maxSources);
        }
        final int nFrames = y[0].length;
        options.validate(y.length, nFrames);
        log("Initializing up to " + maxSources + " sources: " + options);
        if (nFrames < 2) {
            CNMFEUtils.warn("Movie has a single frame: temporal correlations are undefined");
        }

        final double[] sn = (noise != null) ? noise : SignalStats.std(y);
        final PeelingState state = new PeelingState(y, sn, options);
        log("Correlation image built from " + state.frames.length + " frames (coarse scale: "
                + state.coarseFrames.length + " frames)");

        final List<SourceComponent> sources = new ArrayList<>();
        final TerminationReason reason = peel(state, maxSources, sources);

        final List<SourceComponent> clipped = new ArrayList<>(sources.size());
        for (final SourceComponent source : sources) {
            clipped.add(source.withNonNegativeTrace());
        }
        log("Done: " + sources.size() + " source(s) detected (" + reason + ")");
        for (final PeelingProgressCallback listener : progressListeners) {
            listener.finished(reason, sources.size());
        }
        return new InitResult(state.d1, state.d2, nFrames, options.getNb(), clipped,
                state.uncenteredResidual(), reason);
    }

    private TerminationReason peel(final PeelingState state, final int maxSources,
                                   final List<SourceComponent> sources) {
        if (maxSources == 0) return TerminationReason.BUDGET_REACHED;
        final double minCorr = options.getMinCorr();
        final double minScore = options.getStopMultiplier() * minCorr;
        final NeighborhoodCoherence coherence = new NeighborhoodCoherence(state.residual, state.d1, state.d2,
                options.getGSiz(), options.getPSiz(), minCorr);

        while (true) {
            final int pixel = state.selector.selectNext();
            final double score = state.selector.getLastScore();
            if (score < minScore) {
                return TerminationReason.SCORE_BELOW_THRESHOLD;
            }
            final int row = pixel % state.d1;
            final int col = pixel / state.d1;
            if (state.cn[pixel] < minCorr) {
                notifyCandidate(state, row, col, score, CandidateOutcome.LOW_CORRELATION, sources.size());
                continue;
            }

            final CoherentRegion region = coherence.evaluate(row, col);
            if (region.size() < options.getMinPixels()) {
                notifyCandidate(state, row, col, score, CandidateOutcome.TOO_FEW_PIXELS, sources.size());
                continue;
            }

            final PixelWindow window = region.getWindow();
            final boolean[] support = region.dilatedMask(options.getBSiz());
            final int[] supportPixels = window.globalIndices(support);
            state.selector.suppress(window, region.getCorrelations(), options.getHighConfidenceCorr());

            final double[][] patch = new double[supportPixels.length][];
            for (int i = 0; i < supportPixels.length; i++) {
                patch[i] = state.residual[supportPixels[i]];
            }
            final Rank1Factor factor = options.getExtractor().extract(patch, region.getSeedTrace());
            if (factor.isEmpty()) {
                notifyCandidate(state, row, col, score, CandidateOutcome.EMPTY_FOOTPRINT, sources.size());
                continue;
            }

            final SourceComponent source = new SourceComponent(sources.size() + 1, row, col, supportPixels,
                    factor.getSpatial(), factor.getTemporal());
            sources.add(source);
            state.subtract(supportPixels, factor.getSpatial(), factor.getTemporal());
            CNMFEUtils.log("Accepted " + source + ", score " + CNMFEUtils.formatDouble(score, 3));
            if (sources.size() % 10 == 0) {
                log(String.format("%d/%d neurons have been detected", sources.size(), maxSources));
            }
            if (sources.size() == maxSources) {
                notifyCandidate(state, row, col, score, CandidateOutcome.ACCEPTED, sources.size());
                return TerminationReason.BUDGET_REACHED;
            }

            state.selector.decay(window, support, state.residual, state.noise, options.getGSig());
            state.refreshCorrelation(window, options.isParallel());
            notifyCandidate(state, row, col, score, CandidateOutcome.ACCEPTED, sources.size());
        }
    }

    private void notifyCandidate(final PeelingState state, final int row, final int col, final double score,
                                 final CandidateOutcome outcome, final int nSources) {
        if (progressListeners.isEmpty()) return;
        for (final PeelingProgressCallback listener : progressListeners) {
            listener.candidateEvaluated(row, col, score, outcome, nSources);
            listener.priorityUpdated(state.selector.snapshot());
        }
    }

    /**
     * Logs a message if verbose mode is enabled.
     */
    protected void log(final String message) {
        if (!verbose) return;
        if (logger == null) {
            logger = new Logger(getClass());
        }
        logger.info(message);
    }

}
