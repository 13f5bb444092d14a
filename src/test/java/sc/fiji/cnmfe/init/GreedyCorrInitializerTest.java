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
import org.junit.Test;
import sc.fiji.cnmfe.init.extract.ClosedFormRank1Extractor;
import sc.fiji.cnmfe.init.extract.FineTuneRank1Extractor;
import sc.fiji.cnmfe.init.extract.Rank1Extractor;
import sc.fiji.cnmfe.util.ImgUtils;
import sc.fiji.cnmfe.util.SignalStats;
import sc.fiji.cnmfe.util.SparseMatrix;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Tests for {@link GreedyCorrInitializer}
 */
public class GreedyCorrInitializerTest {

    private static final int T = 100;

    private static InitOptions smallNeuronOptions(final int d1, final int d2) {
        final InitOptions options = new InitOptions(d1, d2);
        options.setGSig(2);
        options.setGSiz(5);
        options.setBSiz(1);
        options.setMinCorr(0.3);
        return options;
    }

    private static GreedyCorrInitializer unitNoise(final double[][] y, final InitOptions options) {
        final GreedyCorrInitializer init = new GreedyCorrInitializer(y, options);
        init.setNoiseLevels(SyntheticMovie.ones(y.length));
        return init;
    }

    @Test
    public void testFlatSinglePixelYieldsNothing() {
        final double[][] y = {{0, 0, 0}};
        final InitResult result = new GreedyCorrInitializer(y, new InitOptions(1, 1)).initialize(5);
        assertEquals(0, result.size());
        assertEquals(TerminationReason.SCORE_BELOW_THRESHOLD, result.getTerminationReason());
        assertEquals(0, result.getFootprints().numColumns());
        assertEquals(0, result.getTraces().length);
        assertEquals(0, result.getCenters().length);
        assertArrayEquals(new double[]{0, 0, 0}, result.getResidual()[0], 0);
        assertEquals(1, result.getBackgroundFootprints().length);
        assertEquals(1, result.getBackgroundFootprints()[0].length);
        assertArrayEquals(new double[]{0, 0, 0}, result.getBackgroundTraces()[0], 0);
    }

    @Test
    public void testSingleIsolatedSource() {
        final SyntheticMovie movie = new SyntheticMovie(21, 21, T);
        final double[] footprint = movie.bump(10, 10, 3, 2);
        final double[] trace = SyntheticMovie.spikes(T, 20, 0);
        movie.add(footprint, 10, trace);

        final InitResult result = unitNoise(movie.matrix(), smallNeuronOptions(21, 21)).initialize(3);
        assertEquals("# Sources", 1, result.size());
        assertEquals(TerminationReason.SCORE_BELOW_THRESHOLD, result.getTerminationReason());
        assertArrayEquals(new int[]{10, 10}, result.getCenters()[0]);
        assertEquals(1, result.getComponents().get(0).getIndex());
        assertEquals("Trace follows the injected activity", 1,
                SignalStats.pearson(result.getTraces()[0], trace), 1e-9);

        // the footprint covers the bump and is proportional to it
        final SparseMatrix a = result.getFootprints();
        final double center = a.getValue(movie.index(10, 10), 0);
        assertTrue(center > 0);
        for (int p = 0; p < footprint.length; p++) {
            if (footprint[p] > 0) {
                assertEquals(footprint[p], a.getValue(p, 0) / center, 1e-9);
            }
        }
        // everything was explained
        for (final double[] row : result.getResidual()) {
            for (final double v : row) {
                assertEquals(0, v, 1e-9);
            }
        }
    }

    @Test
    public void testDefaultNoiseLevels() {
        final SyntheticMovie movie = new SyntheticMovie(21, 21, T);
        movie.add(movie.bump(10, 10, 3, 2), 10, SyntheticMovie.spikes(T, 20, 0));
        final InitResult result = new GreedyCorrInitializer(movie.matrix(), smallNeuronOptions(21, 21)).initialize(3);
        assertEquals(1, result.size());
        final int[] center = result.getCenters()[0];
        assertTrue(Math.abs(center[0] - 10) <= 1 && Math.abs(center[1] - 10) <= 1);
    }

    @Test
    public void testTwoDistantSources() {
        final SyntheticMovie movie = twoDistantSources();
        final InitResult result = unitNoise(movie.matrix(), smallNeuronOptions(17, 31)).initialize(3);
        assertEquals("# Sources", 2, result.size());
        assertArrayEquals("Brightest first", new int[]{8, 8}, result.getCenters()[0]);
        assertArrayEquals(new int[]{8, 22}, result.getCenters()[1]);
        final SparseMatrix a = result.getFootprints();
        for (final int p : a.nonZeroRows(0)) {
            assertEquals("Disjoint supports", 0, a.getValue(p, 1), 0);
        }
        assertEquals(1, SignalStats.pearson(result.getTraces()[1], SyntheticMovie.spikes(T, 13, 0)), 1e-9);
    }

    @Test
    public void testBudgetStopsLoop() {
        final SyntheticMovie movie = twoDistantSources();
        final InitResult result = unitNoise(movie.matrix(), smallNeuronOptions(17, 31)).initialize(1);
        assertEquals(1, result.size());
        assertEquals(TerminationReason.BUDGET_REACHED, result.getTerminationReason());
        assertArrayEquals(new int[]{8, 8}, result.getCenters()[0]);

        final InitResult none = unitNoise(movie.matrix(), smallNeuronOptions(17, 31)).initialize(0);
        assertEquals(0, none.size());
        assertEquals(TerminationReason.BUDGET_REACHED, none.getTerminationReason());
    }

    @Test
    public void testAdjacentSourcesAreSeparated() {
        final SyntheticMovie movie = new SyntheticMovie(21, 21, T);
        final double[] left = movie.bump(10, 10, 1.5, 1.5);
        final double[] right = movie.bump(10, 14, 1.5, 1.5);
        movie.add(left, 10, SyntheticMovie.spikes(T, 20, 0, 50));
        movie.add(right, 6, SyntheticMovie.spikes(T, 20, 50, 100));

        final InitResult result = unitNoise(movie.matrix(), smallNeuronOptions(21, 21)).initialize(3);
        assertEquals("# Sources", 2, result.size());
        assertArrayEquals(new int[]{10, 10}, result.getCenters()[0]);
        assertArrayEquals(new int[]{10, 14}, result.getCenters()[1]);
        final SparseMatrix a = result.getFootprints();
        for (final int p : a.nonZeroRows(0)) {
            assertEquals("Left footprint leaks into right neuron", 0, right[p], 0);
        }
        for (final int p : a.nonZeroRows(1)) {
            assertEquals("Right footprint leaks into left neuron", 0, left[p], 0);
        }
    }

    @Test
    public void testOverlappingSourcesAreSeparated() {
        final SyntheticMovie movie = new SyntheticMovie(21, 21, T);
        final double[] left = movie.bump(10, 9, 3, 2);
        final double[] right = movie.bump(10, 12, 3, 2);
        int shared = 0;
        for (int p = 0; p < left.length; p++) {
            if (left[p] > 0 && right[p] > 0) shared++;
        }
        assertTrue("Bumps share pixels", shared > 0);
        movie.add(left, 10, SyntheticMovie.spikes(T, 20, 0, 50));
        movie.add(right, 8, SyntheticMovie.spikes(T, 20, 50, 100));
        final double[][] y = movie.matrix();

        final List<double[]> afterAcceptance = new ArrayList<>();
        final GreedyCorrInitializer init = unitNoise(y, smallNeuronOptions(21, 21));
        init.addProgressListener(new PeelingProgressCallback() {
            private CandidateOutcome last;

            @Override
            public void candidateEvaluated(final int row, final int col, final double score,
                                           final CandidateOutcome outcome, final int nSources) {
                last = outcome;
            }

            @Override
            public void priorityUpdated(final double[] priority) {
                if (last == CandidateOutcome.ACCEPTED) afterAcceptance.add(priority);
            }

            @Override
            public void finished(final TerminationReason reason, final int nSources) {
                assertEquals(TerminationReason.SCORE_BELOW_THRESHOLD, reason);
            }
        });
        final InitResult result = init.initialize(3);
        assertEquals("# Sources", 2, result.size());
        assertArrayEquals(new int[]{10, 9}, result.getCenters()[0]);
        assertArrayEquals(new int[]{10, 12}, result.getCenters()[1]);
        assertTrue("Second center survives the suppression around the first",
                afterAcceptance.get(0)[movie.index(10, 12)] > 0);

        final SparseMatrix a = result.getFootprints();
        boolean overlap = false;
        for (final int p : a.nonZeroRows(0)) {
            if (a.getValue(p, 1) > 0) overlap = true;
        }
        assertTrue("Footprints share support pixels", overlap);
        assertExplained(y, result, "overlapping sources");
    }

    @Test
    public void testResidualConservation() {
        assertConservation(new ClosedFormRank1Extractor());
        assertConservation(new FineTuneRank1Extractor());
    }

    private static InitOptions noisyOptions() {
        final InitOptions options = smallNeuronOptions(20, 20);
        options.setMinCorr(0.4);
        return options;
    }

    private static void assertConservation(final Rank1Extractor extractor) {
        final InitOptions options = noisyOptions();
        options.setExtractor(extractor);
        final double[][] y = noisyMovie().matrix();
        final InitResult result = new GreedyCorrInitializer(y, options).initialize(10);
        assertTrue("Bright neuron found", result.size() >= 1);
        assertTrue(result.size() <= 10);
        assertExplained(y, result, extractor.toString());
    }

    /* residual + A C reproduces the input */
    private static void assertExplained(final double[][] y, final InitResult result, final String label) {
        final double[][] residual = result.getResidual();
        final double[][] traces = result.getTraces();
        final SparseMatrix a = result.getFootprints();
        for (int p = 0; p < y.length; p++) {
            for (int t = 0; t < y[p].length; t++) {
                double model = residual[p][t];
                for (int k = 0; k < result.size(); k++) {
                    model += a.getValue(p, k) * traces[k][t];
                }
                assertEquals(label + ": pixel " + p + ", frame " + t, y[p][t], model, 1e-8);
            }
        }
    }

    @Test
    public void testNonNegativeOutputs() {
        final InitResult result = new GreedyCorrInitializer(noisyMovie().matrix(), noisyOptions()).initialize(10);
        for (final double[] trace : result.getTraces()) {
            for (final double v : trace) {
                assertTrue(v >= 0);
            }
        }
        for (int k = 0; k < result.size(); k++) {
            for (final int p : result.getFootprints().nonZeroRows(k)) {
                assertTrue(result.getFootprints().getValue(p, k) > 0);
            }
            assertEquals(k + 1, result.getComponents().get(k).getIndex());
        }
    }

    @Test
    public void testPriorityNeverIncreases() {
        final List<double[]> snapshots = new ArrayList<>();
        final List<CandidateOutcome> outcomes = new ArrayList<>();
        final TerminationReason[] finished = new TerminationReason[1];
        final GreedyCorrInitializer init = new GreedyCorrInitializer(noisyMovie().matrix(), noisyOptions());
        init.addProgressListener(new PeelingProgressCallback() {
            @Override
            public void candidateEvaluated(final int row, final int col, final double score,
                                           final CandidateOutcome outcome, final int nSources) {
                outcomes.add(outcome);
            }

            @Override
            public void priorityUpdated(final double[] priority) {
                snapshots.add(priority);
            }

            @Override
            public void finished(final TerminationReason reason, final int nSources) {
                finished[0] = reason;
            }
        });
        final InitResult result = init.initialize(10);
        assertEquals(result.getTerminationReason(), finished[0]);
        assertEquals(outcomes.size(), snapshots.size());
        assertEquals(result.size(), outcomes.stream().filter(o -> o == CandidateOutcome.ACCEPTED).count());
        for (int i = 1; i < snapshots.size(); i++) {
            final double[] before = snapshots.get(i - 1);
            final double[] after = snapshots.get(i);
            for (int p = 0; p < after.length; p++) {
                assertTrue("Priority of pixel " + p + " increased", after[p] <= before[p]);
            }
        }
    }

    @Test
    public void testRepeatedRunsAndInputUntouched() {
        final double[][] y = noisyMovie().matrix();
        final double[][] original = noisyMovie().matrix();
        final GreedyCorrInitializer init = new GreedyCorrInitializer(y, noisyOptions());
        final InitResult first = init.initialize(10);
        final InitResult second = init.initialize(10);
        assertEquals(first.size(), second.size());
        for (int k = 0; k < first.size(); k++) {
            assertArrayEquals(first.getCenters()[k], second.getCenters()[k]);
            assertArrayEquals(first.getTraces()[k], second.getTraces()[k], 0);
        }
        for (int p = 0; p < y.length; p++) {
            assertArrayEquals(original[p], y[p], 0);
        }
    }

    @Test
    public void testMovieInput() {
        final SyntheticMovie movie = twoDistantSources();
        final Img<DoubleType> img = ImgUtils.toMovie(movie.matrix(), 17, 31);
        final InitOptions options = smallNeuronOptions(0, 0);
        final GreedyCorrInitializer init = new GreedyCorrInitializer(img, options);
        assertEquals(17, options.getD1());
        assertEquals(31, options.getD2());
        init.setNoiseLevels(SyntheticMovie.ones(17 * 31));
        final InitResult result = init.initialize(3);
        assertEquals(2, result.size());
        assertArrayEquals(new int[]{8, 22}, result.getCenters()[1]);
        final Img<DoubleType> footprint = result.footprintImg(1);
        assertEquals(17, footprint.dimension(0));
        assertEquals(31, footprint.dimension(1));
        assertEquals(T, result.residualImg().dimension(2));
    }

    @Test
    public void testVerboseRun() {
        final SyntheticMovie movie = new SyntheticMovie(21, 21, T);
        movie.add(movie.bump(10, 10, 3, 2), 10, SyntheticMovie.spikes(T, 20, 0));
        final GreedyCorrInitializer init = unitNoise(movie.matrix(), smallNeuronOptions(21, 21));
        init.setVerbose(true);
        assertTrue(init.isVerbose());
        assertEquals(1, init.initialize(3).size());
    }

    @Test
    public void testInvalidInput() {
        assertInvalid(() -> new GreedyCorrInitializer((double[][]) null, new InitOptions(1, 1)));
        assertInvalid(() -> new GreedyCorrInitializer(new double[0][], new InitOptions(1, 1)));
        assertInvalid(() -> new GreedyCorrInitializer(new double[][]{{1, 2}, {1}}, new InitOptions(2, 1)));
        assertInvalid(() -> new GreedyCorrInitializer(new double[][]{{1, 2}, {3, 4}}, new InitOptions(3, 1)));
        final GreedyCorrInitializer init = new GreedyCorrInitializer(new double[][]{{1, 2}, {3, 4}},
                new InitOptions(2, 1));
        assertInvalid(() -> init.initialize(-1));
        assertInvalid(() -> init.setNoiseLevels(new double[3]));
        init.getOptions().setMinCorr(0);
        assertInvalid(() -> init.initialize(1));
    }

    private static void assertInvalid(final Runnable runnable) {
        try {
            runnable.run();
            fail("Expected IllegalArgumentException");
        } catch (final IllegalArgumentException expected) {
            assertNotNull(expected.getMessage());
        }
    }

    private static SyntheticMovie twoDistantSources() {
        final SyntheticMovie movie = new SyntheticMovie(17, 31, T);
        movie.add(movie.bump(8, 8, 3, 2), 10, SyntheticMovie.spikes(T, 20, 0));
        movie.add(movie.bump(8, 22, 3, 2), 8, SyntheticMovie.spikes(T, 13, 0));
        return movie;
    }

    private static SyntheticMovie noisyMovie() {
        final SyntheticMovie movie = new SyntheticMovie(20, 20, T);
        movie.add(movie.bump(9, 9, 3, 2), 20, SyntheticMovie.spikes(T, 20, 0));
        movie.add(movie.bump(5, 15, 2, 1.5), 12, SyntheticMovie.spikes(T, 17, 3));
        movie.addNoise(1, 42);
        movie.addOffset(5);
        return movie;
    }

}
