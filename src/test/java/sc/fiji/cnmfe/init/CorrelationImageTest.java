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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Tests for {@link CorrelationImage}
 */
public class CorrelationImageTest {

	private static final int[] ALL_FRAMES = {0, 1, 2, 3, 4, 5};

	@Test
	public void testRingOffsets() {
		final int[][] fine = CorrelationImage.ringOffsets(1, 2);
		assertEquals("8-neighborhood", 8, fine.length);
		for (final int[] o : fine) {
			assertTrue(Math.abs(o[0]) <= 1 && Math.abs(o[1]) <= 1);
		}
		assertEquals("Ring of radius [5, 6)", 40, CorrelationImage.ringOffsets(5, 6).length);
	}

	@Test
	public void testCoherentPatch() {
		// 3x3 frame, all pixels carry scaled copies of the same trace
		final double[] trace = {0, 1, 3, 2, 0, 5};
		final double[][] y = new double[9][];
		for (int p = 0; p < 9; p++) {
			y[p] = new double[trace.length];
			for (int t = 0; t < trace.length; t++) {
				y[p][t] = (p + 1) * trace[t] + p;
			}
		}
		final double[] cn = CorrelationImage.compute(y, ALL_FRAMES, 3, 3, CorrelationImage.ringOffsets(1, 2), false);
		for (final double v : cn) {
			assertEquals(1, v, 1e-12);
		}
	}

	@Test
	public void testConstantAndAntiCorrelatedNeighbors() {
		// 1x3 frame: trace, its negation, a constant
		final double[][] y = {
				{1, 2, 0, 4, 1, 3},
				{-1, -2, 0, -4, -1, -3},
				{7, 7, 7, 7, 7, 7}
		};
		final double[] cn = CorrelationImage.compute(y, ALL_FRAMES, 1, 3, CorrelationImage.ringOffsets(1, 2), false);
		assertEquals(-1, cn[0], 1e-12);
		assertEquals("Constant neighbor counts as zero", -0.5, cn[1], 1e-12);
		assertEquals("Constant pixel", 0, cn[2], 0);
	}

	@Test
	public void testIsolatedPixel() {
		final double[][] y = {{1, 5, 2, 8, 0, 3}};
		final double[] cn = CorrelationImage.compute(y, ALL_FRAMES, 1, 1, CorrelationImage.ringOffsets(1, 2), false);
		assertEquals(0, cn[0], 0);
	}

	@Test
	public void testWindowTreatsEdgesAsBorders() {
		final SyntheticMovie movie = new SyntheticMovie(9, 9, 40);
		movie.addNoise(1, 7);
		final double[][] y = movie.matrix();
		final int[] frames = allFrames(40);
		final int[][] offsets = CorrelationImage.ringOffsets(1, 2);
		final double[] full = CorrelationImage.compute(y, frames, 9, 9, offsets, false);

		final PixelWindow whole = PixelWindow.frame(9, 9);
		assertArrayEquals(full, CorrelationImage.compute(y, whole, frames, offsets, false), 0);

		final PixelWindow window = PixelWindow.around(4, 4, 2, 9, 9);
		final double[] local = CorrelationImage.compute(y, window, frames, offsets, false);
		assertEquals(25, local.length);
		// the window center sees the same neighbors as in the full frame
		assertEquals(full[movie.index(4, 4)], local[window.localIndex(4, 4)], 1e-12);
		// a window corner has lost its outer neighbors
		assertNotEquals(full[movie.index(2, 2)], local[window.localIndex(2, 2)], 1e-12);
	}

	@Test
	public void testParallelMatchesSequential() {
		final SyntheticMovie movie = new SyntheticMovie(15, 12, 30);
		movie.addNoise(2, 11);
		final double[][] y = movie.matrix();
		final int[] frames = allFrames(30);
		final int[][] offsets = CorrelationImage.ringOffsets(5, 6);
		final double[] sequential = CorrelationImage.compute(y, frames, 15, 12, offsets, false);
		assertArrayEquals(sequential, CorrelationImage.compute(y, frames, 15, 12, offsets, true), 0);
		assertArrayEquals("Pure function", sequential, CorrelationImage.compute(y, frames, 15, 12, offsets, false), 0);
	}

	private static int[] allFrames(final int n) {
		final int[] frames = new int[n];
		for (int t = 0; t < n; t++) frames[t] = t;
		return frames;
	}

}
