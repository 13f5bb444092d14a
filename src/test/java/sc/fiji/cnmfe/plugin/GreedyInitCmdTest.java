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

package sc.fiji.cnmfe.plugin;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scijava.Context;
import org.scijava.command.CommandModule;
import org.scijava.command.CommandService;
import org.scijava.log.LogService;
import sc.fiji.cnmfe.util.ImgUtils;

import static org.junit.Assert.*;

/**
 * Tests for {@link GreedyInitCmd}
 */
public class GreedyInitCmdTest {

	private static final int D1 = 15;
	private static final int D2 = 15;
	private static final int N_FRAMES = 60;

	private Context context;

	@Before
	public void setUp() {
		context = new Context(CommandService.class, LogService.class);
	}

	@After
	public void tearDown() {
		context.dispose();
	}

	@Test
	public void testRun() throws Exception {
		final Img<DoubleType> movie = neuronMovie();
		final CommandModule module = context.getService(CommandService.class).run(GreedyInitCmd.class, false,
				"input", movie, "maxSources", 5, "gSig", 2, "gSiz", 4, "minCorr", 0.5, "bSiz", 1, "nb", 1,
				"extractorChoice", GreedyInitCmd.EXTRACTOR_CLOSED_FORM, "parallel", false, "verbose", false).get();
		assertEquals(1, module.getOutput("nSources"));
		@SuppressWarnings("unchecked")
		final Img<DoubleType> footprints = (Img<DoubleType>) module.getOutput("footprints");
		assertEquals(D1, footprints.dimension(0));
		assertEquals(D2, footprints.dimension(1));
		assertEquals(1, footprints.dimension(2));
		@SuppressWarnings("unchecked")
		final Img<DoubleType> traces = (Img<DoubleType>) module.getOutput("traces");
		assertEquals("One column per source", 1, traces.dimension(0));
		assertEquals("One row per frame", N_FRAMES, traces.dimension(1));
		@SuppressWarnings("unchecked")
		final Img<DoubleType> residual = (Img<DoubleType>) module.getOutput("residual");
		assertEquals(N_FRAMES, residual.dimension(2));
	}

	@Test
	public void testMinPixelsAndEmptyOutputs() throws Exception {
		// the 9-pixel neuron is too small to be accepted
		final CommandModule module = context.getService(CommandService.class).run(GreedyInitCmd.class, false,
				"input", neuronMovie(), "maxSources", 5, "gSig", 2, "gSiz", 4, "minCorr", 0.5,
				"minPixels", 10).get();
		assertEquals(0, module.getOutput("nSources"));
		@SuppressWarnings("unchecked")
		final Img<DoubleType> footprints = (Img<DoubleType>) module.getOutput("footprints");
		assertEquals(1, footprints.dimension(2));
		@SuppressWarnings("unchecked")
		final Img<DoubleType> traces = (Img<DoubleType>) module.getOutput("traces");
		assertNotNull("Empty runs still yield a trace table", traces);
		assertEquals(1, traces.dimension(0));
		assertEquals(N_FRAMES, traces.dimension(1));
		for (final DoubleType v : traces) {
			assertEquals(0, v.get(), 0);
		}
	}

	@Test
	public void testFineTuneIterations() throws Exception {
		final CommandService commands = context.getService(CommandService.class);
		final CommandModule module = commands.run(GreedyInitCmd.class, false,
				"input", neuronMovie(), "maxSources", 5, "gSig", 2, "gSiz", 4, "minCorr", 0.5,
				"extractorChoice", GreedyInitCmd.EXTRACTOR_FINE_TUNE,
				"fineTuneIterations", 2).get();
		assertEquals(1, module.getOutput("nSources"));

		final CommandModule invalid = commands.run(GreedyInitCmd.class, false,
				"input", neuronMovie(), "extractorChoice", GreedyInitCmd.EXTRACTOR_FINE_TUNE,
				"fineTuneIterations", 0).get();
		assertNull("Zero iterations are rejected", invalid.getOutput("footprints"));
	}

	@Test
	public void testInvalidSettingsAreReported() throws Exception {
		final Img<DoubleType> movie = ImgUtils.toMovie(new double[4][3], 2, 2);
		final CommandModule module = context.getService(CommandService.class).run(GreedyInitCmd.class, false,
				"input", movie, "maxSources", -1).get();
		assertNull(module.getOutput("footprints"));
		assertEquals(0, module.getOutput("nSources"));
	}

	/* 3x3 neuron at (7,7), active every 10 frames */
	private static Img<DoubleType> neuronMovie() {
		final double[][] y = new double[D1 * D2][N_FRAMES];
		for (int c = 6; c <= 8; c++) {
			for (int r = 6; r <= 8; r++) {
				for (int t = 0; t < N_FRAMES; t++) {
					y[r + c * D1][t] = (t % 10 == 3) ? 10 : (t % 10 == 4) ? 4 : 0;
				}
			}
		}
		return ImgUtils.toMovie(y, D1, D2);
	}

}
