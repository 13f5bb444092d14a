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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.scijava.ItemIO;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.widget.ChoiceWidget;
import org.scijava.widget.NumberWidget;
import sc.fiji.cnmfe.CNMFEUtils;
import sc.fiji.cnmfe.init.GreedyCorrInitializer;
import sc.fiji.cnmfe.init.InitOptions;
import sc.fiji.cnmfe.init.InitResult;
import sc.fiji.cnmfe.init.extract.ClosedFormRank1Extractor;
import sc.fiji.cnmfe.init.extract.FineTuneRank1Extractor;
import sc.fiji.cnmfe.util.ImgUtils;

/**
 * Command exposing {@link GreedyCorrInitializer} to scripts and the SciJava
 * GUI. Takes a rows x columns x frames movie and outputs the footprints
 * (rows x columns x sources), the traces (frames x sources table) and the
 * residual movie.
 */
@Plugin(type = Command.class, label = "CNMF-E: Greedy Source Initialization...")
public class GreedyInitCmd implements Command {

    static final String EXTRACTOR_CLOSED_FORM = "Closed form (seed trace)";
    static final String EXTRACTOR_FINE_TUNE = "Fine-tune (coordinate descent)";

    @Parameter
    private LogService logService;

    @Parameter(label = "Movie", description = "<HTML>Calcium imaging movie: rows x columns x frames")
    private RandomAccessibleInterval<? extends RealType<?>> input;

    @Parameter(label = "Max. number of sources", min = "0", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Maximum number of sources (K) to extract.<br>" +
                    "Default: 100")
    private int maxSources = 100;

    @Parameter(label = "Neuron radius (gSig)", min = "1", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Approximate radius of a neuron, in pixels. Also used as the<br>" +
                    "border margin and the width of the priority smoothing kernel.<br>" +
                    "Default: 3")
    private int gSig = 3;

    @Parameter(label = "Search half-width (gSiz)", min = "1", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Half-width of the search window around each seed, in pixels.<br>" +
                    "Default: 13")
    private int gSiz = 13;

    @Parameter(label = "Min. local correlation", min = "0.01", max = "1", stepSize = "0.05",
            style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Pixels must correlate above this value with the seed.<br>" +
                    "<b>Lower</b>: more, dimmer sources.<br>" +
                    "<b>Higher</b>: fewer, cleaner sources.<br>" +
                    "Range: (0, 1]; Default: 0.8")
    private double minCorr = 0.8;

    @Parameter(label = "Footprint dilation (bSiz)", min = "0", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Radius of the disk used to grow each footprint support.<br>" +
                    "Default: 1")
    private int bSiz = 1;

    @Parameter(label = "Background components (nb)", min = "0", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Number of (zero) background placeholders.<br>Default: 1")
    private int nb = 1;

    @Parameter(label = "Seed half-width (pSiz)", min = "0", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Half-width of the patch averaged into the seed trace.<br>" +
                    "Must not exceed gSiz. Default: 1")
    private int pSiz = 1;

    @Parameter(label = "Min. pixels per source", min = "0", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Candidates whose coherent region has fewer pixels are rejected.<br>" +
                    "Default: 4")
    private int minPixels = 4;

    @Parameter(label = "Suppression correlation", min = "0", max = "1", stepSize = "0.05",
            style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Pixels correlating above this value with an accepted seed<br>" +
                    "are never picked as seeds again.<br>" +
                    "Default: 0.8")
    private double highConfidenceCorr = 0.8;

    @Parameter(label = "Stop multiplier", min = "0.01", stepSize = "0.5", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>The search stops once the best seed score falls below<br>" +
                    "<i>Stop multiplier x Min. local correlation</i>.<br>" +
                    "<b>Lower</b>: keeps searching among weak peaks.<br>" +
                    "Default: 3")
    private double stopMultiplier = 3;

    @Parameter(label = "Frames for correlation image", min = "1", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Maximum number of evenly spaced frames used to compute<br>" +
                    "the local correlation image.<br>" +
                    "Default: 1000")
    private int maxCorrelationFrames = 1000;

    @Parameter(label = "Background frame stride", min = "1", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Only every n-th of those frames enters the correlation<br>" +
                    "with the background ring.<br>" +
                    "Default: 3")
    private int coarseFrameStride = 3;

    @Parameter(label = "Rank-1 extraction", choices = {EXTRACTOR_CLOSED_FORM, EXTRACTOR_FINE_TUNE},
            style = ChoiceWidget.RADIO_BUTTON_VERTICAL_STYLE)
    private String extractorChoice = EXTRACTOR_CLOSED_FORM;

    @Parameter(label = "Fine-tune iterations", min = "1", style = NumberWidget.SPINNER_STYLE,
            description = "<HTML>Alternating footprint/trace updates of the fine-tune extraction.<br>" +
                    "Ignored by the closed form. Default: 5")
    private int fineTuneIterations = FineTuneRank1Extractor.DEFAULT_ITERATIONS;

    @Parameter(label = "Parallel correlation image")
    private boolean parallel;

    @Parameter(label = "Verbose")
    private boolean verbose;

    @Parameter(type = ItemIO.OUTPUT, label = "Footprints")
    private Img<DoubleType> footprints;

    @Parameter(type = ItemIO.OUTPUT, label = "Traces")
    private Img<DoubleType> traces;

    @Parameter(type = ItemIO.OUTPUT, label = "Residual")
    private Img<DoubleType> residual;

    @Parameter(type = ItemIO.OUTPUT, label = "Number of sources")
    private int nSources;

    @Override
    public void run() {
        if (input == null) {
            error("No movie given", null);
            return;
        }
        final InitOptions options = new InitOptions();
        options.setGSig(gSig);
        options.setGSiz(gSiz);
        options.setMinCorr(minCorr);
        options.setBSiz(bSiz);
        options.setNb(nb);
        options.setPSiz(pSiz);
        options.setMinPixels(minPixels);
        options.setHighConfidenceCorr(highConfidenceCorr);
        options.setStopMultiplier(stopMultiplier);
        options.setMaxCorrelationFrames(maxCorrelationFrames);
        options.setCoarseFrameStride(coarseFrameStride);
        options.setParallel(parallel);
        try {
            options.setExtractor(EXTRACTOR_FINE_TUNE.equals(extractorChoice)
                    ? new FineTuneRank1Extractor(fineTuneIterations) : new ClosedFormRank1Extractor());
            final GreedyCorrInitializer initializer = new GreedyCorrInitializer(input, options);
            initializer.setVerbose(verbose);
            final InitResult result = initializer.initialize(maxSources);
            nSources = result.size();
            footprints = result.footprintStack();
            traces = ImgUtils.toTableImg(traceTable(result));
            residual = result.residualImg();
            logService.info("[CNMF-E] " + nSources + " source(s) detected");
        } catch (final IllegalArgumentException ex) {
            error("Invalid initialization settings: " + ex.getMessage(), ex);
        }
    }

    private void error(final String msg, final Throwable t) {
        if (logService == null) {
            CNMFEUtils.error(msg, t);
        } else if (t == null) {
            logService.error("[CNMF-E] " + msg);
        } else {
            logService.error("[CNMF-E] " + msg, t);
        }
    }

    /* frames x sources, so that each source becomes a table column. A single zero column if nothing was found */
    private static double[][] traceTable(final InitResult result) {
        final double[][] c = result.getTraces();
        final double[][] t = new double[result.getNumFrames()][Math.max(1, c.length)];
        for (int k = 0; k < c.length; k++) {
            for (int f = 0; f < c[k].length; f++) {
                t[f][k] = c[k][f];
            }
        }
        return t;
    }

    public Img<DoubleType> getFootprints() {
        return footprints;
    }

    public Img<DoubleType> getTraces() {
        return traces;
    }

    public Img<DoubleType> getResidual() {
        return residual;
    }

    public int getNumSources() {
        return nSources;
    }

}
