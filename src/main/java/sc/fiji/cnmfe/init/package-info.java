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

/**
 * Greedy correlation-based initialization of neuronal sources in one-photon
 * calcium imaging movies.
 * <p>
 * Sources are detected one at a time ("peeled off") from a pixels x frames
 * signal matrix: a seed pixel is chosen by peak-to-noise ratio and local
 * correlation, a spatially coherent neighborhood is grown around it, and a
 * rank-1 factorization gives the footprint and trace that are subtracted
 * before the next seed is chosen.
 * </p>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link sc.fiji.cnmfe.init.GreedyCorrInitializer} - the peeling loop</li>
 *   <li>{@link sc.fiji.cnmfe.init.InitOptions} - tunable parameters</li>
 *   <li>{@link sc.fiji.cnmfe.init.InitResult} - footprints, traces, centers and residual</li>
 *   <li>{@link sc.fiji.cnmfe.init.CorrelationImage} - local correlation images</li>
 *   <li>{@link sc.fiji.cnmfe.init.NeighborhoodCoherence} - coherent region growing</li>
 *   <li>{@link sc.fiji.cnmfe.init.PeakSelector} - seed selection and priority bookkeeping</li>
 * </ul>
 */
package sc.fiji.cnmfe.init;
