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

package sc.fiji.cnmfe.init.extract;

/**
 * Strategy that factorizes a patch of signal into a single non-negative
 * spatial weight vector and a temporal trace.
 * <p>
 * Implementations include the closed-form projection used by default
 * ({@link ClosedFormRank1Extractor}) and an iterative block-coordinate-descent
 * refinement ({@link FineTuneRank1Extractor}).
 * </p>
 */
public interface Rank1Extractor {

    /**
     * Factorizes {@code patch ~ spatial * temporal}.
     *
     * @param patch     signal of the support pixels, {@code [pixel][frame]}; not modified
     * @param seedTrace non-negative initial temporal trace; not modified
     * @return the factorization; {@link Rank1Factor#isEmpty()} if no positive
     * spatial weight could be found
     */
    Rank1Factor extract(double[][] patch, double[] seedTrace);

}
