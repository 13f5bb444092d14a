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

/**
 * What happened to a candidate seed pixel in one iteration of the peeling loop.
 */
public enum CandidateOutcome {

    /** The candidate became a new source */
    ACCEPTED,
    /** The correlation image at the candidate is below the minimum correlation */
    LOW_CORRELATION,
    /** Too few pixels around the candidate are coherent with it */
    TOO_FEW_PIXELS,
    /** The rank-1 factorization produced no positive spatial weight */
    EMPTY_FOOTPRINT

}
