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

import sc.fiji.cnmfe.util.SignalStats;

/**
 * Rank-1 factor of a signal patch: non-negative spatial weights (one per patch
 * pixel) and a temporal trace (one value per frame).
 */
public class Rank1Factor {

    private final double[] spatial;
    private final double[] temporal;

    public Rank1Factor(final double[] spatial, final double[] temporal) {
        this.spatial = spatial;
        this.temporal = temporal;
    }

    public double[] getSpatial() {
        return spatial;
    }

    public double[] getTemporal() {
        return temporal;
    }

    /**
     * @return true if all spatial weights are zero
     */
    public boolean isEmpty() {
        return SignalStats.norm(spatial) == 0;
    }

}
