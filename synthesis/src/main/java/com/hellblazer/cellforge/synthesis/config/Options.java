/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Cellforge.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cellforge.synthesis.config;

/**
 * Conversion options affecting how cells are built.
 *
 * @param enlargeBox     padding added to a cell's bounding box before comparing its surfaces, so that the cell's own
 *                       bounding surfaces cross the region rather than touch its border
 * @param forceNoOverlap subtract earlier solid cells from later ones so no two solid cells overlap
 * @author hal.hildebrand
 */
public record Options(double enlargeBox, boolean forceNoOverlap) {

    public Options {
        if (!(enlargeBox >= 0) || Double.isInfinite(enlargeBox)) {
            throw new IllegalArgumentException("enlargeBox must be finite and non negative: " + enlargeBox);
        }
    }

    public static Options getDefault() {
        return new Options(2.0, false);
    }

    public Options withEnlargeBox(double enlargeBox) {
        return new Options(enlargeBox, forceNoOverlap);
    }

    public Options withForceNoOverlap(boolean forceNoOverlap) {
        return new Options(enlargeBox, forceNoOverlap);
    }
}
