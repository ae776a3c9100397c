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
package com.hellblazer.cellforge.synthesis.surface;

import javax.vecmath.Point3d;

/**
 * One signed side of a surface, in geometric form. Sense +1 is the positive side of the canonical function, -1 the
 * negative side.
 *
 * @author hal.hildebrand
 */
public record HalfSpace(Surface surface, int sense) {

    public HalfSpace {
        if (sense != 1 && sense != -1) {
            throw new IllegalArgumentException("Sense must be +1 or -1: " + sense);
        }
    }

    public HalfSpace complement() {
        return new HalfSpace(surface, -sense);
    }

    /**
     * Value of the canonical function oriented so that the half-space is where it is positive
     */
    public double signedValue(Point3d point) {
        return sense * surface.evaluate(point);
    }
}
