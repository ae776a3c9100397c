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
package com.hellblazer.cellforge.synthesis.kernel.analytic;

import com.hellblazer.cellforge.synthesis.surface.Surface;

/**
 * One face of an analytic solid: the surface it lies on and the side of that surface the material occupies
 *
 * @author hal.hildebrand
 */
public record BoundingFace(Surface surface, int sense) {

    public BoundingFace {
        if (surface == null) {
            throw new IllegalArgumentException("Surface must not be null");
        }
        if (sense != 1 && sense != -1) {
            throw new IllegalArgumentException("Sense must be +1 or -1: " + sense);
        }
    }

    public static BoundingFace inside(Surface surface) {
        return new BoundingFace(surface, -1);
    }

    public static BoundingFace outside(Surface surface) {
        return new BoundingFace(surface, 1);
    }
}
