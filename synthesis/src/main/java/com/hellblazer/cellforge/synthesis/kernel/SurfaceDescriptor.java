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
package com.hellblazer.cellforge.synthesis.kernel;

import com.hellblazer.cellforge.synthesis.surface.Surface;

/**
 * Classification of one face of a convex fragment.
 *
 * @param surface    the analytic surface carrying the face
 * @param sense      side of the surface's canonical function the fragment's material lies on, +1 or -1
 * @param classified false when the kernel could only produce a best effort approximation of the face
 * @author hal.hildebrand
 */
public record SurfaceDescriptor(Surface surface, int sense, boolean classified) {

    public SurfaceDescriptor {
        if (surface == null) {
            throw new IllegalArgumentException("Surface must not be null");
        }
        if (sense != 1 && sense != -1) {
            throw new IllegalArgumentException("Sense must be +1 or -1: " + sense);
        }
    }

    public static SurfaceDescriptor of(Surface surface, int sense) {
        return new SurfaceDescriptor(surface, sense, true);
    }

    public static SurfaceDescriptor approximate(Surface surface, int sense) {
        return new SurfaceDescriptor(surface, sense, false);
    }
}
