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

import java.util.List;

/**
 * A convex piece of a decomposed solid: the intersection of the half-spaces behind its faces
 *
 * @param <F> the kernel's face type
 * @author hal.hildebrand
 */
public record ConvexFragment<F>(List<F> faces) {

    public ConvexFragment {
        faces = List.copyOf(faces);
    }
}
