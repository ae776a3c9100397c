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

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.surface.HalfSpace;

/**
 * Geometric predicates over half-spaces restricted to a box, the raw material of the simplifier's comparison tables.
 *
 * @author hal.hildebrand
 */
public interface HalfSpaceOracle {

    /**
     * Relation of half-space a to half-space b within the region
     */
    Relation booleanRelation(HalfSpace a, HalfSpace b, Box region);

    /**
     * Position of the region with respect to the half-space
     */
    Position position(HalfSpace halfSpace, Box region);
}
