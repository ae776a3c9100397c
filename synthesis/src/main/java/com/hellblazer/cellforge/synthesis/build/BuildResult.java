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
package com.hellblazer.cellforge.synthesis.build;

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.bool.CellDefinition;

import java.util.List;

/**
 * Outcome of building one cell definition
 *
 * @param cones    the cone references of the cell, null if it has none
 * @param warnings degenerate or unclassified faces met while building, empty when the solid converted cleanly
 * @param bounds   union of the fragment bounds
 * @author hal.hildebrand
 */
public record BuildResult(CellDefinition definition, ConeRecord cones, List<String> warnings, Box bounds) {

    public BuildResult {
        warnings = List.copyOf(warnings);
    }

    public boolean warning() {
        return !warnings.isEmpty();
    }
}
