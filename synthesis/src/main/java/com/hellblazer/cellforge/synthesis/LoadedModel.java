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
package com.hellblazer.cellforge.synthesis;

import com.hellblazer.cellforge.synthesis.cell.SolidEntity;

import java.util.List;

/**
 * The solids and enclosures read from one CAD model
 *
 * @author hal.hildebrand
 */
public record LoadedModel<S>(List<SolidEntity<S>> solids, List<SolidEntity<S>> enclosures) {

    public LoadedModel {
        solids = List.copyOf(solids);
        enclosures = List.copyOf(enclosures);
        if (solids.stream().anyMatch(SolidEntity::isEnclosure)) {
            throw new IllegalArgumentException("Enclosures must be listed as enclosures");
        }
        if (enclosures.stream().anyMatch(e -> !e.isEnclosure())) {
            throw new IllegalArgumentException("Only enclosure cells may be listed as enclosures");
        }
    }

    public static <S> LoadedModel<S> of(List<SolidEntity<S>> solids) {
        return new LoadedModel<>(solids, List.of());
    }
}
