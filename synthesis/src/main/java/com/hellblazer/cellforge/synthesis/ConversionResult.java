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

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Everything a serializer needs from a conversion run
 *
 * @param entries     numbered cells and delimiters in output order
 * @param registry    the surfaces the cells refer to
 * @param boundingBox the padded box of the model, the universe of the void cells
 * @param timings     wall time per stage
 * @author hal.hildebrand
 */
public record ConversionResult<S>(List<OrderedEntry> entries, SurfaceRegistry registry, Box boundingBox,
                                  List<Diagnostic> diagnostics, Map<Diagnostic.Stage, Duration> timings) {

    public ConversionResult {
        entries = List.copyOf(entries);
        diagnostics = List.copyOf(diagnostics);
        timings = Map.copyOf(timings);
    }

    /**
     * The numbered cells, in output order
     */
    @SuppressWarnings("unchecked")
    public List<SolidEntity<S>> cells() {
        return entries.stream()
                      .filter(OrderedEntry.CellEntry.class::isInstance)
                      .map(e -> (SolidEntity<S>) ((OrderedEntry.CellEntry) e).cell())
                      .toList();
    }

    public List<SolidEntity<S>> solidCells() {
        return cells().stream().filter(c -> !c.isVoid()).toList();
    }

    public List<SolidEntity<S>> voidCells() {
        return cells().stream().filter(SolidEntity::isVoid).toList();
    }
}
