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
package com.hellblazer.cellforge.synthesis.bool;

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.kernel.HalfSpaceOracle;
import com.hellblazer.cellforge.synthesis.kernel.Position;
import com.hellblazer.cellforge.synthesis.kernel.Relation;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;

/**
 * Builds the comparison table of a set of surfaces over a region by asking the geometry oracle. Only surfaces that
 * cross the region are compared pairwise; the others are constants there.
 *
 * @author hal.hildebrand
 */
public class ComparisonTableBuilder {
    private static final Logger log = LoggerFactory.getLogger(ComparisonTableBuilder.class);

    private final HalfSpaceOracle oracle;
    private final SurfaceRegistry registry;

    public ComparisonTableBuilder(HalfSpaceOracle oracle, SurfaceRegistry registry) {
        this.oracle = oracle;
        this.registry = registry;
    }

    public ComparisonTable build(Collection<Integer> surfaces, Box region) {
        var table = new ComparisonTable();
        var crossing = new ArrayList<Integer>();
        for (var surface : surfaces) {
            var id = Math.abs(surface);
            var position = oracle.position(registry.halfSpace(id), region);
            table.setPosition(id, position);
            if (position == Position.CROSSES) {
                crossing.add(id);
            }
        }
        for (int i = 0; i < crossing.size(); i++) {
            var a = crossing.get(i);
            for (int j = i + 1; j < crossing.size(); j++) {
                var b = crossing.get(j);
                compare(table, a, b, region);
                compare(table, -a, b, region);
            }
        }
        if (log.isTraceEnabled()) {
            log.trace("{} over {} surfaces ({} crossing) in {}", table, surfaces.size(), crossing.size(), region);
        }
        return table;
    }

    private void compare(ComparisonTable table, int a, int b, Box region) {
        var relation = oracle.booleanRelation(registry.halfSpace(a), registry.halfSpace(b), region);
        if (relation == Relation.IMPLIES) {
            table.addImplication(a, b);
        } else if (relation == Relation.EXCLUDES) {
            table.addImplication(a, -b);
        }
    }
}
