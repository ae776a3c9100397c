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
package com.hellblazer.cellforge.synthesis.overlap;

import com.hellblazer.cellforge.synthesis.bool.BooleanSimplifier;
import com.hellblazer.cellforge.synthesis.bool.CellDefinition;
import com.hellblazer.cellforge.synthesis.bool.ComparisonTableBuilder;
import com.hellblazer.cellforge.synthesis.bool.SimplifyOutcome;
import com.hellblazer.cellforge.synthesis.build.ConeRecord;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.cone.ConePlanePostProcessor;
import com.hellblazer.cellforge.synthesis.config.Options;
import com.hellblazer.cellforge.synthesis.kernel.HalfSpaceOracle;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Makes solid cells pairwise disjoint: each cell loses the parts it shares with the cells listed before it. The
 * subtraction uses the definitions as built, so later cells are not burdened with the subtractions of earlier ones.
 * A subtracted cell with cone references is restricted to its nappes first, since its complement is no longer
 * reached by the cone records of the cell it was subtracted from.
 *
 * @author hal.hildebrand
 */
public class OverlapResolver {
    private static final Logger log = LoggerFactory.getLogger(OverlapResolver.class);

    private final ComparisonTableBuilder tables;
    private final BooleanSimplifier      simplifier = new BooleanSimplifier();
    private final ConePlanePostProcessor nappes     = new ConePlanePostProcessor();
    private final Options                options;

    public OverlapResolver(HalfSpaceOracle oracle, SurfaceRegistry registry, Options options) {
        this.tables = new ComparisonTableBuilder(oracle, registry);
        this.options = options;
    }

    /**
     * @return the cells that became empty, marked null
     */
    public <S> List<SolidEntity<S>> resolve(List<SolidEntity<S>> solids) {
        return resolve(solids, Map.of());
    }

    /**
     * @param records cone records of the solid cells by identity
     * @return the cells that became empty, marked null
     */
    public <S> List<SolidEntity<S>> resolve(List<SolidEntity<S>> solids, Map<Integer, ConeRecord> records) {
        var emptied = new ArrayList<SolidEntity<S>>();
        var earlier = new ArrayList<SolidEntity<S>>();
        var built = new ArrayList<CellDefinition>();
        for (var cell : solids) {
            if (cell.isNullCell() || cell.isEnclosure()) {
                continue;
            }
            var original = cell.getDefinition().copy();
            var definition = cell.getDefinition();
            var subtracted = 0;
            for (int i = 0; i < earlier.size(); i++) {
                if (earlier.get(i).getBounds().intersects(cell.getBounds())) {
                    definition.intersectWith(built.get(i).complement());
                    subtracted++;
                }
            }
            var record = records.get(cell.getIdentity());
            if (record != null) {
                nappes.patch(original, record);
            }
            earlier.add(cell);
            built.add(original);
            if (subtracted == 0) {
                continue;
            }
            var region = cell.getBounds().enlarged(options.enlargeBox());
            var outcome = simplifier.simplify(definition, tables.build(definition.surfaces(), region));
            log.debug("Cell {} minus {} earlier cells: {}", cell.getIdentity(), subtracted, outcome);
            if (outcome == SimplifyOutcome.EMPTY) {
                cell.markNull();
                emptied.add(cell);
            }
        }
        return emptied;
    }
}
