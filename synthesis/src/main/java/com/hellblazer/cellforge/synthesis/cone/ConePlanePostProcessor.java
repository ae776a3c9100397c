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
package com.hellblazer.cellforge.synthesis.cone;

import com.hellblazer.cellforge.synthesis.bool.CellDefinition;
import com.hellblazer.cellforge.synthesis.build.ConePatch;
import com.hellblazer.cellforge.synthesis.build.ConeRecord;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Restricts cone references to a single nappe. The implicit cone is double: its inside covers both nappes, so every
 * inside reference {@code -c} is narrowed to {@code -c p}, and every outside reference {@code +c} widened to
 * {@code +c : -p}, where p is the side of the plane through the apex that holds the nappe of the face.
 * <p>
 * Solid cells use the record taken when they were built. Void cells use the inverted records of the cells they were
 * carved from, and a void filling an enclosure also the record of the enclosure itself; cells without a record
 * contribute nothing.
 *
 * @author hal.hildebrand
 */
public class ConePlanePostProcessor {
    private static final Logger log = LoggerFactory.getLogger(ConePlanePostProcessor.class);

    /**
     * Patch one definition in place
     *
     * @return the number of references patched
     */
    public int patch(CellDefinition definition, ConeRecord record) {
        var patched = 0;
        for (var patch : record.patches()) {
            patched += patch(definition, patch);
        }
        return patched;
    }

    /**
     * Patch the solid and void cells of a run
     *
     * @param records cone records of the solid cells by identity
     * @return the number of references patched
     */
    public <S> int patch(Collection<SolidEntity<S>> cells, Map<Integer, ConeRecord> records) {
        return patch(cells, records, Map.of());
    }

    /**
     * Patch the solid and void cells of a run
     *
     * @param records          cone records of the solid cells by identity
     * @param enclosureRecords cone records of the enclosure cells by enclosure id
     * @return the number of references patched
     */
    public <S> int patch(Collection<SolidEntity<S>> cells, Map<Integer, ConeRecord> records,
                         Map<Integer, ConeRecord> enclosureRecords) {
        var patched = 0;
        for (var cell : cells) {
            if (cell.isNullCell() || cell.getDefinition() == null) {
                continue;
            }
            ConeRecord record;
            if (cell.isVoid()) {
                if (cell.getOrigin() == null) {
                    continue;
                }
                var sources = new ArrayList<ConeRecord>();
                var enclosure = enclosureRecords.get(cell.getOrigin().enclosureId());
                if (enclosure != null) {
                    sources.add(enclosure);
                }
                for (var identity : cell.getOrigin().identities()) {
                    var source = records.get(identity);
                    if (source != null) {
                        sources.add(source.inverted());
                    }
                }
                record = ConeRecord.merge(sources);
            } else {
                record = records.get(cell.getIdentity());
            }
            if (record == null || record.isEmpty()) {
                continue;
            }
            var count = patch(cell.getDefinition(), record);
            if (count > 0) {
                log.debug("Patched {} cone references of cell {}", count, cell.getIdentity());
            }
            patched += count;
        }
        return patched;
    }

    private int patch(CellDefinition definition, ConePatch patch) {
        var cone = patch.cone();
        var plane = patch.planeLiteral();
        var inside = CellDefinition.intersection(-cone, plane);
        var outside = CellDefinition.union(
        List.of(CellDefinition.leaf(cone), CellDefinition.leaf(-plane)));
        var count = 0;
        if (patch.coneLiteral() < 0) {
            count += definition.replaceLiteral(-cone, inside);
        } else {
            count += definition.replaceLiteral(cone, outside);
        }
        return count;
    }
}
