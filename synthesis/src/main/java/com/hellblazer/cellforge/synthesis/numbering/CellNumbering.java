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
package com.hellblazer.cellforge.synthesis.numbering;

import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.config.EnclosureAttribution;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.CellEntry;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.Delimiter;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final labels and output order of the cells. Null cells and enclosure cells are not emitted and consume no label.
 * Labels are handed out in emission order starting at offset + 1; only once every label is known are the void
 * comments rebuilt from their origins, so no cross reference is read while labels are being assigned.
 * <p>
 * Flat order is the solids, the void section delimiter, the voids. Grouped order nests each enclosure's solids, child
 * enclosures and local voids between an open and a close delimiter, the block sitting where its first solid would
 * have been; enclosures without solids close their parent's block.
 *
 * @author hal.hildebrand
 */
public class CellNumbering {
    private static final Logger log = LoggerFactory.getLogger(CellNumbering.class);

    private final int                  offset;
    private final boolean              grouped;
    private final EnclosureAttribution attribution;

    public CellNumbering(int offset, boolean grouped, EnclosureAttribution attribution) {
        if (offset < 0) {
            throw new IllegalArgumentException("Cell offset must not be negative: " + offset);
        }
        this.offset = offset;
        this.grouped = grouped;
        this.attribution = attribution;
    }

    public <S> List<OrderedEntry> number(List<SolidEntity<S>> solids, List<SolidEntity<S>> voids,
                                         List<SolidEntity<S>> enclosures) {
        var run = new Run<S>(solids, voids, enclosures);
        var entries = grouped && !enclosures.isEmpty() ? run.grouped() : run.flat();
        for (var cell : voids) {
            if (cell.getLabel() != 0 && cell.getOrigin() != null) {
                cell.setComment(cell.getOrigin().comment(run.labels));
            }
        }
        log.info("Numbered {} cells, labels {} to {}", run.next - offset, offset + 1, run.next);
        return entries;
    }

    /**
     * State of one numbering run
     */
    private class Run<S> {
        final Map<Integer, Integer>            labels   = new HashMap<>();
        final List<OrderedEntry>               entries  = new ArrayList<>();
        final List<SolidEntity<S>>             solids;
        final List<SolidEntity<S>>             voids;
        final Map<Integer, SolidEntity<S>>     byId     = new LinkedHashMap<>();
        final Map<Integer, List<Slot<S>>>      contents = new HashMap<>();
        int                                    next     = offset;

        Run(List<SolidEntity<S>> solids, List<SolidEntity<S>> voids, List<SolidEntity<S>> enclosures) {
            this.solids = solids;
            this.voids = voids;
            for (var enclosure : enclosures) {
                byId.put(enclosure.getEnclosureId(), enclosure);
            }
        }

        List<OrderedEntry> flat() {
            for (var solid : solids) {
                emit(solid);
            }
            entries.add(new Delimiter(Kind.VOID_CELLS, 0));
            for (var cell : voids) {
                emit(cell);
            }
            return entries;
        }

        List<OrderedEntry> grouped() {
            contents.put(0, new ArrayList<>());
            for (var solid : solids) {
                if (solid.isNullCell() || solid.isEnclosure()) {
                    continue;
                }
                var enclosure = attribute(solid);
                place(enclosure);
                contents.get(enclosure).add(new Slot<>(solid, 0));
            }
            byId.keySet().forEach(this::place);
            emitBlock(0);
            entries.add(new Delimiter(Kind.VOID_CELLS, 0));
            for (var cell : voids) {
                if (!byId.containsKey(cell.getEnclosureId())) {
                    emit(cell);
                }
            }
            return entries;
        }

        private int attribute(SolidEntity<S> solid) {
            var chosen = 0;
            var chosenDepth = -1;
            for (var id : solid.getEnclosures()) {
                if (!byId.containsKey(id)) {
                    continue;
                }
                var depth = depth(id);
                var better = switch (attribution) {
                    case OUTERMOST_FIRST -> chosenDepth < 0 || depth < chosenDepth;
                    case INNERMOST_FIRST -> chosenDepth < 0 || depth > chosenDepth;
                    case FIRST_DECLARED -> chosenDepth < 0;
                };
                if (better) {
                    chosen = id;
                    chosenDepth = depth;
                }
            }
            return chosen;
        }

        private int depth(int enclosureId) {
            var depth = 0;
            var current = enclosureId;
            while (current != 0) {
                if (++depth > byId.size()) {
                    throw new IllegalArgumentException("Enclosure nesting cycle through enclosure " + enclosureId);
                }
                current = parent(current);
            }
            return depth;
        }

        private void emit(SolidEntity<S> cell) {
            if (cell.isNullCell() || cell.isEnclosure()) {
                return;
            }
            cell.setLabel(++next);
            labels.put(cell.getIdentity(), next);
            entries.add(new CellEntry(cell));
        }

        private void emitBlock(int enclosureId) {
            for (var slot : contents.get(enclosureId)) {
                if (slot.cell() == null) {
                    var child = slot.enclosureId();
                    entries.add(new Delimiter(Kind.ENCLOSURE_OPEN, child));
                    emitBlock(child);
                    for (var cell : voids) {
                        if (cell.getEnclosureId() == child) {
                            emit(cell);
                        }
                    }
                    entries.add(new Delimiter(Kind.ENCLOSURE_CLOSE, child));
                } else {
                    emit(slot.cell());
                }
            }
        }

        private int parent(int enclosureId) {
            var parent = byId.get(enclosureId).getParentEnclosureId();
            if (parent != 0 && !byId.containsKey(parent)) {
                log.warn("Enclosure {} has unknown parent {}, treated as top level", enclosureId, parent);
                return 0;
            }
            return parent;
        }

        /**
         * Make sure the enclosure's block exists, appending it to its parent's content on first sight
         */
        private void place(int enclosureId) {
            if (contents.containsKey(enclosureId)) {
                return;
            }
            depth(enclosureId);
            var parent = parent(enclosureId);
            place(parent);
            contents.put(enclosureId, new ArrayList<>());
            contents.get(parent).add(new Slot<>(null, enclosureId));
        }
    }

    /**
     * A solid cell, or a nested enclosure block when the cell is null
     */
    private record Slot<S>(SolidEntity<S> cell, int enclosureId) {
    }
}
