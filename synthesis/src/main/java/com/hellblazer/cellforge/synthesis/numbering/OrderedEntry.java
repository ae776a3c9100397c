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

/**
 * One element of the final cell sequence: a numbered cell or a section delimiter
 *
 * @author hal.hildebrand
 */
public sealed interface OrderedEntry permits OrderedEntry.CellEntry, OrderedEntry.Delimiter {

    record CellEntry(SolidEntity<?> cell) implements OrderedEntry {
        public int label() {
            return cell.getLabel();
        }
    }

    /**
     * @param enclosureId the enclosure opened or closed, 0 for the void section
     */
    record Delimiter(Kind kind, int enclosureId) implements OrderedEntry {

        /**
         * Banner text of the delimiter, as written in comment lines of the output
         */
        public String banner() {
            return switch (kind) {
                case ENCLOSURE_OPEN -> "ENCLOSURE " + enclosureId;
                case ENCLOSURE_CLOSE -> "END ENCLOSURE " + enclosureId;
                case VOID_CELLS -> "VOID CELLS";
            };
        }
    }

    enum Kind {
        ENCLOSURE_OPEN, ENCLOSURE_CLOSE, VOID_CELLS
    }
}
