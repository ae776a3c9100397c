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

/**
 * A cone reference of a cell together with the literal of the plane through the cone's apex that selects the nappe
 * the cell's face lies on
 *
 * @author hal.hildebrand
 */
public record ConePatch(int coneLiteral, int planeLiteral) {

    public ConePatch {
        if (coneLiteral == 0 || planeLiteral == 0) {
            throw new IllegalArgumentException("Literals must be non zero: " + coneLiteral + ", " + planeLiteral);
        }
    }

    public int cone() {
        return Math.abs(coneLiteral);
    }

    /**
     * The same patch for the complement of the cell: the cone side flips, the nappe does not
     */
    public ConePatch inverted() {
        return new ConePatch(-coneLiteral, planeLiteral);
    }
}
