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

/**
 * Node kinds of a boolean cell expression
 *
 * @author hal.hildebrand
 */
public enum NodeKind {
    /** Signed half-space reference */
    LEAF,
    /** Intersection */
    AND,
    /** Union */
    OR,
    /** Complement, single child */
    NOT,
    /** All space */
    TRUE,
    /** Empty set */
    FALSE;

    public NodeKind dual() {
        return switch (this) {
            case AND -> OR;
            case OR -> AND;
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            default -> this;
        };
    }

    public boolean isOperator() {
        return this == AND || this == OR || this == NOT;
    }
}
