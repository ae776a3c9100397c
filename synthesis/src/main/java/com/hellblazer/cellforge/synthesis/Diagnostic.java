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

/**
 * A non-fatal problem met during a conversion run, tied to the cell it concerns
 *
 * @param identity identity of the cell, 0 when the problem is not tied to one
 * @author hal.hildebrand
 */
public record Diagnostic(int identity, String comment, Stage stage, String message) {

    public enum Stage {
        LOAD, DECOMPOSITION, BUILD, OVERLAP, SIMPLIFY, VOID, CONE, NUMBERING
    }

    @Override
    public String toString() {
        return stage + " cell " + identity + (comment.isEmpty() ? "" : " (" + comment + ")") + ": " + message;
    }
}
