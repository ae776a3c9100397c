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

import com.hellblazer.cellforge.synthesis.kernel.Position;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Facts about half-spaces within one region: which surfaces do not cross the region, and which signed literals imply
 * which others there. Every implication is stored with its contrapositive.
 *
 * @author hal.hildebrand
 */
public final class ComparisonTable {

    private final Map<Integer, Position> positions    = new HashMap<>();
    private final Set<Long>              implications = new HashSet<>();

    private static long key(int a, int b) {
        return ((long) a << 32) | (b & 0xffffffffL);
    }

    /**
     * Record a implies b, and with it not b implies not a
     */
    public void addImplication(int a, int b) {
        if (a == b) {
            return;
        }
        implications.add(key(a, b));
        implications.add(key(-b, -a));
    }

    /**
     * Truth value of a literal over the whole region, empty if its surface crosses the region or is unknown
     */
    public Optional<Boolean> constant(int literal) {
        var position = positions.get(Math.abs(literal));
        if (position == null || position == Position.CROSSES) {
            return Optional.empty();
        }
        var positiveInside = position == Position.INSIDE;
        return Optional.of(literal > 0 == positiveInside);
    }

    /**
     * a or b covers the region
     */
    public boolean covers(int a, int b) {
        return implies(-a, b);
    }

    /**
     * a and b are disjoint in the region
     */
    public boolean excludes(int a, int b) {
        return implies(a, -b);
    }

    public boolean implies(int a, int b) {
        return a == b || implications.contains(key(a, b));
    }

    public int implicationCount() {
        return implications.size();
    }

    public Optional<Position> position(int surface) {
        return Optional.ofNullable(positions.get(Math.abs(surface)));
    }

    /**
     * Record the position of the region relative to the positive side of the surface
     */
    public void setPosition(int surface, Position position) {
        positions.put(Math.abs(surface), position);
    }

    @Override
    public String toString() {
        return "ComparisonTable[surfaces=" + positions.size() + ", implications=" + implications.size() + "]";
    }
}
