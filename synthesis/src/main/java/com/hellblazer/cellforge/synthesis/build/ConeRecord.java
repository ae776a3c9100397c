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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The cone references of one cell, one patch per signed cone reference. The first patch recorded for a reference
 * wins.
 *
 * @author hal.hildebrand
 */
public final class ConeRecord {

    private final Map<Integer, ConePatch> patches = new LinkedHashMap<>();

    public ConeRecord() {
    }

    public ConeRecord(Collection<ConePatch> patches) {
        patches.forEach(this::add);
    }

    /**
     * Union of records, earlier records winning per cone reference
     */
    public static ConeRecord merge(Collection<ConeRecord> records) {
        var merged = new ConeRecord();
        for (var record : records) {
            record.patches().forEach(merged::add);
        }
        return merged;
    }

    /**
     * @return true if the patch was recorded, false if its cone reference already has one
     */
    public boolean add(ConePatch patch) {
        return patches.putIfAbsent(patch.coneLiteral(), patch) == null;
    }

    /**
     * The record of the complement of the cell
     */
    public ConeRecord inverted() {
        var inverted = new ConeRecord();
        patches.values().forEach(p -> inverted.add(p.inverted()));
        return inverted;
    }

    public boolean isEmpty() {
        return patches.isEmpty();
    }

    public List<ConePatch> patches() {
        return Collections.unmodifiableList(new ArrayList<>(patches.values()));
    }

    public int size() {
        return patches.size();
    }

    @Override
    public String toString() {
        return "ConeRecord" + patches.values();
    }
}
