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
package com.hellblazer.cellforge.synthesis.cell;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Where a void cell came from: the enclosure it fills and the identities of the cells it was carved from. The
 * comment of a void is always rebuilt from its origin, never patched.
 *
 * @author hal.hildebrand
 */
public record VoidOrigin(int enclosureId, List<Integer> identities) {

    public static final String PREFIX = "Automatic Generated Void Cell. Enclosure(%d)";

    public VoidOrigin {
        identities = List.copyOf(identities);
    }

    /**
     * Comment naming the contributing cells by identity
     */
    public String comment() {
        return render(identities);
    }

    /**
     * Comment naming the contributing cells by their final labels. Identities without a label are dropped.
     */
    public String comment(Map<Integer, Integer> labels) {
        var named = new ArrayList<Integer>();
        for (var identity : identities) {
            var label = labels.get(identity);
            if (label != null) {
                named.add(label);
            }
        }
        return render(named);
    }

    private String render(List<Integer> names) {
        var header = String.format(PREFIX, enclosureId);
        if (names.isEmpty()) {
            return header;
        }
        return header + System.lineSeparator() + "Enclosed cells : (" + names.stream()
                                                                           .map(String::valueOf)
                                                                           .collect(Collectors.joining(", ")) + ")";
    }
}
