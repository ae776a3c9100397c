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
 * Renders a cell definition in MCNP-style notation: juxtaposition for intersection, {@code :} for union and
 * {@code #( )} for complement.
 *
 * @author hal.hildebrand
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {
    }

    public static String format(CellDefinition definition) {
        var builder = new StringBuilder();
        format(definition, definition.root(), builder);
        return builder.toString();
    }

    private static void format(CellDefinition definition, int handle, StringBuilder builder) {
        switch (definition.kind(handle)) {
            case TRUE -> builder.append("UNIVERSE");
            case FALSE -> builder.append("EMPTY");
            case LEAF -> builder.append(definition.literal(handle));
            case NOT -> {
                builder.append("#(");
                format(definition, definition.child(handle, 0), builder);
                builder.append(')');
            }
            case AND -> operands(definition, handle, " ", NodeKind.OR, builder);
            case OR -> operands(definition, handle, ":", NodeKind.AND, builder);
        }
    }

    private static void operands(CellDefinition definition, int handle, String separator, NodeKind bracketed,
                                 StringBuilder builder) {
        var count = definition.childCount(handle);
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                builder.append(separator);
            }
            var child = definition.child(handle, i);
            var kind = definition.kind(child);
            var wrap = kind == bracketed && definition.childCount(child) > 1;
            if (wrap) {
                builder.append('(');
            }
            format(definition, child, builder);
            if (wrap) {
                builder.append(')');
            }
        }
    }
}
