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
package com.hellblazer.cellforge.synthesis.surface;

import com.hellblazer.cellforge.synthesis.config.NumericFormat;

import java.util.Locale;

/**
 * Renders registered surfaces as one line of text, id, kind and parameters, using the configured numeric formats.
 * Used for diagnostics and as the neutral form handed to dialect serializers.
 *
 * @author hal.hildebrand
 */
public class SurfaceFormatter {
    private final NumericFormat format;

    public SurfaceFormatter(NumericFormat format) {
        this.format = format;
    }

    public String format(RegisteredSurface registered) {
        var p = registered.parameters();
        var line = new StringBuilder();
        line.append(registered.id()).append(' ').append(registered.kind());
        switch (registered.kind()) {
            case PLANE -> {
                append(line, format.planeNormal(), p, 0, 3);
                append(line, format.planeDistance(), p, 3, 4);
            }
            case CYLINDER -> {
                append(line, format.cylinderAxis(), p, 0, 6);
                append(line, format.cylinderRadius(), p, 6, 7);
            }
            case CONE -> {
                append(line, format.coneApex(), p, 0, 6);
                append(line, format.coneAngle(), p, 6, 7);
            }
            case SPHERE -> {
                append(line, format.sphereCenter(), p, 0, 3);
                append(line, format.sphereRadius(), p, 3, 4);
            }
            case TORUS -> {
                append(line, format.torusCenter(), p, 0, 6);
                append(line, format.torusRadii(), p, 6, 8);
            }
        }
        return line.toString();
    }

    private static void append(StringBuilder line, String pattern, double[] values, int from, int to) {
        for (int i = from; i < to; i++) {
            line.append(' ').append(String.format(Locale.ROOT, pattern, values[i]).trim());
        }
    }
}
