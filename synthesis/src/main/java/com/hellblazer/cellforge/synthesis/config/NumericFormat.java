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
package com.hellblazer.cellforge.synthesis.config;

import java.util.IllegalFormatException;

/**
 * printf patterns used when surface parameters are rendered as text, one per parameter group.
 *
 * @author hal.hildebrand
 */
public record NumericFormat(String planeNormal, String planeDistance, String sphereCenter, String sphereRadius,
                            String cylinderAxis, String cylinderRadius, String coneApex, String coneAngle,
                            String torusCenter, String torusRadii) {

    public NumericFormat {
        validate("planeNormal", planeNormal);
        validate("planeDistance", planeDistance);
        validate("sphereCenter", sphereCenter);
        validate("sphereRadius", sphereRadius);
        validate("cylinderAxis", cylinderAxis);
        validate("cylinderRadius", cylinderRadius);
        validate("coneApex", coneApex);
        validate("coneAngle", coneAngle);
        validate("torusCenter", torusCenter);
        validate("torusRadii", torusRadii);
    }

    public static NumericFormat getDefault() {
        return new NumericFormat("%14.7e", "%14.7e", "% 13.7e", "%13.7e", "% 13.7e", "%13.7e", "% 13.7e", "%13.7e",
                                 "% 13.7e", "%13.7e");
    }

    private static void validate(String name, String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException(name + " format must not be null");
        }
        try {
            String.format(pattern, 1.0);
        } catch (IllegalFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " format: " + pattern, e);
        }
    }
}
