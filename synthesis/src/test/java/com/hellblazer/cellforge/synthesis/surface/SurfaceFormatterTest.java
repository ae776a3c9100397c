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
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SurfaceFormatterTest {

    @Test
    public void testPlaneAndSphere() {
        var format = new NumericFormat("%.3f", "%.2f", "%.1f", "%.4f", "%.1f", "%.1f", "%.1f", "%.1f", "%.1f",
                                       "%.1f");
        var formatter = new SurfaceFormatter(format);
        assertEquals("7 PLANE 1.000 0.000 0.000 2.50", formatter.format(new RegisteredSurface(7, Plane.x(2.5))));
        assertEquals("3 SPHERE 1.0 -2.0 0.0 0.7500",
                     formatter.format(new RegisteredSurface(3, new Sphere(new Point3d(1, -2, 0), 0.75))));
    }

    @Test
    public void testInvalidPatternRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new NumericFormat("%d", "%f", "%f", "%f", "%f", "%f", "%f", "%f", "%f", "%f"));
    }
}
