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

import com.hellblazer.cellforge.geometry.Vectors;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Circular torus. Parameters: center (x, y, z), unit axis (x, y, z), major radius, minor radius.
 *
 * @author hal.hildebrand
 */
public record Torus(Point3d center, Vector3d axis, double majorRadius, double minorRadius) implements Surface {

    public Torus {
        if (!Vectors.isFinite(center) || !Vectors.isFinite(axis) || !Double.isFinite(majorRadius)
        || !Double.isFinite(minorRadius)) {
            throw new IllegalArgumentException("Torus coefficients must be finite");
        }
        center = new Point3d(center);
        axis = Vectors.unit(axis);
    }

    @Override
    public Point3d center() {
        return new Point3d(center);
    }

    @Override
    public Vector3d axis() {
        return new Vector3d(axis);
    }

    @Override
    public double evaluate(Point3d point) {
        var v = new Vector3d(point);
        v.sub(center);
        var axial = v.dot(axis);
        var rho = Math.sqrt(Math.max(0.0, v.lengthSquared() - axial * axial)) - majorRadius;
        return Math.sqrt(rho * rho + axial * axial) - minorRadius;
    }

    @Override
    public SurfaceKind kind() {
        return SurfaceKind.TORUS;
    }

    @Override
    public double[] parameters() {
        return new double[] { center.x, center.y, center.z, axis.x, axis.y, axis.z, majorRadius, minorRadius };
    }
}
