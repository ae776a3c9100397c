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
 * Infinite circular cylinder. Parameters: point on the axis (x, y, z), unit axis (x, y, z), radius.
 *
 * @author hal.hildebrand
 */
public record Cylinder(Point3d center, Vector3d axis, double radius) implements Surface {

    public Cylinder {
        if (!Vectors.isFinite(center) || !Vectors.isFinite(axis) || !Double.isFinite(radius)) {
            throw new IllegalArgumentException("Cylinder coefficients must be finite");
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
        return Vectors.distanceToLine(point, center, axis) - radius;
    }

    @Override
    public SurfaceKind kind() {
        return SurfaceKind.CYLINDER;
    }

    @Override
    public double[] parameters() {
        return new double[] { center.x, center.y, center.z, axis.x, axis.y, axis.z, radius };
    }
}
