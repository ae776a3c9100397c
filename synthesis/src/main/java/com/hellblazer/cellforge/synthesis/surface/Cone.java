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
 * Circular cone. As an implicit surface it has two nappes, one on each side of the apex; the axis direction names the
 * nappe a face actually lies on, but plays no part in the implicit function. Parameters: apex (x, y, z), unit axis (x,
 * y, z), semi-angle in radians.
 *
 * @author hal.hildebrand
 */
public record Cone(Point3d apex, Vector3d axis, double semiAngle) implements Surface {

    public Cone {
        if (!Vectors.isFinite(apex) || !Vectors.isFinite(axis) || !Double.isFinite(semiAngle)) {
            throw new IllegalArgumentException("Cone coefficients must be finite");
        }
        apex = new Point3d(apex);
        axis = Vectors.unit(axis);
    }

    /**
     * The plane through the apex, perpendicular to the axis, whose positive side holds the nappe the axis points into
     */
    public Plane apexPlane() {
        return Plane.through(apex, axis);
    }

    @Override
    public Point3d apex() {
        return new Point3d(apex);
    }

    @Override
    public Vector3d axis() {
        return new Vector3d(axis);
    }

    @Override
    public double evaluate(Point3d point) {
        var v = new Vector3d(point);
        v.sub(apex);
        var axial = v.dot(axis);
        var perp = Math.sqrt(Math.max(0.0, v.lengthSquared() - axial * axial));
        return perp * Math.cos(semiAngle) - Math.abs(axial) * Math.sin(semiAngle);
    }

    @Override
    public SurfaceKind kind() {
        return SurfaceKind.CONE;
    }

    @Override
    public double[] parameters() {
        return new double[] { apex.x, apex.y, apex.z, axis.x, axis.y, axis.z, semiAngle };
    }
}
