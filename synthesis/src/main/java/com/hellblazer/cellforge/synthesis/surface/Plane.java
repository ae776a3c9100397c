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
 * Plane n.p = d with unit normal n. Parameters: nx, ny, nz, d.
 *
 * @author hal.hildebrand
 */
public record Plane(Vector3d normal, double distance) implements Surface {

    public Plane {
        if (!Double.isFinite(distance) || !Vectors.isFinite(normal)) {
            throw new IllegalArgumentException("Plane coefficients must be finite");
        }
        normal = Vectors.unit(normal);
    }

    /**
     * Plane through the point with the given normal
     */
    public static Plane through(Point3d point, Vector3d normal) {
        var n = Vectors.unit(normal);
        return new Plane(n, n.x * point.x + n.y * point.y + n.z * point.z);
    }

    public static Plane x(double x) {
        return new Plane(new Vector3d(1, 0, 0), x);
    }

    public static Plane y(double y) {
        return new Plane(new Vector3d(0, 1, 0), y);
    }

    public static Plane z(double z) {
        return new Plane(new Vector3d(0, 0, 1), z);
    }

    @Override
    public double evaluate(Point3d point) {
        return normal.x * point.x + normal.y * point.y + normal.z * point.z - distance;
    }

    /**
     * Same plane, opposite orientation
     */
    public Plane flipped() {
        return new Plane(Vectors.negated(normal), -distance);
    }

    @Override
    public SurfaceKind kind() {
        return SurfaceKind.PLANE;
    }

    @Override
    public Vector3d normal() {
        return new Vector3d(normal);
    }

    @Override
    public double[] parameters() {
        return new double[] { normal.x, normal.y, normal.z, distance };
    }

    @Override
    public String toString() {
        return String.format("Plane[%.6fx + %.6fy + %.6fz = %.6f]", normal.x, normal.y, normal.z, distance);
    }
}
