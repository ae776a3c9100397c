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
package com.hellblazer.cellforge.geometry;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * Small vector helpers shared by the surface and kernel code.
 *
 * @author hal.hildebrand
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * 1 - |a.b| for unit vectors: zero when parallel or anti-parallel
     */
    public static double parallelism(Vector3d a, Vector3d b) {
        return 1.0 - Math.abs(a.dot(b));
    }

    /**
     * Distance from a point to the infinite line through origin along the unit direction
     */
    public static double distanceToLine(Point3d point, Point3d origin, Vector3d direction) {
        var v = new Vector3d(point);
        v.sub(origin);
        var axial = v.dot(direction);
        var perp2 = v.lengthSquared() - axial * axial;
        return Math.sqrt(Math.max(0.0, perp2));
    }

    public static boolean isFinite(Tuple3d t) {
        return Double.isFinite(t.x) && Double.isFinite(t.y) && Double.isFinite(t.z);
    }

    /**
     * Normalized copy
     *
     * @throws IllegalArgumentException if the vector has no length
     */
    public static Vector3d unit(Vector3d v) {
        var length = v.length();
        if (!(length > 1e-12)) {
            throw new IllegalArgumentException("Cannot normalize degenerate vector: " + v);
        }
        var u = new Vector3d(v);
        u.scale(1.0 / length);
        return u;
    }

    public static Vector3d negated(Vector3d v) {
        var n = new Vector3d(v);
        n.negate();
        return n;
    }
}
