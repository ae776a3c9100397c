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
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Intersection of linear half-spaces a.x <= d. Vertices are found by brute-force enumeration of constraint triples,
 * which is exact enough and cheap for the handful of planes bounding one convex fragment and its region of interest.
 * Only meaningful for bounded intersections: start from a box.
 *
 * @author hal.hildebrand
 */
public final class ConvexPolytope {
    private static final double SINGULAR = 1e-12;

    private final List<double[]> constraints;

    private ConvexPolytope(List<double[]> constraints) {
        this.constraints = constraints;
    }

    public static ConvexPolytope of(Box box) {
        var constraints = new ArrayList<double[]>();
        constraints.add(new double[] { -1, 0, 0, -box.getMinX() });
        constraints.add(new double[] { 1, 0, 0, box.getMaxX() });
        constraints.add(new double[] { 0, -1, 0, -box.getMinY() });
        constraints.add(new double[] { 0, 1, 0, box.getMaxY() });
        constraints.add(new double[] { 0, 0, -1, -box.getMinZ() });
        constraints.add(new double[] { 0, 0, 1, box.getMaxZ() });
        return new ConvexPolytope(Collections.unmodifiableList(constraints));
    }

    /**
     * Bounds of the polytope, empty if it has no vertices
     */
    public Optional<Box> bounds(double tolerance) {
        var vertices = vertices(tolerance);
        if (vertices.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Box.enclosing(vertices));
    }

    public boolean contains(Point3d p, double tolerance) {
        for (var c : constraints) {
            if (c[0] * p.x + c[1] * p.y + c[2] * p.z > c[3] + tolerance) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return constraints.size();
    }

    /**
     * All vertices of the polytope, duplicates within tolerance merged
     */
    public List<Point3d> vertices(double tolerance) {
        var vertices = new ArrayList<Point3d>();
        var n = constraints.size();
        for (int i = 0; i < n - 2; i++) {
            for (int j = i + 1; j < n - 1; j++) {
                for (int k = j + 1; k < n; k++) {
                    var p = solve(constraints.get(i), constraints.get(j), constraints.get(k));
                    if (p == null || !contains(p, tolerance)) {
                        continue;
                    }
                    if (vertices.stream().noneMatch(v -> v.distance(p) <= tolerance)) {
                        vertices.add(p);
                    }
                }
            }
        }
        return vertices;
    }

    /**
     * Add the half-space normal.x <= offset
     */
    public ConvexPolytope with(Vector3d normal, double offset) {
        var next = new ArrayList<>(constraints);
        next.add(new double[] { normal.x, normal.y, normal.z, offset });
        return new ConvexPolytope(Collections.unmodifiableList(next));
    }

    private static Point3d solve(double[] p, double[] q, double[] r) {
        var det = p[0] * (q[1] * r[2] - q[2] * r[1]) - p[1] * (q[0] * r[2] - q[2] * r[0]) + p[2] * (q[0] * r[1]
                                                                                                   - q[1] * r[0]);
        if (Math.abs(det) < SINGULAR) {
            return null;
        }
        var x = p[3] * (q[1] * r[2] - q[2] * r[1]) - p[1] * (q[3] * r[2] - q[2] * r[3]) + p[2] * (q[3] * r[1]
                                                                                                 - q[1] * r[3]);
        var y = p[0] * (q[3] * r[2] - q[2] * r[3]) - p[3] * (q[0] * r[2] - q[2] * r[0]) + p[2] * (q[0] * r[3]
                                                                                                 - q[3] * r[0]);
        var z = p[0] * (q[1] * r[3] - q[3] * r[1]) - p[1] * (q[0] * r[3] - q[3] * r[0]) + p[3] * (q[0] * r[1]
                                                                                                 - q[1] * r[0]);
        return new Point3d(x / det, y / det, z / det);
    }
}
