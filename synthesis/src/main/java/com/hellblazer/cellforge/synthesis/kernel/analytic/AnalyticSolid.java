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
package com.hellblazer.cellforge.synthesis.kernel.analytic;

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.geometry.Vectors;
import com.hellblazer.cellforge.synthesis.kernel.ConvexFragment;
import com.hellblazer.cellforge.synthesis.surface.Cone;
import com.hellblazer.cellforge.synthesis.surface.Cylinder;
import com.hellblazer.cellforge.synthesis.surface.Plane;
import com.hellblazer.cellforge.synthesis.surface.Sphere;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;

/**
 * A solid given directly as a union of convex pieces, each piece an intersection of bounding faces. This is the
 * solid representation of the {@link AnalyticKernel}, used where no CAD kernel is at hand.
 *
 * @author hal.hildebrand
 */
public record AnalyticSolid(List<ConvexFragment<BoundingFace>> pieces, boolean splineSurfaces) {

    public AnalyticSolid {
        if (pieces.isEmpty()) {
            throw new IllegalArgumentException("A solid needs at least one piece");
        }
        pieces = List.copyOf(pieces);
    }

    public static AnalyticSolid box(Box box) {
        return of(List.of(BoundingFace.outside(Plane.x(box.getMinX())), BoundingFace.inside(Plane.x(box.getMaxX())),
                          BoundingFace.outside(Plane.y(box.getMinY())), BoundingFace.inside(Plane.y(box.getMaxY())),
                          BoundingFace.outside(Plane.z(box.getMinZ())),
                          BoundingFace.inside(Plane.z(box.getMaxZ()))));
    }

    /**
     * Right circular cone with its apex at the given point, opening along the axis up to the base plane at the given
     * height
     */
    public static AnalyticSolid cone(Point3d apex, Vector3d axis, double semiAngle, double height) {
        var unit = Vectors.unit(axis);
        return of(List.of(BoundingFace.inside(new Cone(apex, unit, semiAngle)),
                          BoundingFace.inside(Plane.through(along(apex, unit, height), unit))));
    }

    /**
     * Finite cylinder standing on the base point, extending along the axis
     */
    public static AnalyticSolid cylinder(Point3d base, Vector3d axis, double radius, double height) {
        var unit = Vectors.unit(axis);
        return of(List.of(BoundingFace.inside(new Cylinder(base, unit, radius)),
                          BoundingFace.outside(Plane.through(base, unit)),
                          BoundingFace.inside(Plane.through(along(base, unit, height), unit))));
    }

    public static AnalyticSolid of(List<BoundingFace> faces) {
        return new AnalyticSolid(List.of(new ConvexFragment<>(faces)), false);
    }

    public static AnalyticSolid sphere(Point3d center, double radius) {
        return of(List.of(BoundingFace.inside(new Sphere(center, radius))));
    }

    /**
     * Solid made of the pieces of all the given solids
     */
    public static AnalyticSolid union(AnalyticSolid... solids) {
        var pieces = new ArrayList<ConvexFragment<BoundingFace>>();
        var spline = false;
        for (var solid : solids) {
            pieces.addAll(solid.pieces);
            spline |= solid.splineSurfaces;
        }
        return new AnalyticSolid(pieces, spline);
    }

    private static Point3d along(Point3d origin, Vector3d unit, double distance) {
        var p = new Point3d(unit);
        p.scale(distance);
        p.add(origin);
        return p;
    }

    /**
     * The same solid, marked as also bounded by free-form surfaces the engine cannot model
     */
    public AnalyticSolid withSplineSurfaces() {
        return new AnalyticSolid(pieces, true);
    }
}
