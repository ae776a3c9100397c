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
import com.hellblazer.cellforge.geometry.ConvexPolytope;
import com.hellblazer.cellforge.geometry.Vectors;
import com.hellblazer.cellforge.synthesis.config.Tolerances;
import com.hellblazer.cellforge.synthesis.kernel.ConvexFragment;
import com.hellblazer.cellforge.synthesis.kernel.Position;
import com.hellblazer.cellforge.synthesis.kernel.Relation;
import com.hellblazer.cellforge.synthesis.kernel.SolidKernel;
import com.hellblazer.cellforge.synthesis.kernel.SurfaceDescriptor;
import com.hellblazer.cellforge.synthesis.surface.Cone;
import com.hellblazer.cellforge.synthesis.surface.Cylinder;
import com.hellblazer.cellforge.synthesis.surface.HalfSpace;
import com.hellblazer.cellforge.synthesis.surface.Plane;
import com.hellblazer.cellforge.synthesis.surface.Sphere;
import com.hellblazer.cellforge.synthesis.surface.Torus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Solid kernel over {@link AnalyticSolid}s. Half-space questions are answered by interval bounds: every canonical
 * surface function is 1-Lipschitz, so its range over a cell is bounded by the value at the cell center plus or minus
 * half the cell diagonal. Cells whose bounds do not decide the question are subdivided a few times; anything still
 * undecided is answered conservatively ({@link Position#CROSSES}, {@link Relation#UNRELATED}). Plane and sphere ranges
 * are computed exactly, and relations between two planes are decided on the vertices of the clipped region.
 *
 * @author hal.hildebrand
 */
public class AnalyticKernel implements SolidKernel<AnalyticSolid, BoundingFace> {
    private static final Logger log = LoggerFactory.getLogger(AnalyticKernel.class);

    private static final int    MAX_DEPTH = 5;
    private static final double LIMIT     = 1.0e9;

    private final Tolerances tolerances;
    private final double     epsilon;

    public AnalyticKernel(Tolerances tolerances) {
        this.tolerances = tolerances;
        this.epsilon = tolerances.value();
    }

    private static Point3d along(Point3d origin, Vector3d unit, double t) {
        var p = new Point3d(unit);
        p.scale(t);
        p.add(origin);
        return p;
    }

    /**
     * Box of a disc of the given radius centered on the point, perpendicular to the unit axis
     */
    private static Box disc(Point3d center, Vector3d axis, double radius) {
        var ex = radius * Math.sqrt(Math.max(0.0, 1.0 - axis.x * axis.x));
        var ey = radius * Math.sqrt(Math.max(0.0, 1.0 - axis.y * axis.y));
        var ez = radius * Math.sqrt(Math.max(0.0, 1.0 - axis.z * axis.z));
        return new Box(center.x - ex, center.y - ey, center.z - ez, center.x + ex, center.y + ey, center.z + ez);
    }

    private static Box[] octants(Box cell) {
        var c = cell.getCenter();
        var octants = new Box[8];
        for (int i = 0; i < 8; i++) {
            var x0 = (i & 1) == 0 ? cell.getMinX() : c.x;
            var x1 = (i & 1) == 0 ? c.x : cell.getMaxX();
            var y0 = (i & 2) == 0 ? cell.getMinY() : c.y;
            var y1 = (i & 2) == 0 ? c.y : cell.getMaxY();
            var z0 = (i & 4) == 0 ? cell.getMinZ() : c.z;
            var z1 = (i & 4) == 0 ? c.z : cell.getMaxZ();
            octants[i] = new Box(x0, y0, z0, x1, y1, z1);
        }
        return octants;
    }

    @Override
    public Relation booleanRelation(HalfSpace a, HalfSpace b, Box region) {
        if (a.surface() instanceof Plane pa && b.surface() instanceof Plane pb) {
            return planeRelation(pa, a.sense(), pb, b.sense(), region);
        }
        if (holds(region, cell -> implies(a, b, cell), 0)) {
            return Relation.IMPLIES;
        }
        if (holds(region, cell -> excludes(a, b, cell), 0)) {
            return Relation.EXCLUDES;
        }
        return Relation.UNRELATED;
    }

    @Override
    public Box boundingBox(AnalyticSolid solid) {
        return Box.union(solid.pieces().stream().map(this::boundingBox).toList());
    }

    @Override
    public Box boundingBox(ConvexFragment<BoundingFace> fragment) {
        var limit = new Box(-LIMIT, -LIMIT, -LIMIT, LIMIT, LIMIT, LIMIT);
        for (var face : fragment.faces()) {
            var bound = quadricBound(face, fragment.faces());
            if (bound != null) {
                limit = limit.intersection(bound)
                             .orElseThrow(() -> new IllegalArgumentException("Empty fragment: " + fragment));
            }
        }
        var polytope = ConvexPolytope.of(limit);
        for (var face : fragment.faces()) {
            if (face.surface() instanceof Plane plane) {
                var normal = plane.normal();
                normal.scale(-face.sense());
                polytope = polytope.with(normal, -face.sense() * plane.distance());
            }
        }
        return polytope.bounds(tolerances.distance())
                       .orElseThrow(() -> new IllegalArgumentException("Empty fragment: " + fragment));
    }

    @Override
    public SurfaceDescriptor classifyFace(BoundingFace face) {
        var surface = face.surface();
        var degenerate = switch (surface.kind()) {
            case PLANE -> false;
            case CYLINDER -> ((Cylinder) surface).radius() <= tolerances.cylinderDistance();
            case SPHERE -> ((Sphere) surface).radius() <= tolerances.sphereDistance();
            case CONE -> {
                var cos = Math.cos(((Cone) surface).semiAngle());
                yield 1 - cos <= tolerances.angle() || cos <= tolerances.angle();
            }
            case TORUS -> {
                var torus = (Torus) surface;
                yield torus.minorRadius() <= tolerances.torusDistance() || torus.majorRadius() < torus.minorRadius();
            }
        };
        if (degenerate) {
            log.debug("Degenerate face geometry: {}", surface);
            return SurfaceDescriptor.approximate(surface, face.sense());
        }
        return SurfaceDescriptor.of(surface, face.sense());
    }

    @Override
    public List<ConvexFragment<BoundingFace>> decomposeIntoConvex(AnalyticSolid solid) {
        return solid.pieces();
    }

    @Override
    public void export(List<AnalyticSolid> solids, Path target) throws IOException {
        var text = new StringBuilder();
        for (int i = 0; i < solids.size(); i++) {
            var solid = solids.get(i);
            text.append(String.format(Locale.ROOT, "solid %d%s%n", i + 1, solid.splineSurfaces() ? " spline" : ""));
            for (var piece : solid.pieces()) {
                text.append("  piece").append(System.lineSeparator());
                for (var face : piece.faces()) {
                    text.append(String.format(Locale.ROOT, "    %+d %s%n", face.sense(), face.surface()));
                }
            }
        }
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, text);
    }

    @Override
    public boolean hasUnsupportedSurfaces(AnalyticSolid solid) {
        return solid.splineSurfaces();
    }

    @Override
    public Position position(HalfSpace halfSpace, Box region) {
        if (holds(region, cell -> verdict(range(halfSpace, cell)[0] >= -epsilon,
                                          value(halfSpace, cell.getCenter()) < -epsilon), 0)) {
            return Position.INSIDE;
        }
        if (holds(region, cell -> verdict(range(halfSpace, cell)[1] <= epsilon,
                                          value(halfSpace, cell.getCenter()) > epsilon), 0)) {
            return Position.OUTSIDE;
        }
        return Position.CROSSES;
    }

    /**
     * Bounds the extent of a curved face, using the planes perpendicular to its axis for cylinders and cones
     *
     * @return the box, or null if the face does not bound the fragment on its own
     */
    private Box quadricBound(BoundingFace face, List<BoundingFace> faces) {
        if (face.sense() != -1) {
            return null;
        }
        var surface = face.surface();
        if (surface instanceof Sphere sphere) {
            var c = sphere.center();
            var r = sphere.radius();
            return new Box(c.x - r, c.y - r, c.z - r, c.x + r, c.y + r, c.z + r);
        }
        if (surface instanceof Torus torus) {
            var c = torus.center();
            var r = torus.majorRadius() + torus.minorRadius();
            return new Box(c.x - r, c.y - r, c.z - r, c.x + r, c.y + r, c.z + r);
        }
        if (surface instanceof Cylinder cylinder) {
            var range = axialRange(cylinder.center(), cylinder.axis(), faces, Double.NEGATIVE_INFINITY);
            if (range == null) {
                return null;
            }
            return disc(along(cylinder.center(), cylinder.axis(), range[0]), cylinder.axis(), cylinder.radius()).union(
            disc(along(cylinder.center(), cylinder.axis(), range[1]), cylinder.axis(), cylinder.radius()));
        }
        if (surface instanceof Cone cone) {
            // the face lies on the nappe the axis points into
            var range = axialRange(cone.apex(), cone.axis(), faces, 0.0);
            if (range == null) {
                return null;
            }
            var tan = Math.tan(cone.semiAngle());
            return disc(along(cone.apex(), cone.axis(), range[0]), cone.axis(), Math.abs(range[0]) * tan).union(
            disc(along(cone.apex(), cone.axis(), range[1]), cone.axis(), Math.abs(range[1]) * tan));
        }
        return null;
    }

    /**
     * Range of the axial coordinate allowed by the plane faces perpendicular to the axis
     *
     * @return {min, max}, or null if unbounded
     */
    private double[] axialRange(Point3d origin, Vector3d axis, List<BoundingFace> faces, double floor) {
        var min = floor;
        var max = Double.POSITIVE_INFINITY;
        for (var face : faces) {
            if (!(face.surface() instanceof Plane plane)) {
                continue;
            }
            var normal = plane.normal();
            if (Vectors.parallelism(normal, axis) > tolerances.planeAngle()) {
                continue;
            }
            var along = normal.dot(axis);
            var t = (plane.distance() - normal.dot(new Vector3d(origin))) / along;
            if (face.sense() * along > 0) {
                min = Math.max(min, t);
            } else {
                max = Math.min(max, t);
            }
        }
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
            return null;
        }
        return new double[] { min, max };
    }

    private Verdict excludes(HalfSpace a, HalfSpace b, Box cell) {
        if (range(a, cell)[1] <= epsilon || range(b, cell)[1] <= epsilon) {
            return Verdict.HOLDS;
        }
        var center = cell.getCenter();
        return value(a, center) > epsilon && value(b, center) > epsilon ? Verdict.FAILS : Verdict.UNKNOWN;
    }

    /**
     * Evaluate a cell test over the region, subdividing undecided cells
     */
    private boolean holds(Box cell, CellTest test, int depth) {
        var verdict = test.check(cell);
        if (verdict != Verdict.UNKNOWN) {
            return verdict == Verdict.HOLDS;
        }
        if (depth >= MAX_DEPTH) {
            return false;
        }
        for (var octant : octants(cell)) {
            if (!holds(octant, test, depth + 1)) {
                return false;
            }
        }
        return true;
    }

    private Verdict implies(HalfSpace a, HalfSpace b, Box cell) {
        if (range(a, cell)[1] <= epsilon || range(b, cell)[0] >= -epsilon) {
            return Verdict.HOLDS;
        }
        var center = cell.getCenter();
        return value(a, center) > epsilon && value(b, center) < -epsilon ? Verdict.FAILS : Verdict.UNKNOWN;
    }

    /**
     * Decided on the vertices of the region clipped to a, where b is linear
     */
    private Relation planeRelation(Plane a, int senseA, Plane b, int senseB, Box region) {
        var normal = a.normal();
        normal.scale(-senseA);
        var vertices = ConvexPolytope.of(region)
                                     .with(normal, -senseA * a.distance())
                                     .vertices(tolerances.distance());
        if (vertices.isEmpty()) {
            return Relation.UNRELATED;
        }
        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        for (var v : vertices) {
            var value = senseB * b.evaluate(v);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (min >= -tolerances.distance()) {
            return Relation.IMPLIES;
        }
        if (max <= tolerances.distance()) {
            return Relation.EXCLUDES;
        }
        return Relation.UNRELATED;
    }

    /**
     * Conservative range of the oriented function over the cell
     */
    private double[] range(HalfSpace halfSpace, Box cell) {
        var surface = halfSpace.surface();
        double lo;
        double hi;
        if (surface instanceof Plane plane) {
            lo = Double.POSITIVE_INFINITY;
            hi = Double.NEGATIVE_INFINITY;
            for (var corner : cell.corners()) {
                var v = plane.evaluate(corner);
                lo = Math.min(lo, v);
                hi = Math.max(hi, v);
            }
        } else if (surface instanceof Sphere sphere) {
            var c = sphere.center();
            var nearest = new Point3d(clamp(c.x, cell.getMinX(), cell.getMaxX()),
                                      clamp(c.y, cell.getMinY(), cell.getMaxY()),
                                      clamp(c.z, cell.getMinZ(), cell.getMaxZ()));
            var far = 0.0;
            for (var corner : cell.corners()) {
                far = Math.max(far, corner.distance(c));
            }
            lo = nearest.distance(c) - sphere.radius();
            hi = far - sphere.radius();
        } else {
            var center = surface.evaluate(cell.getCenter());
            var half = cell.getDiagonal() / 2;
            lo = center - half;
            hi = center + half;
        }
        return halfSpace.sense() > 0 ? new double[] { lo, hi } : new double[] { -hi, -lo };
    }

    private double value(HalfSpace halfSpace, Point3d point) {
        return halfSpace.signedValue(point);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static Verdict verdict(boolean holds, boolean fails) {
        return holds ? Verdict.HOLDS : fails ? Verdict.FAILS : Verdict.UNKNOWN;
    }

    private enum Verdict {
        HOLDS, FAILS, UNKNOWN
    }

    @FunctionalInterface
    private interface CellTest {
        Verdict check(Box cell);
    }
}
