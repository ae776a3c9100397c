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
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable axis-aligned box in double precision. Used as the universe of a conversion run, as the region of interest
 * when comparing half-spaces, and as the leaf region of void generation.
 *
 * @author hal.hildebrand
 */
public final class Box {
    private final double minX;
    private final double minY;
    private final double minZ;
    private final double maxX;
    private final double maxY;
    private final double maxZ;

    public Box(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
        if (Double.isNaN(minX) || Double.isNaN(minY) || Double.isNaN(minZ) || Double.isNaN(maxX) || Double.isNaN(maxY)
        || Double.isNaN(maxZ)) {
            throw new IllegalArgumentException("Box coordinates must not be NaN");
        }
        if (minX > maxX || minY > maxY || minZ > maxZ) {
            throw new IllegalArgumentException(
            String.format("Inverted box: min=(%f,%f,%f) max=(%f,%f,%f)", minX, minY, minZ, maxX, maxY, maxZ));
        }
        this.minX = minX;
        this.minY = minY;
        this.minZ = minZ;
        this.maxX = maxX;
        this.maxY = maxY;
        this.maxZ = maxZ;
    }

    public static Box of(Point3d min, Point3d max) {
        return new Box(min.x, min.y, min.z, max.x, max.y, max.z);
    }

    /**
     * Create a cube from its minimum corner and edge length
     */
    public static Box cube(double x, double y, double z, double edge) {
        return new Box(x, y, z, x + edge, y + edge, z + edge);
    }

    /**
     * The smallest box containing all of the points
     *
     * @throws IllegalArgumentException if no points are given
     */
    public static Box enclosing(Collection<Point3d> points) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot enclose an empty point set");
        }
        double x0 = Double.POSITIVE_INFINITY, y0 = Double.POSITIVE_INFINITY, z0 = Double.POSITIVE_INFINITY;
        double x1 = Double.NEGATIVE_INFINITY, y1 = Double.NEGATIVE_INFINITY, z1 = Double.NEGATIVE_INFINITY;
        for (var p : points) {
            x0 = Math.min(x0, p.x);
            y0 = Math.min(y0, p.y);
            z0 = Math.min(z0, p.z);
            x1 = Math.max(x1, p.x);
            y1 = Math.max(y1, p.y);
            z1 = Math.max(z1, p.z);
        }
        return new Box(x0, y0, z0, x1, y1, z1);
    }

    /**
     * The smallest box containing all of the boxes
     *
     * @throws IllegalArgumentException if no boxes are given
     */
    public static Box union(Collection<Box> boxes) {
        Box result = null;
        for (var box : boxes) {
            result = result == null ? box : result.union(box);
        }
        if (result == null) {
            throw new IllegalArgumentException("Cannot form the union of no boxes");
        }
        return result;
    }

    public boolean contains(double x, double y, double z) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY && z >= minZ && z <= maxZ;
    }

    public boolean contains(Point3d point) {
        return contains(point.x, point.y, point.z);
    }

    public boolean contains(Box other) {
        return other.minX >= minX && other.maxX <= maxX && other.minY >= minY && other.maxY <= maxY
        && other.minZ >= minZ && other.maxZ <= maxZ;
    }

    /**
     * The eight corners, x varying fastest
     */
    public Point3d[] corners() {
        var corners = new Point3d[8];
        for (int i = 0; i < 8; i++) {
            corners[i] = new Point3d((i & 1) == 0 ? minX : maxX, (i & 2) == 0 ? minY : maxY,
                                     (i & 4) == 0 ? minZ : maxZ);
        }
        return corners;
    }

    /**
     * Grow the box by the given amount on every side. Negative padding shrinks it, never past its center.
     */
    public Box enlarged(double padding) {
        var cx = (minX + maxX) / 2;
        var cy = (minY + maxY) / 2;
        var cz = (minZ + maxZ) / 2;
        return new Box(Math.min(cx, minX - padding), Math.min(cy, minY - padding), Math.min(cz, minZ - padding),
                       Math.max(cx, maxX + padding), Math.max(cy, maxY + padding), Math.max(cz, maxZ + padding));
    }

    public double extent(int axis) {
        return switch (axis) {
            case 0 -> maxX - minX;
            case 1 -> maxY - minY;
            case 2 -> maxZ - minZ;
            default -> throw new IllegalArgumentException("Axis must be 0, 1 or 2: " + axis);
        };
    }

    public Point3d getCenter() {
        return new Point3d((minX + maxX) / 2, (minY + maxY) / 2, (minZ + maxZ) / 2);
    }

    /**
     * Length of the main diagonal
     */
    public double getDiagonal() {
        var dx = maxX - minX;
        var dy = maxY - minY;
        var dz = maxZ - minZ;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public Point3d getMax() {
        return new Point3d(maxX, maxY, maxZ);
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMaxY() {
        return maxY;
    }

    public double getMaxZ() {
        return maxZ;
    }

    public Point3d getMin() {
        return new Point3d(minX, minY, minZ);
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMinZ() {
        return minZ;
    }

    public Optional<Box> intersection(Box other) {
        var x0 = Math.max(minX, other.minX);
        var y0 = Math.max(minY, other.minY);
        var z0 = Math.max(minZ, other.minZ);
        var x1 = Math.min(maxX, other.maxX);
        var y1 = Math.min(maxY, other.maxY);
        var z1 = Math.min(maxZ, other.maxZ);
        if (x0 > x1 || y0 > y1 || z0 > z1) {
            return Optional.empty();
        }
        return Optional.of(new Box(x0, y0, z0, x1, y1, z1));
    }

    /**
     * Boxes sharing only a face, edge or corner do not intersect
     */
    public boolean intersects(Box other) {
        return minX < other.maxX && maxX > other.minX && minY < other.maxY && maxY > other.minY && minZ < other.maxZ
        && maxZ > other.minZ;
    }

    public int longestAxis() {
        var dx = maxX - minX;
        var dy = maxY - minY;
        var dz = maxZ - minZ;
        if (dx >= dy && dx >= dz) {
            return 0;
        }
        return dy >= dz ? 1 : 2;
    }

    /**
     * Split at the midpoint of the longest axis
     *
     * @return the lower and the upper half
     */
    public Box[] split() {
        var axis = longestAxis();
        return switch (axis) {
            case 0 -> {
                var mid = (minX + maxX) / 2;
                yield new Box[] { new Box(minX, minY, minZ, mid, maxY, maxZ), new Box(mid, minY, minZ, maxX, maxY,
                                                                                      maxZ) };
            }
            case 1 -> {
                var mid = (minY + maxY) / 2;
                yield new Box[] { new Box(minX, minY, minZ, maxX, mid, maxZ), new Box(minX, mid, minZ, maxX, maxY,
                                                                                      maxZ) };
            }
            default -> {
                var mid = (minZ + maxZ) / 2;
                yield new Box[] { new Box(minX, minY, minZ, maxX, maxY, mid), new Box(minX, minY, mid, maxX, maxY,
                                                                                      maxZ) };
            }
        };
    }

    public Box union(Box other) {
        return new Box(Math.min(minX, other.minX), Math.min(minY, other.minY), Math.min(minZ, other.minZ),
                       Math.max(maxX, other.maxX), Math.max(maxY, other.maxY), Math.max(maxZ, other.maxZ));
    }

    public double volume() {
        return (maxX - minX) * (maxY - minY) * (maxZ - minZ);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Box other)) {
            return false;
        }
        return minX == other.minX && minY == other.minY && minZ == other.minZ && maxX == other.maxX
        && maxY == other.maxY && maxZ == other.maxZ;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minX, minY, minZ, maxX, maxY, maxZ);
    }

    @Override
    public String toString() {
        return String.format("Box[min=(%.4f,%.4f,%.4f), max=(%.4f,%.4f,%.4f)]", minX, minY, minZ, maxX, maxY, maxZ);
    }
}
