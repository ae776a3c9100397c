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
import com.hellblazer.cellforge.synthesis.config.Tolerances;

import javax.vecmath.Vector3d;

/**
 * Kind specific coincidence test between two surfaces.
 *
 * @author hal.hildebrand
 */
public class SurfaceMatcher {
    /** The surfaces are not coincident */
    public static final int DIFFERENT = 0;
    /** Coincident with the same orientation */
    public static final int SAME      = 1;
    /** Coincident planes with opposite normals */
    public static final int OPPOSITE  = -1;

    private final Tolerances tolerances;

    public SurfaceMatcher(Tolerances tolerances) {
        this.tolerances = tolerances;
    }

    /**
     * @return {@link #SAME}, {@link #OPPOSITE} or {@link #DIFFERENT}
     */
    public int match(Surface candidate, Surface kept) {
        if (candidate.kind() != kept.kind()) {
            return DIFFERENT;
        }
        return switch (candidate.kind()) {
            case PLANE -> matchPlanes((Plane) candidate, (Plane) kept);
            case CYLINDER -> matchCylinders((Cylinder) candidate, (Cylinder) kept) ? SAME : DIFFERENT;
            case CONE -> matchCones((Cone) candidate, (Cone) kept) ? SAME : DIFFERENT;
            case SPHERE -> matchSpheres((Sphere) candidate, (Sphere) kept) ? SAME : DIFFERENT;
            case TORUS -> matchTori((Torus) candidate, (Torus) kept) ? SAME : DIFFERENT;
        };
    }

    private boolean matchCones(Cone a, Cone b) {
        var apexA = a.apex();
        var apexB = b.apex();
        var scale = new Vector3d(apexB).length();
        if (apexA.distance(apexB) > tolerances.scaled(tolerances.coneDistance(), scale)) {
            return false;
        }
        // Either axis direction describes the same double nappe quadric
        if (Vectors.parallelism(a.axis(), b.axis()) > tolerances.coneAngle()) {
            return false;
        }
        return Math.abs(a.semiAngle() - b.semiAngle()) <= tolerances.coneAngle();
    }

    private boolean matchCylinders(Cylinder a, Cylinder b) {
        if (Vectors.parallelism(a.axis(), b.axis()) > tolerances.cylinderAngle()) {
            return false;
        }
        var tolerance = tolerances.scaled(tolerances.cylinderDistance(), b.radius());
        if (Math.abs(a.radius() - b.radius()) > tolerance) {
            return false;
        }
        return Vectors.distanceToLine(a.center(), b.center(), b.axis()) <= tolerance;
    }

    private int matchPlanes(Plane a, Plane b) {
        var na = a.normal();
        var nb = b.normal();
        if (Vectors.parallelism(na, nb) > tolerances.planeAngle()) {
            return DIFFERENT;
        }
        var tolerance = tolerances.scaled(tolerances.planeDistance(), b.distance());
        if (na.dot(nb) > 0) {
            return Math.abs(a.distance() - b.distance()) <= tolerance ? SAME : DIFFERENT;
        }
        return Math.abs(a.distance() + b.distance()) <= tolerance ? OPPOSITE : DIFFERENT;
    }

    private boolean matchSpheres(Sphere a, Sphere b) {
        var tolerance = tolerances.scaled(tolerances.sphereDistance(), b.radius());
        return a.center().distance(b.center()) <= tolerance && Math.abs(a.radius() - b.radius()) <= tolerance;
    }

    private boolean matchTori(Torus a, Torus b) {
        if (Vectors.parallelism(a.axis(), b.axis()) > tolerances.torusAngle()) {
            return false;
        }
        var tolerance = tolerances.scaled(tolerances.torusDistance(), b.majorRadius());
        return a.center().distance(b.center()) <= tolerance
        && Math.abs(a.majorRadius() - b.majorRadius()) <= tolerance
        && Math.abs(a.minorRadius() - b.minorRadius()) <= tolerance;
    }
}
