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

import javax.vecmath.Point3d;

/**
 * An analytic surface. Every surface has a canonical implicit function, approximately a signed distance, negative on
 * the inner side (behind a plane's normal, inside a quadric) and positive on the outer side. A half-space reference
 * {@code +id} denotes the positive side of the registered surface, {@code -id} the negative side.
 *
 * @author hal.hildebrand
 */
public sealed interface Surface permits Plane, Cylinder, Cone, Sphere, Torus {

    /**
     * Signed value of the canonical implicit function at the point
     */
    double evaluate(Point3d point);

    SurfaceKind kind();

    /**
     * Parametric coefficients, in the order documented by each kind
     */
    double[] parameters();
}
