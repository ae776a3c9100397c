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
package com.hellblazer.cellforge.synthesis.kernel;

import com.hellblazer.cellforge.geometry.Box;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The B-rep kernel the synthesis engine is driven by: convex decomposition, face classification, bounding boxes and
 * the half-space predicates.
 *
 * @param <S> the kernel's solid type
 * @param <F> the kernel's face type
 * @author hal.hildebrand
 */
public interface SolidKernel<S, F> extends HalfSpaceOracle {

    Box boundingBox(S solid);

    Box boundingBox(ConvexFragment<F> fragment);

    SurfaceDescriptor classifyFace(F face);

    /**
     * Split a solid into convex fragments.
     *
     * @return the fragments, never empty for a non-empty solid
     */
    List<ConvexFragment<F>> decomposeIntoConvex(S solid);

    /**
     * Write the solids to the target file for inspection. Kernels without an exchange format ignore the call.
     */
    default void export(List<S> solids, Path target) throws IOException {
        // nothing to write by default
    }

    /**
     * True if the solid's boundary has surfaces outside the kinds the engine models, such as free-form splines
     */
    default boolean hasUnsupportedSurfaces(S solid) {
        return false;
    }
}
