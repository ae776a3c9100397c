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
package com.hellblazer.cellforge.synthesis.build;

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.bool.CellDefinition;
import com.hellblazer.cellforge.synthesis.kernel.SolidKernel;
import com.hellblazer.cellforge.synthesis.surface.Cone;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Turns a solid into a cell definition: each convex fragment becomes the intersection of the half-spaces of its
 * faces, and the solid the union of its fragments. Surfaces are registered on the way, so building is where the
 * surface ids of a run come from. Safe to use from several threads on distinct solids.
 *
 * @param <S> the kernel's solid type
 * @param <F> the kernel's face type
 * @author hal.hildebrand
 */
public class CellDefinitionBuilder<S, F> {
    private static final Logger log = LoggerFactory.getLogger(CellDefinitionBuilder.class);

    private final SolidKernel<S, F> kernel;
    private final SurfaceRegistry   registry;

    public CellDefinitionBuilder(SolidKernel<S, F> kernel, SurfaceRegistry registry) {
        this.kernel = kernel;
        this.registry = registry;
    }

    public BuildResult build(S solid) {
        var fragments = kernel.decomposeIntoConvex(solid);
        var warnings = new ArrayList<String>();
        if (fragments.isEmpty()) {
            warnings.add("Decomposition produced no convex fragments");
            return new BuildResult(CellDefinition.empty(), null, warnings, kernel.boundingBox(solid));
        }
        var cones = new ConeRecord();
        var parts = new ArrayList<CellDefinition>(fragments.size());
        var boxes = new ArrayList<Box>(fragments.size());
        for (var fragment : fragments) {
            var literals = new LinkedHashSet<Integer>();
            for (var face : fragment.faces()) {
                var descriptor = kernel.classifyFace(face);
                if (!descriptor.classified()) {
                    warnings.add("Unclassified face, using approximation " + descriptor.surface());
                }
                var literal = descriptor.sense() * registry.register(descriptor.surface());
                literals.add(literal);
                if (descriptor.surface() instanceof Cone cone) {
                    cones.add(new ConePatch(literal, registry.register(cone.apexPlane())));
                }
            }
            parts.add(CellDefinition.intersection(literals.stream().mapToInt(Integer::intValue).toArray()));
            boxes.add(kernel.boundingBox(fragment));
        }
        var definition = parts.size() == 1 ? parts.get(0) : CellDefinition.union(parts);
        if (!warnings.isEmpty()) {
            log.debug("Built {} with {} warnings", definition, warnings.size());
        }
        return new BuildResult(definition, cones.isEmpty() ? null : cones, warnings, Box.union(boxes));
    }
}
