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
package com.hellblazer.cellforge.synthesis.voids;

import com.hellblazer.cellforge.common.ParallelTasks;
import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.bool.BooleanSimplifier;
import com.hellblazer.cellforge.synthesis.bool.CellDefinition;
import com.hellblazer.cellforge.synthesis.bool.ComparisonTableBuilder;
import com.hellblazer.cellforge.synthesis.bool.SimplifyOutcome;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.cell.VoidOrigin;
import com.hellblazer.cellforge.synthesis.config.Settings;
import com.hellblazer.cellforge.synthesis.config.SimplifyMode;
import com.hellblazer.cellforge.synthesis.kernel.HalfSpaceOracle;
import com.hellblazer.cellforge.synthesis.surface.Plane;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Generates the void cells: the space inside the bounding box not taken by any solid. The outer region is the box
 * minus the top level enclosures and the solids outside every enclosure; each enclosure is a region of its own, minus
 * its member solids and child enclosures. Regions too crowded to complement in one go are bisected along their longest
 * axis, every leaf box giving one void cell:
 * <pre>
 *     boundary of the leaf  AND  NOT c1  AND ... AND  NOT cn
 * </pre>
 * where c1..cn are the cells overlapping the leaf box. The complement part is simplified against the leaf box
 * before the boundary is added, so the simplification is exact.
 *
 * @author hal.hildebrand
 */
public class VoidGenerator {
    private static final Logger log = LoggerFactory.getLogger(VoidGenerator.class);

    private final SurfaceRegistry        registry;
    private final ComparisonTableBuilder tables;
    private final BooleanSimplifier      simplifier;
    private final Settings               settings;

    public VoidGenerator(HalfSpaceOracle oracle, SurfaceRegistry registry, Settings settings) {
        this.registry = registry;
        this.tables = new ComparisonTableBuilder(oracle, registry);
        this.simplifier = new BooleanSimplifier();
        this.settings = settings;
    }

    /**
     * Generate the void cells of the model.
     *
     * @param solids     solid cells, with definitions and bounds
     * @param enclosures enclosure cells, with definitions and bounds
     * @param box        the bounding box of the whole model
     * @param startId    identities of the voids start at startId + 1
     * @return the void cells, outer region first, then enclosures in input order; null cells included, marked
     */
    public <S> List<SolidEntity<S>> generate(List<SolidEntity<S>> solids, List<SolidEntity<S>> enclosures, Box box,
                                             int startId) throws InterruptedException {
        var contributing = solids.stream().filter(s -> !s.isNullCell() && !excluded(s)).toList();
        var regions = new ArrayList<Region<S>>();
        var outer = new ArrayList<SolidEntity<S>>();
        contributing.stream().filter(s -> s.getEnclosures().isEmpty()).forEach(outer::add);
        enclosures.stream().filter(e -> e.getParentEnclosureId() == 0).forEach(outer::add);
        regions.add(new Region<>(0, box, null, outer));
        for (var enclosure : enclosures) {
            var id = enclosure.getEnclosureId();
            var members = new ArrayList<SolidEntity<S>>();
            contributing.stream().filter(s -> s.getEnclosures().contains(id)).forEach(members::add);
            enclosures.stream().filter(e -> e.getParentEnclosureId() == id).forEach(members::add);
            regions.add(new Region<>(id, enclosure.getBounds(), enclosure.getDefinition(), members));
        }

        var leaves = ParallelTasks.map(regions, this::leaves, settings.parallelism());

        var voids = new ArrayList<SolidEntity<S>>();
        var identity = startId;
        for (var regionLeaves : leaves) {
            for (var leaf : regionLeaves) {
                var cell = SolidEntity.<S>voidCell(++identity, leaf.definition, leaf.box, leaf.origin);
                if (leaf.definition.isEmpty()) {
                    cell.markNull();
                }
                voids.add(cell);
            }
        }
        log.info("Generated {} void cells in {} regions", voids.size(), regions.size());
        return voids;
    }

    private CellDefinition boxDefinition(Box box) {
        return CellDefinition.intersection(registry.register(Plane.x(box.getMinX())),
                                           -registry.register(Plane.x(box.getMaxX())),
                                           registry.register(Plane.y(box.getMinY())),
                                           -registry.register(Plane.y(box.getMaxY())),
                                           registry.register(Plane.z(box.getMinZ())),
                                           -registry.register(Plane.z(box.getMaxZ())));
    }

    private <S> boolean excluded(SolidEntity<S> solid) {
        for (var pattern : settings.voidExclude()) {
            if (solid.getComment().contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private <S> Leaf leaf(Region<S> region, Box box, List<SolidEntity<S>> overlapping, boolean split) {
        var identities = overlapping.stream().map(SolidEntity::getIdentity).toList();
        var origin = new VoidOrigin(region.enclosureId, identities);

        var complement = CellDefinition.intersectionOf(
        overlapping.stream().map(c -> c.getDefinition().complement()).toList());
        if (!overlapping.isEmpty() && settings.simplify() != SimplifyMode.NO) {
            var table = tables.build(complement.surfaces(), box);
            if (simplifier.simplify(complement, table) == SimplifyOutcome.EMPTY) {
                log.debug("Void of region {} in {} is empty", region.enclosureId, box);
                return new Leaf(box, complement, origin);
            }
        }

        CellDefinition definition;
        if (region.definition == null) {
            definition = boxDefinition(box);
        } else if (split) {
            definition = boxDefinition(box);
            definition.intersectWith(region.definition);
        } else {
            definition = region.definition.copy();
        }
        if (!complement.isUniverse()) {
            definition.intersectWith(complement);
        }
        simplifier.normalize(definition);
        return new Leaf(box, definition, origin);
    }

    private <S> List<Leaf> leaves(Region<S> region) {
        var leaves = new ArrayList<Leaf>();
        split(region, region.box, 0, region.members, leaves);
        return leaves;
    }

    private <S> void split(Region<S> region, Box box, int depth, List<SolidEntity<S>> candidates, List<Leaf> leaves) {
        var overlapping = candidates.stream().filter(c -> c.getBounds().intersects(box)).toList();
        var surfaces = new TreeSet<Integer>();
        overlapping.forEach(c -> surfaces.addAll(c.getDefinition().surfaces()));
        var crowded = surfaces.size() > settings.maxSurf() || overlapping.size() > settings.maxBracket();
        var divisible = depth < settings.maxSplitDepth() && box.extent(box.longestAxis()) > settings.minVoidSize();
        if (crowded && divisible) {
            var halves = box.split();
            log.trace("Splitting void region {} at depth {}: {} cells, {} surfaces", region.enclosureId, depth,
                      overlapping.size(), surfaces.size());
            split(region, halves[0], depth + 1, overlapping, leaves);
            split(region, halves[1], depth + 1, overlapping, leaves);
            return;
        }
        leaves.add(leaf(region, box, overlapping, depth > 0));
    }

    private record Leaf(Box box, CellDefinition definition, VoidOrigin origin) {
    }

    /**
     * A region to fill: the box of the region, its own definition (null for the outer box) and the cells inside it
     */
    private record Region<S>(int enclosureId, Box box, CellDefinition definition, List<SolidEntity<S>> members) {
    }
}
