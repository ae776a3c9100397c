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
package com.hellblazer.cellforge.synthesis.bool;

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.config.Tolerances;
import com.hellblazer.cellforge.synthesis.kernel.analytic.AnalyticKernel;
import com.hellblazer.cellforge.synthesis.surface.Plane;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BooleanSimplifierTest {

    private static final Box REGION = new Box(-2, -2, -2, 2, 2, 2);

    private SurfaceRegistry        registry;
    private ComparisonTableBuilder tables;
    private BooleanSimplifier      simplifier;

    // x > 0, x > 1, y > 0, y > 1, x > 3, z > 0, z > 1
    private int x0, x1, y0, y1, x3, z0, z1;

    @BeforeEach
    public void setup() {
        registry = new SurfaceRegistry(Tolerances.getDefault());
        x0 = registry.register(Plane.x(0));
        x1 = registry.register(Plane.x(1));
        y0 = registry.register(Plane.y(0));
        y1 = registry.register(Plane.y(1));
        x3 = registry.register(Plane.x(3));
        z0 = registry.register(Plane.z(0));
        z1 = registry.register(Plane.z(1));
        tables = new ComparisonTableBuilder(new AnalyticKernel(Tolerances.getDefault()), registry);
        simplifier = new BooleanSimplifier();
    }

    private SimplifyOutcome simplify(CellDefinition definition) {
        return simplifier.simplify(definition, tables.build(definition.surfaces(), REGION));
    }

    private static CellDefinition or(CellDefinition... parts) {
        return CellDefinition.union(List.of(parts));
    }

    private static CellDefinition and(CellDefinition... parts) {
        return CellDefinition.intersectionOf(List.of(parts));
    }

    private static CellDefinition lit(int literal) {
        return CellDefinition.leaf(literal);
    }

    @Test
    public void testContradiction() {
        var definition = CellDefinition.intersection(y0, -y0);
        assertEquals(SimplifyOutcome.EMPTY, simplify(definition));
        assertTrue(definition.isEmpty());
    }

    @Test
    public void testDisjointHalfSpaces() {
        var definition = CellDefinition.intersection(-x0, x1, z0);
        assertEquals(SimplifyOutcome.EMPTY, simplify(definition));
    }

    @Test
    public void testConstantLiterals() {
        var definition = CellDefinition.intersection(x0, -x3);
        assertEquals(SimplifyOutcome.EXPRESSION, simplify(definition));
        assertEquals(String.valueOf(x0), definition.toString());

        definition = or(lit(x3), CellDefinition.intersection(x0, -x1));
        simplify(definition);
        assertEquals(x0 + " " + -x1, definition.toString());

        definition = or(lit(-x3), CellDefinition.intersection(x0, -x1));
        assertEquals(SimplifyOutcome.UNIVERSE, simplify(definition));
    }

    @Test
    public void testStrongestAndWeakestLiteral() {
        var definition = CellDefinition.intersection(x0, x1);
        simplify(definition);
        assertEquals(String.valueOf(x1), definition.toString());

        definition = or(lit(x0), lit(x1));
        simplify(definition);
        assertEquals(String.valueOf(x0), definition.toString());
    }

    @Test
    public void testTautology() {
        var definition = or(lit(x0), lit(-x1), lit(z0));
        assertEquals(SimplifyOutcome.UNIVERSE, simplify(definition));
    }

    @Test
    public void testContext() {
        var filtered = and(lit(-x1), or(lit(x1), lit(y0)));
        simplify(filtered);
        assertEquals(-x1 + " " + y0, filtered.toString());

        var satisfied = and(lit(-x0), or(lit(-x1), lit(z0)));
        simplify(satisfied);
        assertEquals(String.valueOf(-x0), satisfied.toString());

        var redundant = or(lit(y0), CellDefinition.intersection(y1, z0));
        simplify(redundant);
        assertEquals(String.valueOf(y0), redundant.toString());
    }

    @Test
    public void testAbsorption() {
        var definition = or(CellDefinition.intersection(y0, z0), CellDefinition.intersection(y0, z0, -z1));
        simplify(definition);
        assertEquals(y0 + " " + z0, definition.toString());
    }

    @Test
    public void testComplementaryMerge() {
        var definition = or(CellDefinition.intersection(y0, z0), CellDefinition.intersection(y0, -z0));
        simplify(definition);
        assertEquals(String.valueOf(y0), definition.toString());
    }

    @Test
    public void testNormalize() {
        var definition = CellDefinition.union(List.of(CellDefinition.intersection(y0, z0), lit(x0))).complement();
        simplifier.normalize(definition);
        assertEquals("(" + -y0 + ":" + -z0 + ") " + -x0, definition.toString());
    }

    @Test
    @DisplayName("Simplified definitions denote the same set within the region and never grow")
    public void testEquivalentAndNeverLarger() {
        var random = new Random(0x5eed);
        int[] ids = { x0, x1, y0, y1, x3, z0, z1 };
        for (int trial = 0; trial < 200; trial++) {
            var definition = randomDefinition(random, ids, 3);
            var simplified = definition.copy();
            var outcome = simplify(simplified);

            assertTrue(simplified.size() <= definition.size(),
                       () -> definition + " grew to " + simplified);
            for (int i = 0; i < 100; i++) {
                var point = new Point3d(-2 + 4 * random.nextDouble(), -2 + 4 * random.nextDouble(),
                                        -2 + 4 * random.nextDouble());
                var side = registry.sideOf(point);
                assertEquals(definition.evaluate(side), simplified.evaluate(side),
                             () -> definition + " simplified to " + simplified + " at " + point);
            }
            switch (outcome) {
                case EMPTY -> assertTrue(simplified.isEmpty());
                case UNIVERSE -> assertTrue(simplified.isUniverse());
                case EXPRESSION -> assertFalse(simplified.isEmpty() || simplified.isUniverse());
            }
        }
    }

    private CellDefinition randomDefinition(Random random, int[] ids, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            var id = ids[random.nextInt(ids.length)];
            return lit(random.nextBoolean() ? id : -id);
        }
        var parts = new ArrayList<CellDefinition>();
        var count = 2 + random.nextInt(3);
        for (int i = 0; i < count; i++) {
            parts.add(randomDefinition(random, ids, depth - 1));
        }
        var definition = random.nextBoolean() ? CellDefinition.intersectionOf(parts) : CellDefinition.union(parts);
        return random.nextInt(5) == 0 ? definition.complement() : definition;
    }
}
