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

import com.hellblazer.cellforge.synthesis.config.Tolerances;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SurfaceRegistryTest {

    private SurfaceRegistry registry;

    @BeforeEach
    public void setup() {
        registry = new SurfaceRegistry(Tolerances.getDefault());
    }

    @Test
    public void testIdempotentRegistration() {
        var plane = Plane.x(1.0);
        var id = registry.register(plane);
        assertEquals(1, id);
        assertEquals(id, registry.register(Plane.x(1.0)));
        assertEquals(id, registry.register(Plane.x(1.0 + 1e-6)), "within plane distance tolerance");
        assertEquals(1, registry.size());
        assertEquals(2, registry.register(Plane.x(1.01)));
        assertEquals(2, registry.size());
    }

    @Test
    @DisplayName("A reversed plane maps onto the kept plane with a negated id")
    public void testOppositePlane() {
        var id = registry.register(Plane.z(3.0));
        var flipped = registry.register(new Plane(new Vector3d(0, 0, -1), -3.0));
        assertEquals(-id, flipped);
        assertEquals(1, registry.size());

        // the positive side of the candidate is the negative side of the kept plane
        var above = new Point3d(0, 0, 5);
        assertTrue(registry.sideOf(above).test(id));
        assertTrue(registry.halfSpace(flipped).signedValue(above) < 0);
    }

    @Test
    public void testDistinctKindsNeverMatch() {
        var sphere = registry.register(new Sphere(new Point3d(), 1.0));
        var cylinder = registry.register(new Cylinder(new Point3d(), new Vector3d(0, 0, 1), 1.0));
        var plane = registry.register(Plane.x(0));
        assertEquals(3, new HashSet<>(List.of(sphere, cylinder, plane)).size());
        assertEquals(1, registry.count(SurfaceKind.SPHERE));
        assertEquals(1, registry.count(SurfaceKind.CYLINDER));
        assertEquals(0, registry.count(SurfaceKind.TORUS));
    }

    @Test
    public void testCylinderAlongSameAxisLine() {
        var a = registry.register(new Cylinder(new Point3d(0, 0, 0), new Vector3d(0, 0, 1), 2.0));
        // another point of the same axis line, axis reversed
        var b = registry.register(new Cylinder(new Point3d(0, 0, 7), new Vector3d(0, 0, -1), 2.0));
        assertEquals(a, b);
        var c = registry.register(new Cylinder(new Point3d(0.5, 0, 0), new Vector3d(0, 0, 1), 2.0));
        assertNotEquals(a, c);
    }

    @Test
    public void testConeAxisEitherDirection() {
        var a = registry.register(new Cone(new Point3d(1, 1, 1), new Vector3d(1, 0, 0), 0.3));
        var b = registry.register(new Cone(new Point3d(1, 1, 1), new Vector3d(-1, 0, 0), 0.3));
        var c = registry.register(new Cone(new Point3d(1, 1, 1), new Vector3d(1, 0, 0), 0.4));
        assertEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test
    public void testOffsetIds() {
        var offset = new SurfaceRegistry(Tolerances.getDefault(), 100);
        assertEquals(101, offset.register(Plane.y(0)));
        assertEquals(102, offset.register(Plane.y(1)));
        assertEquals(Plane.y(1), offset.get(102).surface());
        assertEquals(Plane.y(1), offset.get(-102).surface());
        assertThrows(IllegalArgumentException.class, () -> offset.get(1));
        assertThrows(IllegalArgumentException.class, () -> new SurfaceRegistry(Tolerances.getDefault(), -1));
    }

    @Test
    public void testFindDoesNotRegister() {
        assertTrue(registry.find(Plane.x(0)).isEmpty());
        var id = registry.register(Plane.x(0));
        assertEquals(-id, registry.find(Plane.x(0).flipped()).orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Matching is not transitive: only kept surfaces are compared")
    public void testToleranceChain() {
        // a ~ b and b ~ c within 1e-4, a and c apart
        var a = Plane.x(0);
        var b = Plane.x(6.0e-5);
        var c = Plane.x(1.2e-4);

        var idA = registry.register(a);
        var idC = registry.register(c);
        assertNotEquals(idA, idC);
        assertEquals(idA, registry.register(b), "the first kept match wins");
        assertEquals(idC, registry.register(c));
        assertEquals(2, registry.size());
        assertEquals(a, registry.get(idA).surface());

        var chained = new SurfaceRegistry(Tolerances.getDefault());
        var kept = chained.register(a);
        assertEquals(kept, chained.register(b));
        var next = chained.register(c);
        assertNotEquals(kept, next, "the merged duplicate is not a representative");
        assertEquals(2, chained.size());
        assertEquals(c, chained.get(next).surface());
    }

    @Test
    public void testRelativeTolerance() {
        var relative = new SurfaceRegistry(
        Tolerances.builder().withRelativeTolerance(true).withRelativePrecision(1e-4).build());
        var id = relative.register(Plane.x(10_000.0));
        // 1e-4 of the offset
        assertEquals(id, relative.register(Plane.x(10_000.5)));
        assertNotEquals(id, relative.register(Plane.x(10_002.0)));
        // the absolute tolerance still holds near the origin
        var small = relative.register(Plane.x(1.0));
        assertEquals(small, relative.register(Plane.x(1.00005)));

        var fine = new SurfaceRegistry(Tolerances.builder().withRelativeTolerance(true).build());
        var far = fine.register(Plane.x(10_000.0));
        assertEquals(far, fine.register(Plane.x(10_000.005)));
        assertNotEquals(far, fine.register(Plane.x(10_000.5)));

        var absolute = registry.register(Plane.x(10_000.0));
        assertNotEquals(absolute, registry.register(Plane.x(10_000.5)));
    }

    @Test
    @Timeout(30)
    @DisplayName("Concurrent registration of the same surfaces converges on one id per surface")
    public void testConcurrentRegistration() throws Exception {
        var threads = 8;
        var executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<List<Integer>>>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    var ids = new ArrayList<Integer>();
                    for (int i = 0; i < 50; i++) {
                        ids.add(registry.register(Plane.x(i)));
                        ids.add(registry.register(new Sphere(new Point3d(i, 0, 0), 1.0)));
                    }
                    return ids;
                }));
            }
            start.countDown();
            var first = futures.get(0).get(20, TimeUnit.SECONDS);
            for (var future : futures) {
                assertEquals(first, future.get(20, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(100, registry.size());
        assertEquals(100, new HashSet<>(registry.surfaces().stream().map(RegisteredSurface::id).toList()).size());
    }
}
