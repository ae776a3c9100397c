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
package com.hellblazer.cellforge.synthesis;

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.Diagnostic.Stage;
import com.hellblazer.cellforge.synthesis.UnsupportedGeometryException.Reason;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.config.Options;
import com.hellblazer.cellforge.synthesis.config.Settings;
import com.hellblazer.cellforge.synthesis.config.SplineSurfaces;
import com.hellblazer.cellforge.synthesis.config.Tolerances;
import com.hellblazer.cellforge.synthesis.kernel.analytic.AnalyticKernel;
import com.hellblazer.cellforge.synthesis.kernel.analytic.AnalyticSolid;
import com.hellblazer.cellforge.synthesis.kernel.analytic.BoundingFace;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.CellEntry;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.Delimiter;
import com.hellblazer.cellforge.synthesis.surface.SurfaceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class CadToCsgTest {

    @TempDir
    Path tempDir;

    private AnalyticKernel                        kernel;
    private CadToCsg<AnalyticSolid, BoundingFace> converter;

    private static SolidEntity<AnalyticSolid> cube(Box box, String comment) {
        return SolidEntity.solid(0, AnalyticSolid.box(box), comment);
    }

    private static List<String> render(List<OrderedEntry> entries) {
        return entries.stream()
                      .map(e -> e instanceof CellEntry c ? c.cell().getIdentity() + "=" + c.label()
                                                         : ((Delimiter) e).banner())
                      .toList();
    }

    private static boolean inside(SolidEntity<AnalyticSolid> cell, ConversionResult<AnalyticSolid> result,
                                  double x, double y, double z) {
        return cell.getDefinition().evaluate(result.registry().sideOf(new Point3d(x, y, z)));
    }

    @BeforeEach
    public void setup() {
        kernel = new AnalyticKernel(Tolerances.getDefault());
        converter = new CadToCsg<>(kernel);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Two overlapping cubes give two solid cells and one void")
    public void testOverlappingCubes() throws InterruptedException {
        converter.load(LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "first"),
                                              cube(new Box(0.5, 0, 0, 1.5, 1, 1), "second"))));
        var result = converter.start();

        assertEquals(List.of("1=1", "2=2", "VOID CELLS", "3=3"), render(result.entries()));
        assertEquals(2, result.solidCells().size());
        assertEquals(1, result.voidCells().size());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals(14, result.registry().count(SurfaceKind.PLANE));
        assertEquals(-10.0, result.boundingBox().getMinX(), 1.0e-9);
        assertEquals(11.5, result.boundingBox().getMaxX(), 1.0e-9);
        assertEquals(11.0, result.boundingBox().getMaxZ(), 1.0e-9);
        assertTrue(result.timings().containsKey(Stage.BUILD));
        assertTrue(result.timings().containsKey(Stage.VOID));
        assertFalse(result.timings().containsKey(Stage.OVERLAP));

        var first = result.solidCells().get(0);
        var second = result.solidCells().get(1);
        var voidCell = result.voidCells().get(0);
        assertTrue(inside(first, result, 0.75, 0.5, 0.5));
        assertTrue(inside(second, result, 0.75, 0.5, 0.5), "overlap is kept without forceNoOverlap");
        assertFalse(inside(voidCell, result, 0.75, 0.5, 0.5));
        assertFalse(inside(voidCell, result, 1.25, 0.5, 0.5));
        assertTrue(inside(voidCell, result, 5, 5, 5));
        assertFalse(inside(voidCell, result, 12, 0, 0));
        assertTrue(voidCell.getComment().endsWith("Enclosed cells : (1, 2)"));
    }

    @Test
    public void testForceNoOverlap() throws InterruptedException {
        converter.setOptions(Options.getDefault().withForceNoOverlap(true));
        converter.load(LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "first"),
                                              cube(new Box(0.5, 0, 0, 1.5, 1, 1), "second"),
                                              cube(Box.cube(0, 0, 0, 1), "copy of first"))));
        var result = converter.start();

        assertEquals(List.of("1=1", "2=2", "VOID CELLS", "4=3"), render(result.entries()));
        var second = result.solidCells().get(1);
        assertFalse(inside(second, result, 0.75, 0.5, 0.5));
        assertTrue(inside(second, result, 1.25, 0.5, 0.5));
        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(Stage.OVERLAP, diagnostic.stage());
        assertEquals(3, diagnostic.identity());
        assertEquals("copy of first", diagnostic.comment());
        assertTrue(result.timings().containsKey(Stage.OVERLAP));
    }

    @Test
    public void testMultipleModelsAndSkippedSolids() throws InterruptedException {
        converter.setSettings(Settings.builder().withSkipSolids(List.of(0)).withStartCell(100).build());
        converter.load(LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "a"), cube(Box.cube(2, 0, 0, 1), "b"))),
                       LoadedModel.of(List.of(cube(Box.cube(4, 0, 0, 1), "c"))));

        assertEquals(List.of(2, 3), converter.getSolids().stream().map(SolidEntity::getIdentity).toList());
        var result = converter.start();
        assertEquals(List.of("2=100", "3=101", "VOID CELLS", "4=102"), render(result.entries()));
    }

    @Test
    public void testSkippedSolidOutOfRange() {
        converter.setSettings(Settings.builder().withSkipSolids(List.of(2)).build());
        assertThrows(IllegalArgumentException.class,
                     () -> converter.load(LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "a")))));
    }

    @Test
    public void testEmptyModel() {
        assertThrows(IllegalStateException.class, () -> converter.start());
        converter.load(LoadedModel.of(List.of()));
        assertThrows(IllegalStateException.class, () -> converter.start());
    }

    @Test
    public void testSplineSurfaces() throws InterruptedException {
        var spline = SolidEntity.solid(0, AnalyticSolid.box(Box.cube(2, 0, 0, 1)).withSplineSurfaces(), "spline");
        var model = LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "plain"), spline));

        var stop = assertThrows(UnsupportedGeometryException.class, () -> converter.load(model));
        assertEquals(Reason.UNSUPPORTED_SURFACE_IN_SOLID, stop.getReason());
        assertEquals(2, stop.getIdentity());

        converter.setSettings(Settings.builder().withSplineSurfaces(SplineSurfaces.REMOVE).build());
        converter.load(model);
        assertEquals(1, converter.getSolids().size());
        var result = converter.start();
        assertEquals(1, result.solidCells().size());
        assertEquals(Stage.LOAD, result.diagnostics().get(0).stage());
    }

    @Test
    public void testSplineSurfacesIgnored() throws InterruptedException {
        converter.setSettings(Settings.builder().withSplineSurfaces(SplineSurfaces.IGNORE).build());
        var spline = SolidEntity.solid(0, AnalyticSolid.box(Box.cube(2, 0, 0, 1)).withSplineSurfaces(), "spline");
        converter.load(LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "plain"), spline)));
        var result = converter.start();
        assertEquals(2, result.solidCells().size());
        assertEquals(List.of(Stage.LOAD), result.diagnostics().stream().map(Diagnostic::stage).toList());
    }

    @Test
    public void testUnsupportedEnclosure() {
        converter.setSettings(Settings.builder().withSplineSurfaces(SplineSurfaces.IGNORE).build());
        var enclosure = SolidEntity.enclosure(0, AnalyticSolid.box(Box.cube(-1, -1, -1, 3)).withSplineSurfaces(), 1,
                                              0, "shell");
        var model = new LoadedModel<>(List.of(cube(Box.cube(0, 0, 0, 1), "plain")), List.of(enclosure));
        var e = assertThrows(UnsupportedGeometryException.class, () -> converter.load(model));
        assertEquals(Reason.UNSUPPORTED_SURFACE_IN_ENCLOSURE, e.getReason());
        assertEquals(2, e.getIdentity());
    }

    @Test
    public void testEnclosureGrouping() throws InterruptedException {
        converter.setSettings(Settings.builder().withSortEnclosure(true).build());
        var inner = cube(Box.cube(0, 0, 0, 1), "inner").addEnclosure(1);
        var outer = cube(Box.cube(5, 0, 0, 1), "outer");
        var enclosure = SolidEntity.enclosure(0, AnalyticSolid.box(new Box(-1, -1, -1, 3, 2, 2)), 1, 0, "shell");
        converter.load(new LoadedModel<>(List.of(inner, outer), List.of(enclosure)));
        var result = converter.start();

        assertEquals(List.of("ENCLOSURE 1", "1=1", "5=2", "END ENCLOSURE 1", "2=3", "VOID CELLS", "4=4"),
                     render(result.entries()));
        var enclosureVoid = result.voidCells().get(0);
        var outerVoid = result.voidCells().get(1);
        assertTrue(inside(enclosureVoid, result, 2, 0.5, 0.5));
        assertFalse(inside(enclosureVoid, result, 0.5, 0.5, 0.5));
        assertFalse(inside(enclosureVoid, result, 4, 0.5, 0.5));
        assertTrue(inside(outerVoid, result, 4, 0.5, 0.5));
        assertFalse(inside(outerVoid, result, 2, 0.5, 0.5));
        assertFalse(inside(outerVoid, result, 5.5, 0.5, 0.5));
        assertTrue(outerVoid.getComment().endsWith("Enclosed cells : (3)"));
    }

    @Test
    public void testConeCellsUseOneNappe() throws InterruptedException {
        var cone = SolidEntity.solid(0, AnalyticSolid.cone(new Point3d(), new Vector3d(0, 0, 1), Math.PI / 6, 2),
                                     "cone");
        converter.load(LoadedModel.of(List.of(cone)));
        var result = converter.start();

        var cell = result.solidCells().get(0);
        var voidCell = result.voidCells().get(0);
        assertTrue(inside(cell, result, 0, 0, 1));
        assertFalse(inside(cell, result, 0, 0, -1));
        assertTrue(inside(voidCell, result, 0, 0, -1));
        assertFalse(inside(voidCell, result, 0, 0, 1));
    }

    @Test
    @DisplayName("A cell overlapping a cone keeps the region of the mirrored nappe")
    public void testForceNoOverlapWithCone() throws InterruptedException {
        converter.setOptions(Options.getDefault().withForceNoOverlap(true));
        var cone = SolidEntity.solid(0, AnalyticSolid.cone(new Point3d(), new Vector3d(0, 0, 1), Math.PI / 6, 2),
                                     "cone");
        converter.load(LoadedModel.of(List.of(cone, cube(new Box(-1, -1, -1, 1, 1, 1), "block"))));
        var result = converter.start();

        assertEquals(2, result.solidCells().size());
        var coneCell = result.solidCells().get(0);
        var block = result.solidCells().get(1);
        var voidCell = result.voidCells().get(0);
        assertTrue(inside(block, result, 0, 0, -0.5));
        assertFalse(inside(coneCell, result, 0, 0, -0.5));
        assertFalse(inside(voidCell, result, 0, 0, -0.5));
        assertTrue(inside(coneCell, result, 0, 0, 0.5));
        assertFalse(inside(block, result, 0, 0, 0.5));
        assertFalse(inside(voidCell, result, 0, 0, 0.5));
        assertTrue(inside(block, result, 0.9, 0.9, 0.5));
        assertTrue(inside(voidCell, result, 0, 0, 3));
    }

    @Test
    public void testRepeatedStart() throws InterruptedException {
        converter.setOptions(Options.getDefault().withForceNoOverlap(true));
        converter.setSettings(Settings.builder().withSplineSurfaces(SplineSurfaces.REMOVE).build());
        var spline = SolidEntity.solid(0, AnalyticSolid.box(Box.cube(2, 0, 0, 1)).withSplineSurfaces(), "spline");
        converter.load(LoadedModel.of(List.of(cube(Box.cube(0, 0, 0, 1), "a"), spline,
                                              cube(Box.cube(0, 0, 0, 1), "copy of a"))));

        var first = converter.start();
        var second = converter.start();

        assertEquals(List.of("1=1", "VOID CELLS", "4=2"), render(first.entries()));
        assertEquals(render(first.entries()), render(second.entries()));
        assertEquals(List.of(Stage.LOAD, Stage.OVERLAP), first.diagnostics().stream().map(Diagnostic::stage).toList());
        assertEquals(first.diagnostics(), second.diagnostics());
        assertTrue(inside(second.solidCells().get(0), second, 0.5, 0.5, 0.5));
    }

    @Test
    public void testSuspiciousSolidExported() throws InterruptedException {
        converter.setSettings(Settings.builder().withOutPath(tempDir).build());
        var wire = SolidEntity.solid(0, AnalyticSolid.cylinder(new Point3d(), new Vector3d(0, 0, 1), 1.0e-5, 1),
                                     "wire");
        converter.load(LoadedModel.of(List.of(cube(Box.cube(2, 0, 0, 1), "plain"), wire)));
        var result = converter.start();

        assertTrue(Files.exists(tempDir.resolve("suspicious_solids").resolve("Solid_original_1")));
        assertEquals(List.of(Stage.BUILD), result.diagnostics().stream().map(Diagnostic::stage).toList());
        assertEquals(2, result.diagnostics().get(0).identity());
    }

    @Test
    public void testExportFailureRecorded() throws Exception {
        var spied = spy(new AnalyticKernel(Tolerances.getDefault()));
        doThrow(new IOException("disk full")).when(spied).export(anyList(), any(Path.class));
        var failing = new CadToCsg<>(spied);
        failing.setSettings(Settings.builder().withOutPath(tempDir).withVoidGen(false).build());
        var wire = SolidEntity.solid(0, AnalyticSolid.cylinder(new Point3d(), new Vector3d(0, 0, 1), 1.0e-5, 1),
                                     "wire");
        failing.load(LoadedModel.of(List.of(wire)));
        var result = failing.start();

        verify(spied).export(anyList(), eq(tempDir.resolve("suspicious_solids").resolve("Solid_original_0")));
        assertEquals(List.of(Stage.BUILD, Stage.DECOMPOSITION),
                     result.diagnostics().stream().map(Diagnostic::stage).toList());
        assertTrue(result.voidCells().isEmpty());
    }

    @Test
    public void testParallelRun() throws InterruptedException {
        converter.setSettings(Settings.builder().withParallelism(4).build());
        var cells = new ArrayList<SolidEntity<AnalyticSolid>>();
        for (int i = 0; i < 8; i++) {
            cells.add(cube(Box.cube(2 * i, 0, 0, 1), "cube " + i));
        }
        converter.load(LoadedModel.of(cells));
        var result = converter.start();

        assertEquals(9, result.cells().size());
        for (int i = 0; i < 8; i++) {
            var cell = result.solidCells().get(i);
            assertEquals(i + 1, cell.getLabel());
            assertTrue(inside(cell, result, 2 * i + 0.5, 0.5, 0.5));
            assertFalse(inside(cell, result, 2 * i + 1.5, 0.5, 0.5));
        }
    }
}
