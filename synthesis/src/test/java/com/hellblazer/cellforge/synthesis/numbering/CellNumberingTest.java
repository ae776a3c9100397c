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
package com.hellblazer.cellforge.synthesis.numbering;

import com.hellblazer.cellforge.synthesis.bool.CellDefinition;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.cell.VoidOrigin;
import com.hellblazer.cellforge.synthesis.config.EnclosureAttribution;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.CellEntry;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.Delimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CellNumberingTest {

    private SolidEntity<String> outer;
    private SolidEntity<String> innerA;
    private SolidEntity<String> innerB;
    private SolidEntity<String> enclosure;
    private SolidEntity<String> outerVoid;
    private SolidEntity<String> innerVoid;

    private static List<String> render(List<OrderedEntry> entries) {
        return entries.stream()
                      .map(e -> e instanceof CellEntry c ? c.cell().getIdentity() + "=" + c.label()
                                                         : ((Delimiter) e).banner())
                      .toList();
    }

    private static SolidEntity<String> voidOf(int identity, int enclosureId, Integer... origin) {
        return SolidEntity.voidCell(identity, CellDefinition.universe(), null,
                                    new VoidOrigin(enclosureId, List.of(origin)));
    }

    @BeforeEach
    public void setup() {
        outer = SolidEntity.solid(1, "outer", "outer");
        innerA = SolidEntity.solid(2, "a", "a").addEnclosure(1);
        innerB = SolidEntity.solid(3, "b", "b").addEnclosure(1);
        enclosure = SolidEntity.enclosure(4, "shield", 1, 0, "shield");
        outerVoid = voidOf(5, 0, 1, 4);
        innerVoid = voidOf(6, 1, 2, 3);
    }

    @Test
    public void testFlat() {
        var entries = new CellNumbering(0, false, EnclosureAttribution.OUTERMOST_FIRST).number(
        List.of(outer, innerA, innerB), List.of(outerVoid, innerVoid), List.of(enclosure));
        assertEquals(List.of("1=1", "2=2", "3=3", "VOID CELLS", "5=4", "6=5"), render(entries));
        assertEquals(0, enclosure.getLabel());
    }

    @Test
    public void testGrouped() {
        var entries = new CellNumbering(0, true, EnclosureAttribution.OUTERMOST_FIRST).number(
        List.of(outer, innerA, innerB), List.of(outerVoid, innerVoid), List.of(enclosure));
        assertEquals(List.of("1=1", "ENCLOSURE 1", "2=2", "3=3", "6=4", "END ENCLOSURE 1", "VOID CELLS", "5=5"),
                     render(entries));
    }

    @Test
    public void testGroupedWithoutEnclosuresIsFlat() {
        var entries = new CellNumbering(0, true, EnclosureAttribution.OUTERMOST_FIRST).number(List.of(outer),
                                                                                               List.of(outerVoid),
                                                                                               List.of());
        assertEquals(List.of("1=1", "VOID CELLS", "5=2"), render(entries));
    }

    @Test
    public void testNullCellsConsumeNoLabel() {
        innerA.markNull();
        outerVoid.markNull();
        var entries = new CellNumbering(100, false, EnclosureAttribution.OUTERMOST_FIRST).number(
        List.of(outer, innerA, innerB), List.of(outerVoid, innerVoid), List.of(enclosure));
        assertEquals(List.of("1=101", "3=102", "VOID CELLS", "6=103"), render(entries));
        assertEquals(0, innerA.getLabel());
    }

    @Test
    public void testVoidCommentsUseLabels() {
        new CellNumbering(10, false, EnclosureAttribution.OUTERMOST_FIRST).number(List.of(outer, innerA, innerB),
                                                                                 List.of(outerVoid, innerVoid),
                                                                                 List.of(enclosure));
        var eol = System.lineSeparator();
        assertEquals("Automatic Generated Void Cell. Enclosure(0)" + eol + "Enclosed cells : (11)",
                     outerVoid.getComment());
        assertEquals("Automatic Generated Void Cell. Enclosure(1)" + eol + "Enclosed cells : (12, 13)",
                     innerVoid.getComment());
    }

    @Test
    public void testAttribution() {
        var top = SolidEntity.enclosure(10, "top", 1, 0, "");
        var nested = SolidEntity.enclosure(11, "nested", 2, 1, "");

        assertEquals(List.of("ENCLOSURE 1", "1=1", "ENCLOSURE 2", "END ENCLOSURE 2", "END ENCLOSURE 1", "VOID CELLS"),
                     render(numbered(EnclosureAttribution.OUTERMOST_FIRST, top, nested)));
        assertEquals(List.of("ENCLOSURE 1", "ENCLOSURE 2", "1=1", "END ENCLOSURE 2", "END ENCLOSURE 1", "VOID CELLS"),
                     render(numbered(EnclosureAttribution.INNERMOST_FIRST, top, nested)));
        assertEquals(List.of("ENCLOSURE 1", "ENCLOSURE 2", "1=1", "END ENCLOSURE 2", "END ENCLOSURE 1", "VOID CELLS"),
                     render(numbered(EnclosureAttribution.FIRST_DECLARED, top, nested)));
    }

    private List<OrderedEntry> numbered(EnclosureAttribution attribution, SolidEntity<String> top,
                                        SolidEntity<String> nested) {
        var solid = SolidEntity.solid(1, "member", "").addEnclosure(2).addEnclosure(1);
        return new CellNumbering(0, true, attribution).number(List.of(solid), List.of(), List.of(top, nested));
    }

    @Test
    public void testUnknownParentIsTopLevel() {
        var orphan = SolidEntity.enclosure(4, "orphan", 1, 9, "");
        var entries = new CellNumbering(0, true, EnclosureAttribution.OUTERMOST_FIRST).number(List.of(innerA),
                                                                                               List.of(innerVoid),
                                                                                               List.of(orphan));
        assertEquals(List.of("ENCLOSURE 1", "2=1", "6=2", "END ENCLOSURE 1", "VOID CELLS"), render(entries));
    }

    @Test
    public void testNestingCycle() {
        var first = SolidEntity.enclosure(10, "first", 1, 2, "");
        var second = SolidEntity.enclosure(11, "second", 2, 1, "");
        var numbering = new CellNumbering(0, true, EnclosureAttribution.OUTERMOST_FIRST);
        assertThrows(IllegalArgumentException.class,
                     () -> numbering.number(List.of(innerA), List.of(), List.of(first, second)));
    }

    @Test
    public void testInvalidOffset() {
        assertThrows(IllegalArgumentException.class,
                     () -> new CellNumbering(-1, false, EnclosureAttribution.OUTERMOST_FIRST));
    }
}
