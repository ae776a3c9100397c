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
package com.hellblazer.cellforge.synthesis.cell;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class VoidOriginTest {

    @Test
    public void testComment() {
        var origin = new VoidOrigin(3, List.of(4, 9));
        assertEquals("Automatic Generated Void Cell. Enclosure(3)" + System.lineSeparator()
                     + "Enclosed cells : (4, 9)", origin.comment());
        assertEquals("Automatic Generated Void Cell. Enclosure(0)", new VoidOrigin(0, List.of()).comment());
    }

    @Test
    public void testCommentWithLabels() {
        var origin = new VoidOrigin(0, List.of(4, 9, 12));
        assertEquals("Automatic Generated Void Cell. Enclosure(0)" + System.lineSeparator()
                     + "Enclosed cells : (101, 103)", origin.comment(Map.of(4, 101, 12, 103)));
        assertEquals("Automatic Generated Void Cell. Enclosure(0)", origin.comment(Map.of()));
    }

    @Test
    public void testVoidCellCarriesOrigin() {
        var origin = new VoidOrigin(2, List.of(1));
        var cell = SolidEntity.<String>voidCell(7, null, null, origin);
        assertTrue(cell.isVoid());
        assertEquals(2, cell.getEnclosureId());
        assertEquals(origin.comment(), cell.getComment());
        assertThrows(IllegalStateException.class, cell::getSolid);
    }

    @Test
    public void testLabels() {
        var cell = SolidEntity.solid(1, "solid", null);
        assertEquals("", cell.getComment());
        assertThrows(IllegalArgumentException.class, () -> cell.setLabel(0));
        cell.setLabel(5);
        assertThrows(IllegalStateException.class, () -> cell.setLabel(6));
        assertThrows(IllegalStateException.class, () -> cell.setIdentity(2));
        assertThrows(IllegalArgumentException.class, () -> SolidEntity.enclosure(2, "e", 0, 0, ""));
        assertThrows(IllegalArgumentException.class, () -> SolidEntity.enclosure(2, "e", 1, 1, ""));
    }
}
