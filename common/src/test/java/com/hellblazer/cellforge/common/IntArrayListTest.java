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
package com.hellblazer.cellforge.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IntArrayListTest {

    @Test
    void testGrow() {
        var list = new IntArrayList();
        assertTrue(list.isEmpty());
        for (int i = 0; i < 20; i++) {
            list.addInt(i * 2);
        }
        assertEquals(20, list.size());
        assertFalse(list.isEmpty());
        assertEquals(38, list.getInt(19));
        assertEquals(4, list.setInt(2, -4));
        assertEquals(-4, list.getInt(2));
    }

    @Test
    void testCopyIsIndependent() {
        var list = IntArrayList.of(3, -4, 5);
        var copy = list.copy();
        assertEquals(3, copy.size());
        copy.setInt(0, 7);
        copy.addInt(9);
        assertEquals(3, list.getInt(0));
        assertEquals(3, list.size());
        assertEquals("[3, -4, 5]", list.toString());
        assertEquals("[7, -4, 5, 9]", copy.toString());
    }

    @Test
    void testRangeChecked() {
        var list = IntArrayList.of(1);
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> list.setInt(-1, 0));
        assertTrue(IntArrayList.of().isEmpty());
    }
}
