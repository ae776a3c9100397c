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

import com.hellblazer.cellforge.common.IntArrayList;

import java.util.Arrays;

/**
 * Append-only storage of expression nodes addressed by integer handles. Rewrites never modify a node reachable from
 * another definition: every definition owns its arena and nodes are copied, never shared, between arenas.
 *
 * @author hal.hildebrand
 */
public final class ExpressionArena {
    private static final int           INITIAL_CAPACITY = 16;
    private static final IntArrayList  NO_CHILDREN      = new IntArrayList();

    private NodeKind[]     kinds    = new NodeKind[INITIAL_CAPACITY];
    private int[]          literals = new int[INITIAL_CAPACITY];
    private IntArrayList[] children = new IntArrayList[INITIAL_CAPACITY];
    private int            size;

    public int and(IntArrayList operands) {
        return operator(NodeKind.AND, operands);
    }

    public int child(int handle, int slot) {
        return children(handle).getInt(slot);
    }

    public int childCount(int handle) {
        return children(handle).size();
    }

    public int constant(boolean value) {
        return append(value ? NodeKind.TRUE : NodeKind.FALSE, 0, NO_CHILDREN);
    }

    /**
     * Deep copy of a subtree of another arena (or this one) into this arena
     *
     * @return the handle of the copy's root
     */
    public int copyFrom(ExpressionArena source, int handle) {
        var kind = source.kind(handle);
        return switch (kind) {
            case LEAF -> leaf(source.literal(handle));
            case TRUE -> constant(true);
            case FALSE -> constant(false);
            default -> {
                var operands = new IntArrayList();
                var count = source.childCount(handle);
                for (int i = 0; i < count; i++) {
                    operands.addInt(copyFrom(source, source.child(handle, i)));
                }
                yield append(kind, 0, operands);
            }
        };
    }

    public NodeKind kind(int handle) {
        check(handle);
        return kinds[handle];
    }

    public int leaf(int literal) {
        if (literal == 0) {
            throw new IllegalArgumentException("Surface reference 0 is not a half-space");
        }
        return append(NodeKind.LEAF, literal, NO_CHILDREN);
    }

    public int literal(int handle) {
        check(handle);
        if (kinds[handle] != NodeKind.LEAF) {
            throw new IllegalArgumentException("Node " + handle + " is not a leaf: " + kinds[handle]);
        }
        return literals[handle];
    }

    public int not(int operand) {
        check(operand);
        return append(NodeKind.NOT, 0, IntArrayList.of(operand));
    }

    /**
     * Number of nodes ever allocated, reachable or not
     */
    public int nodeCount() {
        return size;
    }

    public int operator(NodeKind kind, IntArrayList operands) {
        if (kind != NodeKind.AND && kind != NodeKind.OR) {
            throw new IllegalArgumentException("Not an n-ary operator: " + kind);
        }
        for (int i = 0; i < operands.size(); i++) {
            check(operands.getInt(i));
        }
        return append(kind, 0, operands.copy());
    }

    public int or(IntArrayList operands) {
        return operator(NodeKind.OR, operands);
    }

    /**
     * Repoint one child slot of an operator node
     */
    public void setChild(int parent, int slot, int child) {
        check(child);
        children(parent).setInt(slot, child);
    }

    IntArrayList children(int handle) {
        check(handle);
        return children[handle];
    }

    private int append(NodeKind kind, int literal, IntArrayList operands) {
        if (size == kinds.length) {
            var capacity = size * 2;
            kinds = Arrays.copyOf(kinds, capacity);
            literals = Arrays.copyOf(literals, capacity);
            children = Arrays.copyOf(children, capacity);
        }
        kinds[size] = kind;
        literals[size] = literal;
        children[size] = operands;
        return size++;
    }

    private void check(int handle) {
        if (handle < 0 || handle >= size) {
            throw new IndexOutOfBoundsException("Invalid node handle " + handle + ", arena size " + size);
        }
    }
}
