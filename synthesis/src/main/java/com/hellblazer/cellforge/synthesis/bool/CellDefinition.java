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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * A cell definition: a boolean expression over signed surface references. A positive literal {@code +s} denotes the
 * positive side of surface s, {@code -s} the negative side. Each definition owns its node arena; combining
 * definitions copies nodes, so mutating one definition never changes another.
 *
 * @author hal.hildebrand
 */
public final class CellDefinition {

    private ExpressionArena arena;
    private int             root;

    private CellDefinition(ExpressionArena arena, int root) {
        this.arena = arena;
        this.root = root;
    }

    public static CellDefinition empty() {
        var arena = new ExpressionArena();
        return new CellDefinition(arena, arena.constant(false));
    }

    /**
     * Intersection of copies of the parts, the universe when there are none
     */
    public static CellDefinition intersectionOf(Collection<CellDefinition> parts) {
        return combine(NodeKind.AND, parts);
    }

    /**
     * Intersection of half-spaces, the universe when there are none
     */
    public static CellDefinition intersection(int... literals) {
        var arena = new ExpressionArena();
        if (literals.length == 0) {
            return new CellDefinition(arena, arena.constant(true));
        }
        if (literals.length == 1) {
            return new CellDefinition(arena, arena.leaf(literals[0]));
        }
        var operands = new IntArrayList();
        for (var literal : literals) {
            operands.addInt(arena.leaf(literal));
        }
        return new CellDefinition(arena, arena.and(operands));
    }

    public static CellDefinition leaf(int literal) {
        var arena = new ExpressionArena();
        return new CellDefinition(arena, arena.leaf(literal));
    }

    /**
     * Union of copies of the parts, empty when there are none
     */
    public static CellDefinition union(Collection<CellDefinition> parts) {
        return combine(NodeKind.OR, parts);
    }

    public static CellDefinition universe() {
        var arena = new ExpressionArena();
        return new CellDefinition(arena, arena.constant(true));
    }

    private static CellDefinition combine(NodeKind operator, Collection<CellDefinition> parts) {
        var arena = new ExpressionArena();
        if (parts.isEmpty()) {
            return new CellDefinition(arena, arena.constant(operator == NodeKind.AND));
        }
        var operands = new IntArrayList();
        for (var part : parts) {
            operands.addInt(arena.copyFrom(part.arena, part.root));
        }
        if (operands.size() == 1) {
            return new CellDefinition(arena, operands.getInt(0));
        }
        return new CellDefinition(arena, arena.operator(operator, operands));
    }

    public int child(int handle, int slot) {
        return arena.child(handle, slot);
    }

    public int childCount(int handle) {
        return arena.childCount(handle);
    }

    /**
     * Rebuild the arena with only the nodes reachable from the root
     */
    public void compact() {
        var compacted = new ExpressionArena();
        root = compacted.copyFrom(arena, root);
        arena = compacted;
    }

    /**
     * The complement, as a new definition
     */
    public CellDefinition complement() {
        var target = new ExpressionArena();
        var copied = target.copyFrom(arena, root);
        return new CellDefinition(target, target.not(copied));
    }

    public CellDefinition copy() {
        var target = new ExpressionArena();
        return new CellDefinition(target, target.copyFrom(arena, root));
    }

    /**
     * Evaluate the expression at a point
     *
     * @param positiveSide for a surface id, true if the point lies on the positive side of that surface
     */
    public boolean evaluate(IntPredicate positiveSide) {
        return evaluate(root, positiveSide);
    }

    /**
     * Intersect this definition, in place, with a copy of the other
     */
    public void intersectWith(CellDefinition other) {
        var copied = arena.copyFrom(other.arena, other.root);
        root = arena.and(IntArrayList.of(root, copied));
    }

    public boolean isEmpty() {
        return arena.kind(root) == NodeKind.FALSE;
    }

    public boolean isUniverse() {
        return arena.kind(root) == NodeKind.TRUE;
    }

    public NodeKind kind(int handle) {
        return arena.kind(handle);
    }

    /**
     * Nesting depth of the expression: 0 for a literal, a constant or a plain intersection of literals, otherwise one
     * more than the deepest operand
     */
    public int level() {
        return level(root);
    }

    public int literal(int handle) {
        return arena.literal(handle);
    }

    /**
     * Substitute every occurrence of a signed literal with a fresh copy of the replacement. The opposite literal is
     * left alone.
     *
     * @return the number of occurrences replaced
     */
    public int replaceLiteral(int literal, CellDefinition replacement) {
        var parents = new ArrayList<int[]>();
        var rootMatches = collect(root, literal, parents);
        for (var slot : parents) {
            arena.setChild(slot[0], slot[1], arena.copyFrom(replacement.arena, replacement.root));
        }
        if (rootMatches) {
            root = arena.copyFrom(replacement.arena, replacement.root);
            return parents.size() + 1;
        }
        return parents.size();
    }

    public int root() {
        return root;
    }

    /**
     * Number of nodes reachable from the root
     */
    public int size() {
        return size(root);
    }

    /**
     * Unsigned ids of the surfaces referenced, ascending
     */
    public SortedSet<Integer> surfaces() {
        var ids = new TreeSet<Integer>();
        surfaces(root, ids);
        return Collections.unmodifiableSortedSet(ids);
    }

    @Override
    public String toString() {
        return ExpressionFormatter.format(this);
    }

    ExpressionArena arena() {
        return arena;
    }

    void setRoot(int root) {
        this.root = root;
    }

    int size(int handle) {
        var count = 1;
        if (arena.kind(handle).isOperator()) {
            for (int i = 0; i < arena.childCount(handle); i++) {
                count += size(arena.child(handle, i));
            }
        }
        return count;
    }

    private boolean collect(int handle, int literal, List<int[]> parents) {
        var kind = arena.kind(handle);
        if (kind == NodeKind.LEAF) {
            return arena.literal(handle) == literal;
        }
        if (!kind.isOperator()) {
            return false;
        }
        for (int i = 0; i < arena.childCount(handle); i++) {
            if (collect(arena.child(handle, i), literal, parents)) {
                parents.add(new int[] { handle, i });
            }
        }
        return false;
    }

    private boolean evaluate(int handle, IntPredicate positiveSide) {
        return switch (arena.kind(handle)) {
            case TRUE -> true;
            case FALSE -> false;
            case LEAF -> {
                var literal = arena.literal(handle);
                var positive = positiveSide.test(Math.abs(literal));
                yield literal > 0 == positive;
            }
            case NOT -> !evaluate(arena.child(handle, 0), positiveSide);
            case AND -> {
                for (int i = 0; i < arena.childCount(handle); i++) {
                    if (!evaluate(arena.child(handle, i), positiveSide)) {
                        yield false;
                    }
                }
                yield true;
            }
            case OR -> {
                for (int i = 0; i < arena.childCount(handle); i++) {
                    if (evaluate(arena.child(handle, i), positiveSide)) {
                        yield true;
                    }
                }
                yield false;
            }
        };
    }

    private int level(int handle) {
        var kind = arena.kind(handle);
        if (!kind.isOperator()) {
            return 0;
        }
        var deepest = -1;
        var allLeaves = true;
        for (int i = 0; i < arena.childCount(handle); i++) {
            var child = arena.child(handle, i);
            if (arena.kind(child).isOperator()) {
                allLeaves = false;
            }
            deepest = Math.max(deepest, level(child));
        }
        if (kind == NodeKind.AND && allLeaves) {
            return 0;
        }
        return deepest + 1;
    }

    private void surfaces(int handle, SortedSet<Integer> ids) {
        var kind = arena.kind(handle);
        if (kind == NodeKind.LEAF) {
            ids.add(Math.abs(arena.literal(handle)));
        } else if (kind.isOperator()) {
            for (int i = 0; i < arena.childCount(handle); i++) {
                surfaces(arena.child(handle, i), ids);
            }
        }
    }
}
