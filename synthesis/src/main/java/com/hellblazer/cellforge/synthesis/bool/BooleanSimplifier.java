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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One pass of table driven boolean reduction. The pass never changes the set a definition denotes within the region
 * the table was built for, and never makes it bigger: a rewrite that would grow the expression is discarded.
 * <p>
 * The pass pushes complements down to the literals, replaces literals whose surface misses the region by constants,
 * prunes literals implied by (or contradicting) their siblings, drops operands that are satisfied or vacuous in the
 * context of their sibling literals, absorbs redundant operands and merges unions of intersections that differ in one
 * complementary literal.
 *
 * @author hal.hildebrand
 */
public class BooleanSimplifier {
    private static final Logger log = LoggerFactory.getLogger(BooleanSimplifier.class);

    /**
     * Complement pushdown only, no table needed
     */
    public void normalize(CellDefinition definition) {
        var before = definition.size();
        var normalized = normalize(definition.arena(), definition.root(), false);
        if (definition.size(normalized) <= before) {
            definition.setRoot(normalized);
        }
        definition.compact();
    }

    /**
     * Simplify the definition in place against the table
     */
    public SimplifyOutcome simplify(CellDefinition definition, ComparisonTable table) {
        var before = definition.size();
        var arena = definition.arena();
        var normalized = normalize(arena, definition.root(), false);
        var reduced = new Pass(arena, table).reduce(normalized);
        if (definition.size(reduced) <= before) {
            definition.setRoot(reduced);
        } else if (definition.size(normalized) <= before) {
            log.trace("Reduction grew {} nodes to {}, keeping normalized form", before, definition.size(reduced));
            definition.setRoot(normalized);
        } else {
            log.trace("Simplification grew {} nodes, keeping original", before);
        }
        definition.compact();
        if (definition.isEmpty()) {
            return SimplifyOutcome.EMPTY;
        }
        if (definition.isUniverse()) {
            return SimplifyOutcome.UNIVERSE;
        }
        return SimplifyOutcome.EXPRESSION;
    }

    private int normalize(ExpressionArena arena, int handle, boolean negate) {
        var kind = arena.kind(handle);
        switch (kind) {
            case LEAF:
                var literal = arena.literal(handle);
                return arena.leaf(negate ? -literal : literal);
            case TRUE:
            case FALSE:
                return arena.constant(kind == NodeKind.TRUE ^ negate);
            case NOT:
                return normalize(arena, arena.child(handle, 0), !negate);
            default:
                var operator = negate ? kind.dual() : kind;
                var operands = new IntArrayList();
                for (int i = 0; i < arena.childCount(handle); i++) {
                    var child = normalize(arena, arena.child(handle, i), negate);
                    if (arena.kind(child) == operator) {
                        for (int j = 0; j < arena.childCount(child); j++) {
                            operands.addInt(arena.child(child, j));
                        }
                    } else {
                        operands.addInt(child);
                    }
                }
                if (operands.size() == 1) {
                    return operands.getInt(0);
                }
                return arena.operator(operator, operands);
        }
    }

    /**
     * The operands of one operator node split into literals and compound operands of the dual kind
     */
    private static final class Operands {
        final List<Integer> literals  = new ArrayList<>();
        final List<Integer> compounds = new ArrayList<>();
    }

    private static final class Pass {
        private final ExpressionArena arena;
        private final ComparisonTable table;

        Pass(ExpressionArena arena, ComparisonTable table) {
            this.arena = arena;
            this.table = table;
        }

        int reduce(int handle) {
            return switch (arena.kind(handle)) {
                case LEAF -> table.constant(arena.literal(handle)).map(arena::constant).orElse(handle);
                case AND -> reduceOperator(handle, true);
                case OR -> reduceOperator(handle, false);
                default -> handle;
            };
        }

        /**
         * Both operators share one routine, the union case being the exact dual of the intersection case
         *
         * @param conjunction true for AND, false for OR
         */
        private int reduceOperator(int handle, boolean conjunction) {
            var self = conjunction ? NodeKind.AND : NodeKind.OR;
            // the absorbing constant of the operator: FALSE for AND, TRUE for OR
            var absorbing = !conjunction;
            var operands = new Operands();
            for (int i = 0; i < arena.childCount(handle); i++) {
                var reduced = reduce(arena.child(handle, i));
                var kind = arena.kind(reduced);
                if (kind == (conjunction ? NodeKind.FALSE : NodeKind.TRUE)) {
                    return arena.constant(absorbing);
                }
                if (kind == NodeKind.TRUE || kind == NodeKind.FALSE) {
                    continue;
                }
                if (!add(reduced, self, operands)) {
                    return arena.constant(absorbing);
                }
            }

            var kept = keep(operands.literals, conjunction);
            if (kept == null) {
                return arena.constant(absorbing);
            }

            // operands that are decided, or literals of them that are decided, given the sibling literals
            var extra = new Operands();
            var compounds = new ArrayList<Integer>();
            for (var compound : operands.compounds) {
                if (satisfiedBy(compound, kept, conjunction)) {
                    continue;
                }
                var filtered = filter(compound, kept, conjunction);
                if (filtered == null) {
                    return arena.constant(absorbing);
                }
                if (arena.kind(filtered) == NodeKind.LEAF || arena.kind(filtered) == self) {
                    if (!add(filtered, self, extra)) {
                        return arena.constant(absorbing);
                    }
                    compounds.addAll(extra.compounds);
                    extra.compounds.clear();
                } else {
                    compounds.add(filtered);
                }
            }
            if (!extra.literals.isEmpty()) {
                var merged = new ArrayList<>(kept);
                merged.addAll(extra.literals);
                kept = keep(merged, conjunction);
                if (kept == null) {
                    return arena.constant(absorbing);
                }
            }

            compounds = absorb(compounds);
            if (!conjunction) {
                compounds = mergeComplementary(compounds, kept);
            }

            var result = new IntArrayList();
            for (var literal : kept) {
                result.addInt(arena.leaf(literal));
            }
            for (var compound : compounds) {
                result.addInt(compound);
            }
            if (result.isEmpty()) {
                return arena.constant(conjunction);
            }
            if (result.size() == 1) {
                return result.getInt(0);
            }
            return arena.operator(self, result);
        }

        /**
         * Drop operands whose literal set contains the literal set of a pure literal sibling. Identical sets keep the
         * first.
         */
        private ArrayList<Integer> absorb(List<Integer> compounds) {
            var sets = new ArrayList<Set<Integer>>();
            var pure = new ArrayList<Boolean>();
            for (var compound : compounds) {
                var literals = new HashSet<Integer>();
                var onlyLiterals = true;
                for (int i = 0; i < arena.childCount(compound); i++) {
                    var child = arena.child(compound, i);
                    if (arena.kind(child) == NodeKind.LEAF) {
                        literals.add(arena.literal(child));
                    } else {
                        onlyLiterals = false;
                    }
                }
                sets.add(literals);
                pure.add(onlyLiterals);
            }
            var result = new ArrayList<Integer>();
            for (int b = 0; b < compounds.size(); b++) {
                var absorbed = false;
                for (int a = 0; a < compounds.size() && !absorbed; a++) {
                    if (a == b || !pure.get(a) || !sets.get(b).containsAll(sets.get(a))) {
                        continue;
                    }
                    var identical = pure.get(b) && sets.get(a).size() == sets.get(b).size();
                    absorbed = !identical || a < b;
                }
                if (!absorbed) {
                    result.add(compounds.get(b));
                }
            }
            return result;
        }

        /**
         * Add a reduced operand, flattening operands of the same kind
         *
         * @return false if the operand is the absorbing constant
         */
        private boolean add(int operand, NodeKind self, Operands operands) {
            var kind = arena.kind(operand);
            if (kind == NodeKind.LEAF) {
                operands.literals.add(arena.literal(operand));
            } else if (kind == self) {
                for (int i = 0; i < arena.childCount(operand); i++) {
                    if (!add(arena.child(operand, i), self, operands)) {
                        return false;
                    }
                }
            } else if (kind == NodeKind.TRUE || kind == NodeKind.FALSE) {
                return (kind == NodeKind.TRUE) == (self == NodeKind.AND);
            } else {
                operands.compounds.add(operand);
            }
            return true;
        }

        /**
         * Remove from a dual operand the literals decided by the context literals.
         *
         * @return the operand, rebuilt if it changed, or null when none of its operands survive
         */
        private Integer filter(int compound, List<Integer> context, boolean conjunction) {
            var survivors = new IntArrayList();
            var count = arena.childCount(compound);
            for (int i = 0; i < count; i++) {
                var child = arena.child(compound, i);
                if (arena.kind(child) == NodeKind.LEAF && decided(arena.literal(child), context, conjunction)) {
                    continue;
                }
                survivors.addInt(child);
            }
            if (survivors.size() == count) {
                return compound;
            }
            if (survivors.isEmpty()) {
                return null;
            }
            if (survivors.size() == 1) {
                return survivors.getInt(0);
            }
            return arena.operator(arena.kind(compound), survivors);
        }

        /**
         * Within an intersection, a literal of a union operand is false where a context literal excludes it. Within a
         * union, a literal of an intersection operand is true wherever the context literals are false.
         */
        private boolean decided(int literal, List<Integer> context, boolean conjunction) {
            for (var k : context) {
                if (conjunction ? table.excludes(k, literal) : table.covers(k, literal)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Literal reduction among the operands of one operator. An intersection keeps the strongest literals, a union
         * the weakest.
         *
         * @return the surviving literals, or null if they decide the operator: a contradiction for an intersection, a
         * tautology for a union
         */
        private List<Integer> keep(List<Integer> literals, boolean conjunction) {
            var kept = new ArrayList<Integer>();
            for (var x : literals) {
                for (var k : kept) {
                    if (k == -x || (conjunction ? table.excludes(k, x) : table.covers(k, x))) {
                        return null;
                    }
                }
                if (conjunction) {
                    if (kept.stream().anyMatch(k -> table.implies(k, x))) {
                        continue;
                    }
                    kept.removeIf(k -> table.implies(x, k));
                } else {
                    if (kept.stream().anyMatch(k -> table.implies(x, k))) {
                        continue;
                    }
                    kept.removeIf(k -> table.implies(k, x));
                }
                kept.add(x);
            }
            return kept;
        }

        /**
         * Merge pairs of pure literal intersections that differ only in one complementary literal:
         * {@code (A x):(A -x)} becomes {@code A}
         */
        private ArrayList<Integer> mergeComplementary(List<Integer> compounds, List<Integer> kept) {
            var consumed = new boolean[compounds.size()];
            var result = new ArrayList<Integer>();
            for (int i = 0; i < compounds.size(); i++) {
                if (consumed[i]) {
                    continue;
                }
                var a = pureLiterals(compounds.get(i));
                var merged = -1;
                for (int j = i + 1; j < compounds.size() && a != null && merged < 0; j++) {
                    if (consumed[j]) {
                        continue;
                    }
                    var b = pureLiterals(compounds.get(j));
                    if (b == null || a.size() != b.size()) {
                        continue;
                    }
                    var common = complementaryCommon(a, b);
                    if (common != null) {
                        consumed[i] = consumed[j] = true;
                        merged = common.size() == 1 ? arena.leaf(common.get(0))
                                                    : arena.and(toList(common));
                    }
                }
                if (merged >= 0) {
                    if (arena.kind(merged) == NodeKind.LEAF && kept.contains(arena.literal(merged))) {
                        continue;
                    }
                    result.add(merged);
                } else {
                    result.add(compounds.get(i));
                }
            }
            return result;
        }

        private List<Integer> complementaryCommon(List<Integer> a, List<Integer> b) {
            Integer pivot = null;
            for (var x : a) {
                if (b.contains(x)) {
                    continue;
                }
                if (pivot != null || !b.contains(-x)) {
                    return null;
                }
                pivot = x;
            }
            if (pivot == null) {
                return null;
            }
            var common = new ArrayList<>(a);
            common.remove(pivot);
            return common.isEmpty() ? null : common;
        }

        private List<Integer> pureLiterals(int compound) {
            if (arena.kind(compound) != NodeKind.AND) {
                return null;
            }
            var literals = new ArrayList<Integer>();
            for (int i = 0; i < arena.childCount(compound); i++) {
                var child = arena.child(compound, i);
                if (arena.kind(child) != NodeKind.LEAF) {
                    return null;
                }
                literals.add(arena.literal(child));
            }
            return literals;
        }

        /**
         * Within an intersection, a union operand is true where one of its literals is implied by a context literal.
         * Within a union, an intersection operand adds nothing where one of its literals implies a context literal.
         */
        private boolean satisfiedBy(int compound, List<Integer> context, boolean conjunction) {
            for (int i = 0; i < arena.childCount(compound); i++) {
                var child = arena.child(compound, i);
                if (arena.kind(child) != NodeKind.LEAF) {
                    continue;
                }
                var y = arena.literal(child);
                for (var k : context) {
                    if (conjunction ? table.implies(k, y) : table.implies(y, k)) {
                        return true;
                    }
                }
            }
            return false;
        }

        private IntArrayList toList(List<Integer> literals) {
            var leaves = new IntArrayList();
            for (var literal : literals) {
                leaves.addInt(arena.leaf(literal));
            }
            return leaves;
        }
    }
}
