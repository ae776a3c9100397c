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

import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.bool.CellDefinition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One cell of the conversion: a CAD solid, an enclosure or a generated void, with its cell definition once built.
 * Identities are assigned at load time (voids at generation) and stay fixed; labels are assigned once, by the
 * numbering pass.
 *
 * @param <S> the kernel's solid type
 * @author hal.hildebrand
 */
public class SolidEntity<S> {

    private final S            solid;
    private final boolean      voidCell;
    private final boolean      enclosure;
    private final Set<Integer> enclosures = new LinkedHashSet<>();
    private final int          enclosureId;
    private final int          parentEnclosureId;
    private final VoidOrigin   origin;
    private int                identity;
    private int                label;
    private CellDefinition     definition;
    private boolean            nullCell;
    private String             comment;
    private Box                bounds;

    private SolidEntity(int identity, S solid, boolean voidCell, boolean enclosure, int enclosureId,
                        int parentEnclosureId, VoidOrigin origin, String comment) {
        this.identity = identity;
        this.solid = solid;
        this.voidCell = voidCell;
        this.enclosure = enclosure;
        this.enclosureId = enclosureId;
        this.parentEnclosureId = parentEnclosureId;
        this.origin = origin;
        this.comment = comment == null ? "" : comment;
    }

    /**
     * An enclosure: a solid that bounds a region of the model whose voids are generated separately
     *
     * @param enclosureId       the id solids use to declare membership, positive
     * @param parentEnclosureId the enclosing enclosure, 0 at top level
     */
    public static <S> SolidEntity<S> enclosure(int identity, S solid, int enclosureId, int parentEnclosureId,
                                               String comment) {
        if (enclosureId <= 0) {
            throw new IllegalArgumentException("Enclosure id must be positive: " + enclosureId);
        }
        if (parentEnclosureId < 0 || parentEnclosureId == enclosureId) {
            throw new IllegalArgumentException(
            "Invalid parent enclosure " + parentEnclosureId + " for enclosure " + enclosureId);
        }
        return new SolidEntity<>(identity, solid, false, true, enclosureId, parentEnclosureId, null,
                                 comment);
    }

    public static <S> SolidEntity<S> solid(int identity, S solid, String comment) {
        return new SolidEntity<>(identity, solid, false, false, 0, 0, null, comment);
    }

    /**
     * A generated void cell
     */
    public static <S> SolidEntity<S> voidCell(int identity, CellDefinition definition, Box bounds,
                                              VoidOrigin origin) {
        var entity = new SolidEntity<S>(identity, null, true, false, origin.enclosureId(), 0, origin,
                                        origin.comment());
        entity.definition = definition;
        entity.bounds = bounds;
        return entity;
    }

    /**
     * Declare membership of an enclosure. Membership order is declaration order.
     */
    public SolidEntity<S> addEnclosure(int enclosureId) {
        if (enclosureId <= 0) {
            throw new IllegalArgumentException("Enclosure id must be positive: " + enclosureId);
        }
        enclosures.add(enclosureId);
        return this;
    }

    public Box getBounds() {
        return bounds;
    }

    public String getComment() {
        return comment;
    }

    public CellDefinition getDefinition() {
        return definition;
    }

    /**
     * Enclosure id of an enclosure, or for a void the enclosure it fills; 0 otherwise
     */
    public int getEnclosureId() {
        return enclosureId;
    }

    /**
     * Ids of the enclosures this solid was declared in
     */
    public Set<Integer> getEnclosures() {
        return Collections.unmodifiableSet(enclosures);
    }

    public int getIdentity() {
        return identity;
    }

    /**
     * Final label, 0 until numbered
     */
    public int getLabel() {
        return label;
    }

    public VoidOrigin getOrigin() {
        return origin;
    }

    public int getParentEnclosureId() {
        return parentEnclosureId;
    }

    /**
     * The kernel solid this cell was loaded from
     *
     * @throws IllegalStateException for generated voids
     */
    public S getSolid() {
        if (solid == null) {
            throw new IllegalStateException("Cell " + identity + " has no kernel solid");
        }
        return solid;
    }

    public boolean isEnclosure() {
        return enclosure;
    }

    public boolean isNullCell() {
        return nullCell;
    }

    public boolean isVoid() {
        return voidCell;
    }

    /**
     * Mark the cell as denoting nothing. Null cells are dropped before numbering.
     */
    public void markNull() {
        nullCell = true;
    }

    /**
     * Forget the results of an earlier run: label, definition, bounds and the null mark
     */
    public void reset() {
        label = 0;
        definition = null;
        bounds = null;
        nullCell = false;
    }

    public void setBounds(Box bounds) {
        this.bounds = bounds;
    }

    public void setComment(String comment) {
        this.comment = comment == null ? "" : comment;
    }

    public void setDefinition(CellDefinition definition) {
        this.definition = definition;
    }

    /**
     * Assign the final label
     *
     * @throws IllegalStateException if the cell was already labelled
     */
    public void setLabel(int label) {
        if (this.label != 0) {
            throw new IllegalStateException("Cell " + identity + " already labelled " + this.label);
        }
        if (label <= 0) {
            throw new IllegalArgumentException("Labels are positive: " + label);
        }
        this.label = label;
    }

    /**
     * Replace the identity when models are merged, before any stage refers to it
     */
    public void setIdentity(int identity) {
        if (label != 0) {
            throw new IllegalStateException("Cannot renumber labelled cell " + identity);
        }
        this.identity = identity;
    }

    @Override
    public String toString() {
        var kind = voidCell ? "void" : enclosure ? "enclosure " + enclosureId : "solid";
        return "SolidEntity[" + identity + " " + kind + (label == 0 ? "" : " label " + label) + (nullCell ? " null"
                                                                                                        : "") + "]";
    }
}
