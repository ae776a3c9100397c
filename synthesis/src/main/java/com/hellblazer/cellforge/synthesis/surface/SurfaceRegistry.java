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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntPredicate;

/**
 * Canonical store of the surfaces of one conversion run. Candidates are compared, kind by kind, against the surfaces
 * already kept; a match returns the kept id, otherwise the candidate is kept under the next id. Ids are allocated
 * monotonically starting at offset + 1 and entries are never removed.
 * <p>
 * Tolerant comparison is not transitive. Candidates are only ever compared with kept representatives, so the first
 * surface of a cluster wins and the outcome is well defined, though it depends on registration order.
 * <p>
 * Registration is thread safe: a scan under the read lock, then a re-scan of the entries added since and the append
 * under the write lock, so racing registrations of one surface converge on a single id.
 *
 * @author hal.hildebrand
 */
public class SurfaceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SurfaceRegistry.class);

    private final SurfaceMatcher                                matcher;
    private final int                                           offset;
    private final EnumMap<SurfaceKind, List<RegisteredSurface>> byKind   = new EnumMap<>(SurfaceKind.class);
    private final List<RegisteredSurface>                       surfaces = new ArrayList<>();
    private final ReentrantReadWriteLock                        lock     = new ReentrantReadWriteLock();

    public SurfaceRegistry(Tolerances tolerances) {
        this(tolerances, 0);
    }

    public SurfaceRegistry(Tolerances tolerances, int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Surface offset must not be negative: " + offset);
        }
        this.matcher = new SurfaceMatcher(tolerances);
        this.offset = offset;
        for (var kind : SurfaceKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
    }

    public int count(SurfaceKind kind) {
        lock.readLock().lock();
        try {
            return byKind.get(kind).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Look up a surface without registering it
     *
     * @return the signed id as {@link #register(Surface)} would return it, if a kept surface matches
     */
    public Optional<Integer> find(Surface candidate) {
        lock.readLock().lock();
        try {
            var found = scan(candidate, byKind.get(candidate.kind()), 0);
            return found == 0 ? Optional.empty() : Optional.of(found);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param id surface id, the sign is ignored
     * @throws IllegalArgumentException if no surface has this id
     */
    public RegisteredSurface get(int id) {
        var index = Math.abs(id) - offset - 1;
        lock.readLock().lock();
        try {
            if (index < 0 || index >= surfaces.size()) {
                throw new IllegalArgumentException("Unknown surface id: " + id);
            }
            return surfaces.get(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The geometric half-space a signed reference denotes
     */
    public HalfSpace halfSpace(int literal) {
        return new HalfSpace(get(literal).surface(), literal > 0 ? 1 : -1);
    }

    public int offset() {
        return offset;
    }

    /**
     * Register a surface.
     *
     * @return the id of the kept surface, negated when the candidate is a kept plane with its normal reversed, so
     * that the candidate's positive side is always denoted by the returned value
     */
    public int register(Surface candidate) {
        var kind = candidate.kind();
        int scanned;
        lock.readLock().lock();
        try {
            var kept = byKind.get(kind);
            var found = scan(candidate, kept, 0);
            if (found != 0) {
                return found;
            }
            scanned = kept.size();
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            var kept = byKind.get(kind);
            var found = scan(candidate, kept, scanned);
            if (found != 0) {
                return found;
            }
            var registered = new RegisteredSurface(offset + surfaces.size() + 1, candidate);
            kept.add(registered);
            surfaces.add(registered);
            log.trace("Registered surface {}: {}", registered.id(), candidate);
            return registered.id();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Which side of each surface the point lies on, as consumed by {@code CellDefinition.evaluate}
     */
    public IntPredicate sideOf(Point3d point) {
        return id -> get(id).surface().evaluate(point) > 0;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return surfaces.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All surfaces in id order
     */
    public List<RegisteredSurface> surfaces() {
        lock.readLock().lock();
        try {
            return List.copyOf(surfaces);
        } finally {
            lock.readLock().unlock();
        }
    }

    private int scan(Surface candidate, List<RegisteredSurface> kept, int from) {
        for (int i = from; i < kept.size(); i++) {
            var existing = kept.get(i);
            var match = matcher.match(candidate, existing.surface());
            if (match != SurfaceMatcher.DIFFERENT) {
                return match * existing.id();
            }
        }
        return 0;
    }
}
