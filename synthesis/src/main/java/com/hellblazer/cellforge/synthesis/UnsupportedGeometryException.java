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

/**
 * Input the engine refuses to convert at all. Raised before any cell is built.
 *
 * @author hal.hildebrand
 */
public class UnsupportedGeometryException extends RuntimeException {

    private final Reason reason;
    private final int    identity;

    public UnsupportedGeometryException(Reason reason, int identity, String message) {
        super(message);
        this.reason = reason;
        this.identity = identity;
    }

    public int getIdentity() {
        return identity;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        /** An enclosure is bounded by surfaces the engine cannot model */
        UNSUPPORTED_SURFACE_IN_ENCLOSURE,
        /** A solid is bounded by surfaces the engine cannot model, and the run is set to stop on them */
        UNSUPPORTED_SURFACE_IN_SOLID
    }
}
