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
package com.hellblazer.cellforge.synthesis.config;

/**
 * Which enclosure a solid belonging to several enclosures is written under when cells are grouped by enclosure.
 *
 * @author hal.hildebrand
 */
public enum EnclosureAttribution {
    /** Smallest nesting depth, ties resolved by the order the memberships were declared */
    OUTERMOST_FIRST,
    /** Largest nesting depth, ties resolved by the order the memberships were declared */
    INNERMOST_FIRST,
    /** The first declared membership */
    FIRST_DECLARED
}
