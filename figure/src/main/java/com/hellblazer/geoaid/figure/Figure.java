/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Geo-AID Debugger.
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
package com.hellblazer.geoaid.figure;

import java.util.List;

/**
 * A snapshot of the generated figure. Immutable, so handing the reference to another thread is equivalent to
 * handing over a copy.
 *
 * @param items      the figure's elements, in drawing order
 * @param generation the number of optimizer steps taken to produce this snapshot
 * @param quality    total constraint error of the positions the snapshot was built from; lower is better
 * @author hal.hildebrand
 */
public record Figure(List<FigureItem> items, long generation, double quality) {

    private static final Figure EMPTY = new Figure(List.of(), 0, Double.POSITIVE_INFINITY);

    public Figure {
        items = List.copyOf(items);
    }

    /**
     * The figure held by a session before its first step completes.
     */
    public static Figure empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
