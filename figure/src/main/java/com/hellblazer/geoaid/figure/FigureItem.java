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

/**
 * One resolution independent element of a {@link Figure}. Labels are optional; a null or blank label is not
 * displayed.
 *
 * @author hal.hildebrand
 */
public sealed interface FigureItem permits FigureItem.PointItem, FigureItem.LineItem, FigureItem.SegmentItem,
                                           FigureItem.RayItem, FigureItem.CircleItem {

    String label();

    default boolean hasLabel() {
        return label() != null && !label().isBlank();
    }

    /**
     * A point, optionally drawn as a dot.
     */
    record PointItem(Position position, String label, boolean displayDot) implements FigureItem {
    }

    /**
     * The infinite line through {@code a} and {@code b}.
     */
    record LineItem(Position a, Position b, String label) implements FigureItem {
    }

    record SegmentItem(Position a, Position b, String label) implements FigureItem {
    }

    /**
     * The half line starting at {@code origin} and passing through {@code through}.
     */
    record RayItem(Position origin, Position through, String label) implements FigureItem {
    }

    record CircleItem(Position center, double radius, String label) implements FigureItem {
    }
}
