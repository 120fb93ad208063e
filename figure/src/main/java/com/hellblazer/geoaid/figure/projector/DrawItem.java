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
package com.hellblazer.geoaid.figure.projector;

/**
 * Screen space projection of one figure element. Built fresh every frame and never cached.
 * <p>
 * {@link #label()} is null when the element has no label or labels are disabled.
 *
 * @author hal.hildebrand
 */
public sealed interface DrawItem permits DrawItem.DrawPoint, DrawItem.DrawLine, DrawItem.DrawSegment,
                                         DrawItem.DrawRay, DrawItem.DrawCircle {

    Label label();

    /**
     * Text anchored at a screen position (baseline left).
     */
    record Label(String content, ScreenPoint position) {
    }

    record DrawPoint(ScreenPoint position, boolean displayDot, Label label) implements DrawItem {
    }

    /**
     * An infinite line, already clipped to the two points where it meets the viewport boundary.
     */
    record DrawLine(ScreenPoint a, ScreenPoint b, Label label) implements DrawItem {
    }

    record DrawSegment(ScreenPoint a, ScreenPoint b, Label label) implements DrawItem {
    }

    /**
     * A ray from its origin to the point where it leaves the viewport.
     */
    record DrawRay(ScreenPoint origin, ScreenPoint end, Label label) implements DrawItem {
    }

    record DrawCircle(ScreenPoint center, double radius, Label label) implements DrawItem {
    }
}
