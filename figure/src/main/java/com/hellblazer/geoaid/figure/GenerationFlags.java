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
 * Generation settings read from a problem definition. Shared read-only by the generation worker and the renderer for
 * the lifetime of a session.
 *
 * @param margin     fraction of the viewport kept free on each side when projecting, in [0, 0.5)
 * @param showLabels whether labels are projected
 * @param seed       seed for the optimizer's random proposals
 * @author hal.hildebrand
 */
public record GenerationFlags(double margin, boolean showLabels, long seed) {

    public static final GenerationFlags DEFAULT = new GenerationFlags(0.1, true, 0L);

    public GenerationFlags {
        if (!(margin >= 0.0 && margin < 0.5)) {
            throw new IllegalArgumentException("margin must be in [0, 0.5): " + margin);
        }
    }

    public GenerationFlags withMargin(double margin) {
        return new GenerationFlags(margin, showLabels, seed);
    }

    public GenerationFlags withShowLabels(boolean showLabels) {
        return new GenerationFlags(margin, showLabels, seed);
    }

    public GenerationFlags withSeed(long seed) {
        return new GenerationFlags(margin, showLabels, seed);
    }
}
