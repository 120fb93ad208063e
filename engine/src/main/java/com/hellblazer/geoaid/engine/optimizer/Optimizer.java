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
package com.hellblazer.geoaid.engine.optimizer;

import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.FigureTemplate;

/**
 * An iterative figure generator. Instances are confined to a single thread: the generation worker that owns them.
 *
 * @author hal.hildebrand
 */
public interface Optimizer extends AutoCloseable {

    /**
     * Compute the per-worker adjustment magnitudes for the given bound. Called once, before the first step.
     *
     * @param bound the maximum adjustment, strictly positive
     */
    Magnitudes precompute(double bound);

    /**
     * Advance the generation by one refinement step.
     */
    void step(Magnitudes magnitudes);

    /**
     * Build a snapshot of the current state.
     */
    Figure materialize(FigureTemplate template);

    /**
     * Release internal resources. The optimizer is unusable afterwards.
     */
    @Override
    void close();
}
