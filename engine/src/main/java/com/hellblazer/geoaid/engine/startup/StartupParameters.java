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
package com.hellblazer.geoaid.engine.startup;

import com.hellblazer.geoaid.figure.problem.ProblemDefinition;

import java.util.Objects;

/**
 * Validated inputs for starting a generation session.
 *
 * @author hal.hildebrand
 */
public record StartupParameters(ProblemDefinition problem, int workerCount, double bound) {

    public StartupParameters {
        Objects.requireNonNull(problem, "problem");
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        if (!(bound > 0.0) || !Double.isFinite(bound)) {
            throw new IllegalArgumentException("bound must be a finite positive number: " + bound);
        }
    }
}
