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
package com.hellblazer.geoaid.figure.problem;

import com.hellblazer.geoaid.figure.FigureTemplate;
import com.hellblazer.geoaid.figure.GenerationFlags;

import javax.vecmath.Point2d;
import java.util.List;

/**
 * A loaded generation problem: the points to place, the constraints they must satisfy and the figure to display.
 *
 * @author hal.hildebrand
 */
public record ProblemDefinition(GenerationFlags flags, List<String> pointNames, List<Constraint> constraints,
                                FigureTemplate template) {

    public ProblemDefinition {
        pointNames = List.copyOf(pointNames);
        constraints = List.copyOf(constraints);
        if (template.maxPointIndex() >= pointNames.size()) {
            throw new IllegalArgumentException("template refers to an undeclared point");
        }
    }

    public int pointCount() {
        return pointNames.size();
    }

    /**
     * Total squared error of all constraints for the given positions.
     */
    public double quality(Point2d[] positions) {
        var total = 0.0;
        for (var constraint : constraints) {
            total += constraint.error(positions);
        }
        return total;
    }
}
